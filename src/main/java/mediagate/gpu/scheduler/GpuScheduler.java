package mediagate.gpu.scheduler;

import mediagate.gpu.config.GatewayConfig;
import mediagate.gpu.error.InsufficientCapacityException;
import mediagate.gpu.error.UnknownDeviceException;
import mediagate.gpu.eviction.VramEstimator;
import mediagate.gpu.eviction.VramOptimizer;
import mediagate.gpu.ledger.AllocationLedger;
import mediagate.gpu.ledger.DeviceCapacity;
import mediagate.gpu.model.CancelResult;
import mediagate.gpu.model.CompleteResult;
import mediagate.gpu.model.Device;
import mediagate.gpu.model.DeviceStatus;
import mediagate.gpu.model.Job;
import mediagate.gpu.model.JobKind;
import mediagate.gpu.model.JobPayload;
import mediagate.gpu.model.JobState;
import mediagate.gpu.model.PriorityTier;
import mediagate.gpu.model.Reservation;
import mediagate.gpu.queue.PriorityJobQueue;
import mediagate.gpu.registry.DeviceHealthListener;
import mediagate.gpu.registry.DeviceRegistry;
import mediagate.gpu.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Admits jobs onto devices, queues what does not fit and drains the queue
 * whenever capacity comes back.
 *
 * Reservation, the QUEUED to ADMITTED transition and removal from the
 * queue happen in one ledger critical section, so a job is ADMITTED exactly
 * while it holds a reservation and is never both queued and admitted.
 * Dispatch to the executor happens after every lock is released.
 */
public class GpuScheduler implements DeviceHealthListener {

    private static final Logger log = LoggerFactory.getLogger(GpuScheduler.class);

    private static final Set<JobState> QUEUED_ONLY = EnumSet.of(JobState.QUEUED);
    private static final Set<JobState> ADMITTED_ONLY = EnumSet.of(JobState.ADMITTED);
    private static final Set<JobState> HOLDING = EnumSet.of(JobState.ADMITTED, JobState.RUNNING);

    private final GatewayConfig config;
    private final DeviceRegistry registry;
    private final AllocationLedger ledger;
    private final PriorityJobQueue queue;
    private final VramOptimizer optimizer;
    private final VramEstimator estimator;
    private final JobRepository jobs;
    private final JobDispatcher dispatcher;
    private final Clock clock;

    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean drainRequested = new AtomicBoolean();

    // mean run time of finished jobs, for wait estimates
    private final Object runStatsLock = new Object();
    private long finishedRuns;
    private Duration meanRunTime = Duration.ZERO;

    public GpuScheduler(GatewayConfig config, DeviceRegistry registry, AllocationLedger ledger,
            PriorityJobQueue queue, VramOptimizer optimizer, VramEstimator estimator,
            JobRepository jobs, JobDispatcher dispatcher) {
        this.config = config;
        this.registry = registry;
        this.ledger = ledger;
        this.queue = queue;
        this.optimizer = optimizer;
        this.estimator = estimator;
        this.jobs = jobs;
        this.dispatcher = dispatcher;
        this.clock = config.clock();
    }

    public static String newJobId() {
        return "job-" + UUID.randomUUID().toString().substring(0, 13);
    }

    // ---- submission ----

    /**
     * Submit a new job.
     *
     * @param vramEstimate bytes, or 0 to let the estimator decide
     * @return the job id
     */
    public String submit(JobKind kind, JobPayload payload, long vramEstimate, PriorityTier tier) {
        Job job = Job.builder()
                .id(newJobId())
                .kind(kind)
                .payload(payload)
                .vramEstimate(vramEstimate)
                .tier(tier)
                .build();
        return submit(job).id();
    }

    /**
     * Submit a job built by the caller. Submission never waits for capacity:
     * the job is admitted right away, queued, or failed with a reason
     * visible through {@link #status}.
     *
     * @return the job as stored after submission
     * @throws IllegalArgumentException on malformed input
     */
    public Job submit(Job request) {
        if (request.id() == null || request.id().isBlank()) {
            throw new IllegalArgumentException("id is required");
        }
        if (request.kind() == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (request.vramEstimate() < 0) {
            throw new IllegalArgumentException("vramEstimate must be non-negative");
        }
        if (request.payload() != null) {
            request.payload().validate();
        }

        long estimate = request.vramEstimate() > 0
                ? request.vramEstimate()
                : estimator.estimate(request.kind(), request.payload());
        Instant now = clock.instant();
        Job job = request.toBuilder()
                .vramEstimate(estimate)
                .tier(request.tier() == null ? PriorityTier.NORMAL : request.tier())
                .state(JobState.QUEUED)
                .deviceId(null)
                .admissions(0)
                .errorMessage(null)
                .submittedAt(now)
                .enqueuedAt(now)
                .startedAt(null)
                .finishedAt(null)
                .build();
        jobs.save(job);
        log.info("Job {} submitted ({}, {}, {} bytes)", job.id(), job.kind(), job.tier(), estimate);

        long largest = registry.listDevices().stream().mapToLong(Device::totalVram).max().orElse(0)
                - ledger.headroomBytes();
        if (estimate > largest) {
            failQueued(job.id(), "job needs " + estimate + " bytes, more than any device offers (" + largest + ")");
            return current(job);
        }

        if (!waitingAtOrAbove(job.tier()) && admitAndStart(job)) {
            return current(job);
        }

        if (!queue.enqueue(job)) {
            failQueued(job.id(), "queue full");
            return current(job);
        }
        log.debug("Job {} queued in tier {}", job.id(), job.tier());
        drain();
        return current(job);
    }

    // ---- admission ----

    /**
     * Reserve capacity for a QUEUED job and move it to ADMITTED. Tries an
     * eviction once when no device has room, and retries when a concurrent
     * admission takes the chosen device first.
     *
     * @return the device the job was admitted to, or empty if it must wait
     */
    public Optional<Integer> admit(Job job) {
        List<Integer> preferred = config.preferredDevices(job.kind());
        boolean evictionTried = false;
        int attempts = 0;
        while (attempts < config.maxAdmissionAttempts()) {
            List<Device> devices = registry.listDevices();
            Map<Integer, DeviceCapacity> capacity = ledger.snapshot();
            Optional<Integer> choice = AdmissionPolicy.select(job.vramEstimate(), devices, capacity, preferred);

            if (choice.isEmpty()) {
                if (evictionTried || !evictFor(job, devices, capacity)) {
                    if (AdmissionPolicy.onlyQuarantinedDevicesFit(job.vramEstimate(), devices, capacity)) {
                        log.debug("Job {} only fits on quarantined devices", job.id());
                    }
                    return Optional.empty();
                }
                evictionTried = true;
                continue;
            }

            attempts++;
            int deviceId = choice.get();
            try {
                Optional<Job> claimed = ledger.atomically(() -> reserveAndClaim(job, deviceId));
                if (claimed.isEmpty()) {
                    log.debug("Job {} left QUEUED before admission completed", job.id());
                    return Optional.empty();
                }
                log.info("Job {} admitted to device {} ({} bytes)", job.id(), deviceId, job.vramEstimate());
                return Optional.of(deviceId);
            } catch (InsufficientCapacityException e) {
                log.debug("Admission of job {} lost a race on device {}: {}", job.id(), deviceId, e.getMessage());
            } catch (UnknownDeviceException e) {
                log.debug("Device {} removed while admitting job {}", deviceId, job.id());
            }
        }
        return Optional.empty();
    }

    private boolean evictFor(Job job, List<Device> devices, Map<Integer, DeviceCapacity> capacity) {
        List<Integer> candidates = new ArrayList<>();
        for (Device d : devices) {
            DeviceCapacity c = capacity.get(d.id());
            if (d.isHealthy() && c != null && c.open() && c.totalBytes() >= job.vramEstimate()) {
                candidates.add(d.id());
            }
        }
        try {
            Optional<Integer> target = optimizer.pickEvictionTarget(candidates, job.vramEstimate());
            return target.isPresent() && optimizer.tryFreeCapacity(target.get(), job.vramEstimate());
        } catch (UnknownDeviceException e) {
            log.debug("Eviction for job {} skipped: {}", job.id(), e.getMessage());
            return false;
        }
    }

    // runs under the ledger lock; failover takes the same lock before requeueing
    private Optional<Job> reserveAndClaim(Job job, int deviceId) {
        ledger.tryReserve(deviceId, job.id(), job.vramEstimate(), job.tier());
        Optional<Job> claimed = jobs.transition(job.id(), QUEUED_ONLY, j -> j.toBuilder()
                .state(JobState.ADMITTED)
                .deviceId(deviceId)
                .admissions(j.admissions() + 1)
                .build());
        if (claimed.isEmpty()) {
            ledger.release(job.id());
        } else {
            queue.remove(job.id());
        }
        return claimed;
    }

    private boolean admitAndStart(Job job) {
        Optional<Integer> device = admit(job);
        device.ifPresent(id -> start(job.id(), id));
        return device.isPresent();
    }

    private void start(String jobId, int deviceId) {
        Optional<Job> running = jobs.transition(jobId, ADMITTED_ONLY, j -> j.toBuilder()
                .state(JobState.RUNNING)
                .startedAt(clock.instant())
                .build());
        if (running.isEmpty()) {
            log.debug("Job {} no longer ADMITTED, not dispatching", jobId);
            return;
        }
        Job job = running.get();
        optimizer.touch(deviceId, job.modelName());
        try {
            dispatcher.dispatch(job, deviceId);
        } catch (RuntimeException e) {
            log.error("Dispatch of job {} to device {} failed", jobId, deviceId, e);
            complete(jobId, false, "dispatch failed: " + e.getMessage());
        }
    }

    // ---- queue draining ----

    /**
     * Admit queued jobs until nothing more fits. Tiers are served in
     * priority order; within a tier a job that does not fit is skipped but
     * keeps its place, up to the configured skip limit. Concurrent callers
     * coalesce into the drain already running.
     *
     * @return number of jobs admitted by this call
     */
    public int drain() {
        int admitted = 0;
        drainRequested.set(true);
        while (drainRequested.get() && draining.compareAndSet(false, true)) {
            try {
                drainRequested.set(false);
                admitted += drainPass();
            } finally {
                draining.set(false);
            }
        }
        return admitted;
    }

    private int drainPass() {
        int admitted = 0;
        for (PriorityTier tier : PriorityTier.values()) {
            boolean progress = true;
            while (progress) {
                progress = false;
                for (Job queued : queue.peek(tier, config.drainSkipLimit())) {
                    Optional<Job> current = jobs.findById(queued.id());
                    if (current.isEmpty() || current.get().state() != JobState.QUEUED) {
                        queue.remove(queued.id());
                        progress = true;
                        break;
                    }
                    Optional<Integer> device = admit(current.get());
                    if (device.isPresent()) {
                        start(queued.id(), device.get());
                        admitted++;
                        progress = true;
                        break;
                    }
                }
            }
        }
        if (admitted > 0) {
            log.debug("Drain admitted {} job(s), {} still queued", admitted, queue.size());
        }
        return admitted;
    }

    private boolean waitingAtOrAbove(PriorityTier tier) {
        for (Map.Entry<PriorityTier, Integer> e : queue.depths().entrySet()) {
            if (e.getKey().ordinal() <= tier.ordinal() && e.getValue() > 0) {
                return true;
            }
        }
        return false;
    }

    // ---- job lifecycle ----

    /**
     * Cancel a job. Queued jobs leave the queue; admitted or running jobs
     * release their capacity immediately and the executor is asked to stop.
     */
    public CancelResult cancel(String jobId) {
        while (true) {
            Optional<Job> current = jobs.findById(jobId);
            if (current.isEmpty()) {
                return CancelResult.NOT_FOUND;
            }
            Job job = current.get();
            if (job.isTerminal()) {
                return CancelResult.ALREADY_TERMINAL;
            }
            Instant now = clock.instant();
            if (job.state() == JobState.QUEUED) {
                if (jobs.transition(jobId, QUEUED_ONLY, j -> finish(j, JobState.CANCELLED, null, now)).isPresent()) {
                    queue.remove(jobId);
                    log.info("Job {} cancelled while queued", jobId);
                    return CancelResult.CANCELLED_QUEUED;
                }
            } else if (jobs.transition(jobId, HOLDING, j -> finish(j, JobState.CANCELLED, null, now)).isPresent()) {
                ledger.release(jobId);
                dispatcher.stop(jobId);
                log.info("Job {} cancelled on device {}", jobId, job.deviceId());
                drain();
                return CancelResult.CANCELLED_RUNNING;
            }
        }
    }

    /** Executor callback for a successful or failed run */
    public CompleteResult complete(String jobId, boolean success) {
        return complete(jobId, success, null);
    }

    /**
     * Executor callback. Records the outcome, releases the reservation and
     * drains the queue. Repeated callbacks are answered without side effects.
     */
    public CompleteResult complete(String jobId, boolean success, String error) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId is required");
        }
        Optional<Job> current = jobs.findById(jobId);
        if (current.isEmpty()) {
            return CompleteResult.NOT_FOUND;
        }

        JobState target = success ? JobState.COMPLETED : JobState.FAILED;
        String reason = success ? null : (error == null || error.isBlank() ? "execution failed" : error);
        Instant now = clock.instant();
        Optional<Job> done = jobs.transition(jobId, HOLDING, j -> finish(j, target, reason, now));
        if (done.isEmpty()) {
            Job latest = jobs.findById(jobId).orElse(current.get());
            CompleteResult res = latest.isTerminal() ? CompleteResult.ALREADY_TERMINAL : CompleteResult.NOT_RUNNING;
            log.debug("Completion of job {} ignored: {}", jobId, res);
            return res;
        }

        ledger.release(jobId);
        recordRunTime(done.get());
        if (success) {
            log.info("Job {} completed on device {}", jobId, done.get().deviceId());
        } else {
            log.warn("Job {} failed on device {}: {}", jobId, done.get().deviceId(), reason);
        }
        drain();
        return success ? CompleteResult.COMPLETED : CompleteResult.FAILED;
    }

    /**
     * Operator override: fail a job and drop its reservation regardless of
     * what the executor reports.
     *
     * @return true if a reservation was released
     */
    public boolean forceRelease(String jobId) {
        Instant now = clock.instant();
        Optional<Job> failed = jobs.transition(jobId, HOLDING,
                j -> finish(j, JobState.FAILED, "force released by operator", now));
        Optional<Reservation> released = ledger.release(jobId);
        failed.ifPresent(j -> dispatcher.stop(jobId));
        if (released.isEmpty()) {
            return false;
        }
        log.warn("Force released {} bytes on device {} held by job {}",
                released.get().vramBytes(), released.get().deviceId(), jobId);
        drain();
        return true;
    }

    private void failQueued(String jobId, String reason) {
        Instant now = clock.instant();
        jobs.transition(jobId, QUEUED_ONLY, j -> finish(j, JobState.FAILED, reason, now))
                .ifPresent(j -> log.warn("Job {} failed: {}", jobId, reason));
    }

    private void recordRunTime(Job job) {
        if (job.startedAt() == null || job.finishedAt() == null) {
            return;
        }
        Duration run = Duration.between(job.startedAt(), job.finishedAt());
        synchronized (runStatsLock) {
            finishedRuns++;
            meanRunTime = meanRunTime.plus(run.minus(meanRunTime).dividedBy(finishedRuns));
        }
    }

    private static Job finish(Job job, JobState state, String error, Instant at) {
        return job.toBuilder().state(state).errorMessage(error).finishedAt(at).build();
    }

    private Job current(Job job) {
        return jobs.findById(job.id()).orElse(job);
    }

    // ---- device health ----

    /**
     * Close a device and requeue every job that held capacity on it, ahead
     * of the jobs already waiting, oldest reservation first.
     *
     * @return number of jobs requeued
     */
    public int failover(int deviceId) {
        List<Reservation> released = ledger.closeDevice(deviceId);
        int requeued = 0;
        for (int i = released.size() - 1; i >= 0; i--) {
            Reservation r = released.get(i);
            Instant now = clock.instant();
            Optional<Job> job = jobs.transition(r.jobId(), HOLDING, j -> j.toBuilder()
                    .state(JobState.QUEUED)
                    .deviceId(null)
                    .startedAt(null)
                    .enqueuedAt(now)
                    .build());
            if (job.isEmpty()) {
                continue;
            }
            try {
                queue.requeueFront(job.get());
                requeued++;
            } catch (RuntimeException e) {
                log.error("Could not requeue job {} displaced from device {}", r.jobId(), deviceId, e);
                failQueued(r.jobId(), "requeue after failover failed: " + e.getMessage());
            }
            try {
                dispatcher.stop(r.jobId());
            } catch (RuntimeException e) {
                log.error("Stop of job {} displaced from device {} failed", r.jobId(), deviceId, e);
            }
        }
        if (requeued > 0) {
            log.warn("Failover of device {}: {} job(s) requeued", deviceId, requeued);
            drain();
        }
        return requeued;
    }

    @Override
    public void onDeviceUnhealthy(int deviceId, String reason) {
        failover(deviceId);
    }

    @Override
    public void onDeviceHealthy(int deviceId) {
        ledger.openDevice(deviceId);
        log.info("Device {} open for admission", deviceId);
        drain();
    }

    /**
     * Take a device out of the inventory. Jobs holding capacity on it are
     * requeued as on failover before the device is forgotten.
     *
     * @return false if the device was not registered
     */
    public boolean removeDevice(int deviceId) {
        if (!registry.contains(deviceId)) {
            return false;
        }
        int held = ledger.reservationsOn(deviceId).size();
        failover(deviceId);
        List<Reservation> leftover = ledger.removeDevice(deviceId);
        if (!leftover.isEmpty()) {
            log.error("Device {} removed with {} reservation(s) still held", deviceId, leftover.size());
        }
        optimizer.forgetDevice(deviceId);
        registry.deregister(deviceId);
        log.info("Device {} removed ({} job(s) displaced)", deviceId, held);
        return true;
    }

    /** Operator quarantine; never lifted by health checks */
    public boolean quarantineDevice(int deviceId, String reason) {
        requireDevice(deviceId);
        return registry.quarantine(deviceId, reason == null || reason.isBlank() ? "operator quarantine" : reason);
    }

    public boolean restoreDevice(int deviceId) {
        requireDevice(deviceId);
        return registry.restore(deviceId);
    }

    private void requireDevice(int deviceId) {
        if (!registry.contains(deviceId)) {
            throw new UnknownDeviceException(deviceId);
        }
    }

    // ---- queries ----

    public Optional<Job> status(String jobId) {
        return jobs.findById(jobId);
    }

    /** Zero-based place of a queued job in dispatch order */
    public OptionalInt queuePosition(String jobId) {
        return queue.position(jobId);
    }

    /**
     * Rough time until a queued job starts: the mean run time of finished
     * jobs for every round of running jobs ahead of it.
     *
     * @return empty if the job is not queued or no job has finished yet
     */
    public Optional<Duration> estimatedWait(String jobId) {
        OptionalInt position = queue.position(jobId);
        if (position.isEmpty()) {
            return Optional.empty();
        }
        Duration mean;
        synchronized (runStatsLock) {
            if (finishedRuns == 0) {
                return Optional.empty();
            }
            mean = meanRunTime;
        }
        int slots = Math.max(1, runningJobs());
        int rounds = position.getAsInt() / slots + 1;
        return Optional.of(mean.multipliedBy(rounds));
    }

    public Map<PriorityTier, Integer> queueDepths() {
        return queue.depths();
    }

    public int queueSize() {
        return queue.size();
    }

    public List<DeviceStatus> deviceTable() {
        Map<Integer, DeviceCapacity> capacity = ledger.snapshot();
        List<DeviceStatus> out = new ArrayList<>();
        for (Device d : registry.listDevices()) {
            out.add(new DeviceStatus(d, capacity.get(d.id()), optimizer.loadedModels(d.id())));
        }
        return out;
    }

    public int runningJobs() {
        return ledger.activeReservations().size();
    }

    /**
     * Log every reservation and queued job that is lost with the process.
     *
     * @return number of reservations still active
     */
    public int shutdown() {
        List<Reservation> active = ledger.activeReservations();
        for (Reservation r : active) {
            log.warn("Reservation of job {} ({} bytes on device {}) lost at shutdown",
                    r.jobId(), r.vramBytes(), r.deviceId());
        }
        List<Job> dropped = queue.clear();
        if (!dropped.isEmpty()) {
            log.warn("{} queued job(s) dropped at shutdown", dropped.size());
        }
        return active.size();
    }
}
