package mediagate.gpu.maintenance;

import mediagate.gpu.config.GatewayConfig;
import mediagate.gpu.error.QueueTimeoutException;
import mediagate.gpu.model.Job;
import mediagate.gpu.model.JobState;
import mediagate.gpu.queue.PriorityJobQueue;
import mediagate.gpu.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Background task that fails jobs which waited in the queue longer than
 * the configured limit, and prunes old finished jobs from the store.
 *
 * Waiting time counts from the latest enqueue, so a job displaced by
 * failover starts a fresh wait.
 */
public class QueueTimeoutReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(QueueTimeoutReaper.class);

    static final int KEEP_FINISHED_JOBS = 10_000;

    private final PriorityJobQueue queue;
    private final JobRepository jobs;
    private final GatewayConfig config;
    private final Clock clock;

    public QueueTimeoutReaper(PriorityJobQueue queue, JobRepository jobs, GatewayConfig config) {
        this.queue = queue;
        this.jobs = jobs;
        this.config = config;
        this.clock = config.clock();
    }

    @Override
    public void run() {
        try {
            reapExpired();
            int pruned = jobs.pruneTerminal(KEEP_FINISHED_JOBS);
            if (pruned > 0) {
                log.debug("Pruned {} finished jobs", pruned);
            }
        } catch (Exception e) {
            log.error("Queue timeout reaper error", e);
        }
    }

    /**
     * Fail every queued job past its deadline.
     *
     * @return number of jobs failed
     */
    public int reapExpired() {
        Instant now = clock.instant();
        Duration limit = config.maxQueueWait();
        List<Job> expired = queue.enqueuedBefore(now.minus(limit));
        if (expired.isEmpty()) {
            return 0;
        }

        int failed = 0;
        for (Job job : expired) {
            try {
                QueueTimeoutException timeout = new QueueTimeoutException(job.id(),
                        Duration.between(job.enqueuedAt(), now), limit);
                boolean changed = jobs.transition(job.id(), EnumSet.of(JobState.QUEUED), j -> j.toBuilder()
                        .state(JobState.FAILED)
                        .errorMessage(timeout.getMessage())
                        .finishedAt(now)
                        .build()).isPresent();
                queue.remove(job.id());
                if (changed) {
                    failed++;
                    log.warn("Job {} failed: {}", job.id(), timeout.getMessage());
                }
            } catch (Exception e) {
                log.error("Failed to reap job {}", job.id(), e);
            }
        }
        return failed;
    }
}
