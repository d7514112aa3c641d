package mediagate.gpu.queue;

import mediagate.gpu.model.Job;
import mediagate.gpu.model.PriorityTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.ToIntFunction;

/**
 * Multi-tier FIFO queue of jobs waiting for capacity.
 *
 * Tiers are scanned in {@link PriorityTier} declaration order and the head
 * of the first non-empty tier wins. Lower tiers can starve under sustained
 * higher-tier load.
 */
public class PriorityJobQueue {

    private static final Logger log = LoggerFactory.getLogger(PriorityJobQueue.class);

    private final EnumMap<PriorityTier, ArrayDeque<Job>> tiers = new EnumMap<>(PriorityTier.class);
    private final Map<String, PriorityTier> index = new HashMap<>();
    private final ToIntFunction<PriorityTier> capacity;

    /**
     * @param capacity maximum number of jobs per tier
     */
    public PriorityJobQueue(ToIntFunction<PriorityTier> capacity) {
        this.capacity = capacity;
        for (PriorityTier tier : PriorityTier.values()) {
            tiers.put(tier, new ArrayDeque<>());
        }
    }

    /**
     * Append a job to the tail of its tier.
     *
     * @return false if the tier is full
     */
    public synchronized boolean enqueue(Job job) {
        if (index.containsKey(job.id())) {
            throw new IllegalStateException("job " + job.id() + " is already queued");
        }
        ArrayDeque<Job> q = tiers.get(job.tier());
        if (q.size() >= capacity.applyAsInt(job.tier())) {
            log.warn("Queue tier {} full ({} jobs), rejecting job {}", job.tier(), q.size(), job.id());
            return false;
        }
        q.addLast(job);
        index.put(job.id(), job.tier());
        return true;
    }

    /**
     * Put a displaced job back at the head of its tier. Ignores the tier
     * capacity so that failover never drops work. A job that is still
     * queued moves to the head instead of being added twice.
     */
    public synchronized void requeueFront(Job job) {
        if (index.containsKey(job.id())) {
            log.debug("Job {} still queued, moving it to the head of its tier", job.id());
            remove(job.id());
        }
        tiers.get(job.tier()).addFirst(job);
        index.put(job.id(), job.tier());
    }

    /** Pop the head of the highest non-empty tier */
    public synchronized Optional<Job> dequeue() {
        for (ArrayDeque<Job> q : tiers.values()) {
            Job head = q.pollFirst();
            if (head != null) {
                index.remove(head.id());
                return Optional.of(head);
            }
        }
        return Optional.empty();
    }

    public synchronized boolean remove(String jobId) {
        PriorityTier tier = index.remove(jobId);
        if (tier == null) {
            return false;
        }
        Iterator<Job> it = tiers.get(tier).iterator();
        while (it.hasNext()) {
            if (it.next().id().equals(jobId)) {
                it.remove();
                return true;
            }
        }
        return true;
    }

    public synchronized boolean contains(String jobId) {
        return index.containsKey(jobId);
    }

    /** The first {@code limit} jobs of a tier, head first */
    public synchronized List<Job> peek(PriorityTier tier, int limit) {
        List<Job> out = new ArrayList<>(Math.min(limit, tiers.get(tier).size()));
        for (Job job : tiers.get(tier)) {
            if (out.size() >= limit) {
                break;
            }
            out.add(job);
        }
        return out;
    }

    /** Zero-based position in overall dequeue order */
    public synchronized OptionalInt position(String jobId) {
        PriorityTier tier = index.get(jobId);
        if (tier == null) {
            return OptionalInt.empty();
        }
        int pos = 0;
        for (Map.Entry<PriorityTier, ArrayDeque<Job>> e : tiers.entrySet()) {
            if (e.getKey() != tier) {
                pos += e.getValue().size();
                continue;
            }
            for (Job job : e.getValue()) {
                if (job.id().equals(jobId)) {
                    return OptionalInt.of(pos);
                }
                pos++;
            }
        }
        return OptionalInt.empty();
    }

    /** Jobs enqueued strictly before the cutoff */
    public synchronized List<Job> enqueuedBefore(Instant cutoff) {
        List<Job> out = new ArrayList<>();
        for (ArrayDeque<Job> q : tiers.values()) {
            for (Job job : q) {
                if (job.enqueuedAt() != null && job.enqueuedAt().isBefore(cutoff)) {
                    out.add(job);
                }
            }
        }
        return out;
    }

    public synchronized int depth(PriorityTier tier) {
        return tiers.get(tier).size();
    }

    public synchronized Map<PriorityTier, Integer> depths() {
        EnumMap<PriorityTier, Integer> out = new EnumMap<>(PriorityTier.class);
        tiers.forEach((tier, q) -> out.put(tier, q.size()));
        return Collections.unmodifiableMap(out);
    }

    public synchronized int size() {
        return index.size();
    }

    public synchronized boolean isEmpty() {
        return index.isEmpty();
    }

    /** Remove and return everything, in dequeue order */
    public synchronized List<Job> clear() {
        List<Job> out = new ArrayList<>(index.size());
        tiers.values().forEach(q -> {
            out.addAll(q);
            q.clear();
        });
        index.clear();
        return out;
    }
}
