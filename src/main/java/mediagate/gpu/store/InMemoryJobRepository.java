package mediagate.gpu.store;

import mediagate.gpu.model.Job;
import mediagate.gpu.model.JobState;
import mediagate.gpu.repository.JobRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-lifetime job store. State is lost on restart.
 */
public class InMemoryJobRepository implements JobRepository {

    private static final Comparator<Job> BY_SUBMISSION = Comparator
            .comparing(Job::submittedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Job::id);

    private final ConcurrentHashMap<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public void save(Job job) {
        Job previous = jobs.putIfAbsent(job.id(), job);
        if (previous != null) {
            throw new IllegalArgumentException("job " + job.id() + " already exists");
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public Optional<Job> transition(String jobId, Set<JobState> expected, UnaryOperator<Job> update) {
        Job[] result = new Job[1];
        jobs.computeIfPresent(jobId, (id, current) -> {
            if (!expected.contains(current.state())) {
                return current;
            }
            Job next = update.apply(current);
            result[0] = next;
            return next;
        });
        return Optional.ofNullable(result[0]);
    }

    @Override
    public List<Job> findByState(JobState state, int limit) {
        return jobs.values().stream()
                .filter(j -> j.state() == state)
                .sorted(BY_SUBMISSION)
                .limit(limit)
                .toList();
    }

    @Override
    public int countByState(JobState state) {
        return (int) jobs.values().stream().filter(j -> j.state() == state).count();
    }

    @Override
    public int pruneTerminal(int keep) {
        List<Job> terminal = jobs.values().stream()
                .filter(Job::isTerminal)
                .sorted(Comparator.comparing((Job j) -> j.finishedAt() == null ? Instant.MIN : j.finishedAt())
                        .reversed())
                .toList();
        int removed = 0;
        for (int i = keep; i < terminal.size(); i++) {
            if (jobs.remove(terminal.get(i).id(), terminal.get(i))) {
                removed++;
            }
        }
        return removed;
    }
}
