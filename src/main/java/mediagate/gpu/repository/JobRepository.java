package mediagate.gpu.repository;

import mediagate.gpu.model.Job;
import mediagate.gpu.model.JobState;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Repository interface for job state.
 * All state changes go through {@link #transition} so that concurrent
 * callers (completion callbacks, cancellation, failover, queue reaper)
 * observe a single winner per transition.
 */
public interface JobRepository {

    /**
     * Save a new job.
     *
     * @param job the job to save
     * @throws IllegalArgumentException if a job with the same ID exists
     */
    void save(Job job);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<Job> findById(String jobId);

    /**
     * Atomically replace a job if its current state is one of
     * {@code expected}.
     *
     * @param jobId    the job ID
     * @param expected states from which the transition is allowed
     * @param update   produces the new job from the current one
     * @return the updated job, or empty if the job is missing or in another state
     */
    Optional<Job> transition(String jobId, Set<JobState> expected, UnaryOperator<Job> update);

    /**
     * Find jobs in a state.
     *
     * @param state the state to filter by
     * @param limit maximum number of results
     * @return jobs ordered by submission time
     */
    List<Job> findByState(JobState state, int limit);

    /**
     * Count jobs in a state.
     */
    int countByState(JobState state);

    /**
     * Remove terminal jobs so the store does not grow without bound.
     *
     * @param keep number of most recent terminal jobs to retain
     * @return number of jobs removed
     */
    int pruneTerminal(int keep);
}
