package mediagate.gpu.model;

/**
 * Job lifecycle state.
 */
public enum JobState {
    /** Waiting in the priority queue for capacity */
    QUEUED,
    /** Holds a reservation, not yet handed to the executor */
    ADMITTED,
    /** Handed to the executor */
    RUNNING,
    /** Executor reported success */
    COMPLETED,
    /** Executor reported failure, or the job timed out in the queue */
    FAILED,
    /** Cancelled by the caller */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /** States in which the job holds (or is about to hold) a reservation */
    public boolean holdsCapacity() {
        return this == ADMITTED || this == RUNNING;
    }
}
