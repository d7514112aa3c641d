package mediagate.gpu.model;

/**
 * Result of a cancellation request.
 */
public enum CancelResult {
    /** Job was waiting in the queue and has been removed */
    CANCELLED_QUEUED,

    /** Job held a reservation; capacity released and the executor asked to stop */
    CANCELLED_RUNNING,

    /** Job already finished - nothing to cancel */
    ALREADY_TERMINAL,

    /** Job not found */
    NOT_FOUND
}
