package mediagate.gpu.model;

/**
 * Result of an executor completion callback.
 */
public enum CompleteResult {
    /** Job finished and its reservation was released */
    COMPLETED,

    /** Job finished with a failure and its reservation was released */
    FAILED,

    /**
     * Job was already in a terminal state - idempotent no-op
     */
    ALREADY_TERMINAL,

    /** Job is not running (queued again after failover, or never admitted) */
    NOT_RUNNING,

    /** Job not found */
    NOT_FOUND
}
