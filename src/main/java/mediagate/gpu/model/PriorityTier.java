package mediagate.gpu.model;

/**
 * Queuing class of a job. Declaration order is dequeue order.
 */
public enum PriorityTier {
    /** Interactive requests, always served first */
    REALTIME,
    /** Important work */
    HIGH,
    /** Default tier */
    NORMAL,
    /** Bulk processing, may starve under sustained load */
    BATCH;

    /** Parse a tier name case-insensitively */
    public static PriorityTier parse(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return PriorityTier.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown priority tier: " + value);
        }
    }
}
