package mediagate.gpu.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A job's claim on a device's VRAM. Owned by the allocation ledger.
 */
public record Reservation(
        String jobId,
        int deviceId,
        long vramBytes,
        Instant createdAt,
        PriorityTier tier) {

    public Reservation {
        Objects.requireNonNull(jobId, "jobId is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        Objects.requireNonNull(tier, "tier is required");
    }
}
