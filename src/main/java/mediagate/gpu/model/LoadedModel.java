package mediagate.gpu.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A model resident on a device, occupying VRAM independently of job
 * reservations. Baseline models are never evicted.
 */
public record LoadedModel(
        String name,
        int deviceId,
        long vramBytes,
        boolean baseline,
        Instant lastUsedAt) {

    public LoadedModel {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(lastUsedAt, "lastUsedAt is required");
        if (vramBytes <= 0) {
            throw new IllegalArgumentException("vramBytes must be positive");
        }
    }

    public LoadedModel touchedAt(Instant when) {
        return new LoadedModel(name, deviceId, vramBytes, baseline, when);
    }

    public boolean isEvictable() {
        return !baseline;
    }
}
