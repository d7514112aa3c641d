package mediagate.gpu.config;

import java.util.Set;

/**
 * Static description of a GPU in the inventory.
 */
public record DeviceSpec(int id, String name, long totalVram, Set<Integer> nvlinkPeers) {

    public DeviceSpec {
        if (id < 0) {
            throw new IllegalArgumentException("device id must be non-negative");
        }
        if (totalVram <= 0) {
            throw new IllegalArgumentException("totalVram must be positive");
        }
        nvlinkPeers = nvlinkPeers == null ? Set.of() : Set.copyOf(nvlinkPeers);
    }

    public DeviceSpec(int id, String name, long totalVram) {
        this(id, name, totalVram, Set.of());
    }
}
