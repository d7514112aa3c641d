package mediagate.gpu.scheduler;

import mediagate.gpu.ledger.DeviceCapacity;
import mediagate.gpu.model.Device;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chooses the device for a job from a consistent snapshot.
 *
 * Largest free VRAM wins, then lowest utilization, then lowest device id.
 * When preferred devices are given, an eligible preferred device beats any
 * other device.
 */
public final class AdmissionPolicy {

    private AdmissionPolicy() {
    }

    public static Optional<Integer> select(long neededBytes, List<Device> devices,
            Map<Integer, DeviceCapacity> capacity, List<Integer> preferred) {
        List<Candidate> eligible = devices.stream()
                .filter(Device::isHealthy)
                .map(d -> new Candidate(d, capacity.get(d.id())))
                .filter(c -> c.capacity != null && c.capacity.open() && c.capacity.freeBytes() >= neededBytes)
                .sorted(ORDER)
                .toList();
        if (eligible.isEmpty()) {
            return Optional.empty();
        }
        if (!preferred.isEmpty()) {
            for (Candidate c : eligible) {
                if (preferred.contains(c.device.id())) {
                    return Optional.of(c.device.id());
                }
            }
        }
        return Optional.of(eligible.get(0).device.id());
    }

    /**
     * True when a quarantined device could hold the job but no healthy one
     * ever could.
     */
    public static boolean onlyQuarantinedDevicesFit(long neededBytes, List<Device> devices,
            Map<Integer, DeviceCapacity> capacity) {
        boolean healthyFits = false;
        boolean quarantinedFits = false;
        for (Device d : devices) {
            DeviceCapacity c = capacity.get(d.id());
            if (c == null) {
                continue;
            }
            boolean fits = c.totalBytes() >= neededBytes;
            if (d.isHealthy() && c.open()) {
                healthyFits |= fits;
            } else {
                quarantinedFits |= fits;
            }
        }
        return quarantinedFits && !healthyFits;
    }

    private record Candidate(Device device, DeviceCapacity capacity) {
    }

    private static final Comparator<Candidate> ORDER = Comparator
            .comparingLong((Candidate c) -> c.capacity.freeBytes()).reversed()
            .thenComparingDouble(c -> c.device.utilizationPct())
            .thenComparingInt(c -> c.device.id());
}
