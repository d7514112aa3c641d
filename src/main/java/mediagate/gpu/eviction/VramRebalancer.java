package mediagate.gpu.eviction;

import mediagate.gpu.ledger.AllocationLedger;
import mediagate.gpu.ledger.DeviceCapacity;
import mediagate.gpu.model.LoadedModel;
import mediagate.gpu.registry.DeviceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Background pass that looks for devices carrying noticeably more VRAM than
 * the average of the healthy devices and unloads idle models from them.
 * Secondary to admission, which already spreads load by free VRAM.
 */
public class VramRebalancer implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(VramRebalancer.class);

    private final DeviceRegistry registry;
    private final AllocationLedger ledger;
    private final VramOptimizer optimizer;
    private final double threshold;
    private final Duration idleTtl;
    private final Clock clock;

    /**
     * @param threshold fraction above the average that counts as overloaded
     * @param idleTtl   models unused for longer are unloaded from overloaded devices
     */
    public VramRebalancer(DeviceRegistry registry, AllocationLedger ledger, VramOptimizer optimizer,
            double threshold, Duration idleTtl, Clock clock) {
        this.registry = registry;
        this.ledger = ledger;
        this.optimizer = optimizer;
        this.threshold = threshold;
        this.idleTtl = idleTtl;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            rebalance();
        } catch (Exception e) {
            log.error("VRAM rebalancer error", e);
        }
    }

    /**
     * Devices whose used VRAM (reserved + resident) exceeds the healthy
     * average by more than the threshold.
     */
    public List<Integer> overloadedDevices() {
        Map<Integer, DeviceCapacity> capacity = ledger.snapshot();
        List<DeviceCapacity> healthy = capacity.values().stream()
                .filter(c -> c.open() && registry.isHealthy(c.deviceId()))
                .toList();
        if (healthy.size() < 2) {
            return List.of();
        }
        double avg = healthy.stream()
                .mapToLong(c -> c.reservedBytes() + c.residentBytes())
                .average()
                .orElse(0);
        if (avg <= 0) {
            return List.of();
        }
        List<Integer> overloaded = new ArrayList<>();
        for (DeviceCapacity c : healthy) {
            if (c.reservedBytes() + c.residentBytes() > avg * (1 + threshold)) {
                overloaded.add(c.deviceId());
            }
        }
        return overloaded;
    }

    /**
     * @return number of models unloaded
     */
    public int rebalance() {
        List<Integer> overloaded = overloadedDevices();
        if (overloaded.isEmpty()) {
            log.debug("VRAM balanced across devices");
            return 0;
        }
        Instant cutoff = clock.instant().minus(idleTtl);
        int unloaded = 0;
        for (int deviceId : overloaded) {
            List<LoadedModel> idle = optimizer.unloadIdle(deviceId, cutoff);
            unloaded += idle.size();
            log.info("Device {} above average VRAM use, unloaded {} idle model(s)", deviceId, idle.size());
        }
        return unloaded;
    }
}
