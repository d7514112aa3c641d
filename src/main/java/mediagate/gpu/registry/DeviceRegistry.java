package mediagate.gpu.registry;

import mediagate.gpu.config.DeviceSpec;
import mediagate.gpu.error.UnknownDeviceException;
import mediagate.gpu.model.Device;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Device inventory and live metrics. Single source of truth for which GPUs
 * exist and whether they may admit work.
 *
 * Health changes of one device are serialized together with their listener
 * notifications, so listeners see them in the order the flag changed.
 */
public class DeviceRegistry {

    private static final Logger log = LoggerFactory.getLogger(DeviceRegistry.class);

    private static final class Entry {
        final int id;
        final String name;
        final long totalVram;
        final Set<Integer> nvlinkPeers;
        long usedVram;
        double utilization;
        double temperature;
        boolean healthy = true;
        boolean manual;
        String reason;
        Instant lastMetricsAt;
        final Deque<Instant> errors = new ArrayDeque<>();
        final ReentrantLock transitions = new ReentrantLock();

        Entry(DeviceSpec spec) {
            this.id = spec.id();
            this.name = spec.name();
            this.totalVram = spec.totalVram();
            this.nvlinkPeers = spec.nvlinkPeers();
        }
    }

    private final ConcurrentHashMap<Integer, Entry> devices = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<DeviceHealthListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;
    private final Duration errorWindow;

    public DeviceRegistry(Clock clock, Duration errorWindow) {
        this.clock = clock;
        this.errorWindow = errorWindow;
    }

    public void addListener(DeviceHealthListener listener) {
        listeners.add(listener);
    }

    public void register(DeviceSpec spec) {
        Entry previous = devices.putIfAbsent(spec.id(), new Entry(spec));
        if (previous != null) {
            throw new IllegalArgumentException("device " + spec.id() + " already registered");
        }
        log.info("Registered device {} ({}, {} MB)", spec.id(), spec.name(), spec.totalVram() / (1024 * 1024));
    }

    /**
     * Remove a device from the inventory. Reservations still held on it are
     * the ledger's concern.
     */
    public boolean deregister(int deviceId) {
        boolean removed = devices.remove(deviceId) != null;
        if (removed) {
            log.info("Deregistered device {}", deviceId);
        }
        return removed;
    }

    /** Immutable snapshot of every device, ordered by id */
    public List<Device> listDevices() {
        List<Device> list = new ArrayList<>(devices.size());
        for (Entry e : devices.values()) {
            list.add(snapshot(e));
        }
        list.sort(Comparator.comparingInt(Device::id));
        return list;
    }

    public Optional<Device> find(int deviceId) {
        Entry e = devices.get(deviceId);
        return e == null ? Optional.empty() : Optional.of(snapshot(e));
    }

    public boolean contains(int deviceId) {
        return devices.containsKey(deviceId);
    }

    public long totalVram(int deviceId) {
        return entry(deviceId).totalVram;
    }

    public boolean isHealthy(int deviceId) {
        Entry e = devices.get(deviceId);
        if (e == null) {
            return false;
        }
        synchronized (e) {
            return e.healthy;
        }
    }

    public int size() {
        return devices.size();
    }

    /**
     * Overwrite the live metrics of a device.
     *
     * @throws UnknownDeviceException if the device is not registered
     */
    public void updateMetrics(int deviceId, double utilization, double temperature, long usedVram) {
        if (utilization < 0 || utilization > 100) {
            throw new IllegalArgumentException("utilization must be between 0 and 100");
        }
        if (usedVram < 0) {
            throw new IllegalArgumentException("usedVram must be non-negative");
        }
        Entry e = entry(deviceId);
        if (usedVram > e.totalVram) {
            log.error("Rejected metrics for device {}: used {} exceeds total {}", deviceId, usedVram, e.totalVram);
            throw new IllegalArgumentException("usedVram exceeds total VRAM of device " + deviceId);
        }
        synchronized (e) {
            e.utilization = utilization;
            e.temperature = temperature;
            e.usedVram = usedVram;
            e.lastMetricsAt = clock.instant();
        }
        log.debug("Metrics for device {} (util={}%, temp={}C, used={})", deviceId, utilization, temperature, usedVram);
    }

    /** Record a device-level error reported by an executor or telemetry */
    public void recordError(int deviceId) {
        Entry e = entry(deviceId);
        synchronized (e) {
            e.errors.addLast(clock.instant());
            pruneErrors(e);
        }
    }

    /** Errors recorded within the configured window */
    public int recentErrors(int deviceId) {
        Entry e = entry(deviceId);
        synchronized (e) {
            pruneErrors(e);
            return e.errors.size();
        }
    }

    /**
     * Flag a device unhealthy and notify listeners.
     *
     * @return true if the device was healthy before
     */
    public boolean markUnhealthy(int deviceId, String reason) {
        return transitionUnhealthy(deviceId, reason, false);
    }

    /**
     * Operator quarantine. Unlike {@link #markUnhealthy}, automatic health
     * checks never lift it; only {@link #restore} does.
     */
    public boolean quarantine(int deviceId, String reason) {
        return transitionUnhealthy(deviceId, reason, true);
    }

    /**
     * Flag an automatically quarantined device healthy again.
     *
     * @return true if the device transitioned; false if it was healthy
     *         already or is held by an operator quarantine
     */
    public boolean markHealthy(int deviceId) {
        Entry e = entry(deviceId);
        e.transitions.lock();
        try {
            synchronized (e) {
                if (e.healthy || e.manual) {
                    return false;
                }
                e.healthy = true;
                e.reason = null;
                e.errors.clear();
            }
            log.info("Device {} is healthy again", deviceId);
            fireHealthy(deviceId);
            return true;
        } finally {
            e.transitions.unlock();
        }
    }

    /** Lift any quarantine, manual or automatic */
    public boolean restore(int deviceId) {
        Entry e = entry(deviceId);
        e.transitions.lock();
        try {
            synchronized (e) {
                if (e.healthy) {
                    return false;
                }
                e.healthy = true;
                e.manual = false;
                e.reason = null;
                e.errors.clear();
            }
            log.info("Device {} restored by operator", deviceId);
            fireHealthy(deviceId);
            return true;
        } finally {
            e.transitions.unlock();
        }
    }

    private boolean transitionUnhealthy(int deviceId, String reason, boolean manual) {
        Entry e = entry(deviceId);
        e.transitions.lock();
        try {
            synchronized (e) {
                if (!e.healthy) {
                    if (manual && !e.manual) {
                        e.manual = true;
                        e.reason = reason;
                    }
                    return false;
                }
                e.healthy = false;
                e.manual = manual;
                e.reason = reason;
            }
            log.warn("Device {} marked unhealthy: {}", deviceId, reason);
            for (DeviceHealthListener l : listeners) {
                try {
                    l.onDeviceUnhealthy(deviceId, reason);
                } catch (RuntimeException ex) {
                    log.error("Health listener failed for device {}", deviceId, ex);
                }
            }
            return true;
        } finally {
            e.transitions.unlock();
        }
    }

    private void fireHealthy(int deviceId) {
        for (DeviceHealthListener l : listeners) {
            try {
                l.onDeviceHealthy(deviceId);
            } catch (RuntimeException ex) {
                log.error("Health listener failed for device {}", deviceId, ex);
            }
        }
    }

    private void pruneErrors(Entry e) {
        Instant cutoff = clock.instant().minus(errorWindow);
        while (!e.errors.isEmpty() && e.errors.peekFirst().isBefore(cutoff)) {
            e.errors.removeFirst();
        }
    }

    private Entry entry(int deviceId) {
        Entry e = devices.get(deviceId);
        if (e == null) {
            throw new UnknownDeviceException(deviceId);
        }
        return e;
    }

    private Device snapshot(Entry e) {
        synchronized (e) {
            pruneErrors(e);
            return Device.builder()
                    .id(e.id)
                    .name(e.name)
                    .totalVram(e.totalVram)
                    .usedVram(e.usedVram)
                    .utilizationPct(e.utilization)
                    .temperatureC(e.temperature)
                    .healthy(e.healthy)
                    .unhealthyReason(e.reason)
                    .manuallyQuarantined(e.manual)
                    .recentErrors(e.errors.size())
                    .nvlinkPeers(e.nvlinkPeers)
                    .lastMetricsAt(e.lastMetricsAt)
                    .build();
        }
    }
}
