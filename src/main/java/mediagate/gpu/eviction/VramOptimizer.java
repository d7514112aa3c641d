package mediagate.gpu.eviction;

import mediagate.gpu.error.EvictionFailedException;
import mediagate.gpu.error.InsufficientCapacityException;
import mediagate.gpu.error.UnknownDeviceException;
import mediagate.gpu.ledger.AllocationLedger;
import mediagate.gpu.model.LoadedModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resident model catalogue and eviction policy.
 *
 * Only idle resident models are ever unloaded; job reservations are never
 * touched. Baseline models are excluded. Every mutation runs inside
 * {@link AllocationLedger#atomically} so the resident accounting and the
 * catalogue change together.
 */
public class VramOptimizer {

    private static final Logger log = LoggerFactory.getLogger(VramOptimizer.class);

    private static final Comparator<LoadedModel> LEAST_RECENTLY_USED = Comparator
            .comparing(LoadedModel::lastUsedAt)
            .thenComparing(LoadedModel::name);

    private final AllocationLedger ledger;
    private final Clock clock;
    private final Map<Integer, Map<String, LoadedModel>> models = new ConcurrentHashMap<>();

    public VramOptimizer(AllocationLedger ledger, Clock clock) {
        this.ledger = ledger;
        this.clock = clock;
    }

    /**
     * Make a model resident on a device. Loading an already resident model
     * only refreshes its last-used time.
     *
     * @throws InsufficientCapacityException if the model does not fit
     */
    public LoadedModel loadModel(int deviceId, String name, long vramBytes, boolean baseline) {
        return ledger.atomically(() -> {
            Map<String, LoadedModel> onDevice = models.computeIfAbsent(deviceId, k -> new ConcurrentHashMap<>());
            LoadedModel existing = onDevice.get(name);
            if (existing != null) {
                LoadedModel touched = existing.touchedAt(clock.instant());
                onDevice.put(name, touched);
                return touched;
            }
            ledger.addResident(deviceId, vramBytes);
            LoadedModel model = new LoadedModel(name, deviceId, vramBytes, baseline, clock.instant());
            onDevice.put(name, model);
            log.info("Loaded model {} on device {} ({} bytes{})", name, deviceId, vramBytes,
                    baseline ? ", baseline" : "");
            return model;
        });
    }

    /**
     * Unload a model on operator request.
     *
     * @return false if it was not resident
     * @throws IllegalStateException for baseline models
     */
    public boolean unloadModel(int deviceId, String name) {
        return ledger.atomically(() -> {
            Map<String, LoadedModel> onDevice = models.get(deviceId);
            LoadedModel model = onDevice == null ? null : onDevice.get(name);
            if (model == null) {
                return false;
            }
            if (model.baseline()) {
                throw new IllegalStateException("model " + name + " is platform baseline and cannot be unloaded");
            }
            unload(model);
            return true;
        });
    }

    /** Mark a resident model as just used. No-op if it is not resident. */
    public void touch(int deviceId, String name) {
        if (name == null) {
            return;
        }
        Map<String, LoadedModel> onDevice = models.get(deviceId);
        if (onDevice != null) {
            onDevice.computeIfPresent(name, (k, m) -> m.touchedAt(clock.instant()));
        }
    }

    public boolean isLoaded(int deviceId, String name) {
        Map<String, LoadedModel> onDevice = models.get(deviceId);
        return onDevice != null && onDevice.containsKey(name);
    }

    public List<LoadedModel> loadedModels(int deviceId) {
        Map<String, LoadedModel> onDevice = models.get(deviceId);
        if (onDevice == null) {
            return List.of();
        }
        List<LoadedModel> out = new ArrayList<>(onDevice.values());
        out.sort(LEAST_RECENTLY_USED);
        return out;
    }

    /** Bytes that eviction could release on a device */
    public long evictableBytes(int deviceId) {
        return loadedModels(deviceId).stream()
                .filter(LoadedModel::isEvictable)
                .mapToLong(LoadedModel::vramBytes)
                .sum();
    }

    /**
     * Unload least-recently-used evictable models until the device has at
     * least {@code neededBytes} free. Either enough is freed or nothing
     * changes.
     *
     * @return the models that were unloaded (empty if none were needed)
     * @throws EvictionFailedException if even unloading every evictable model
     *                                 would not be enough
     */
    public List<LoadedModel> evict(int deviceId, long neededBytes) {
        return ledger.atomically(() -> {
            long free = ledger.freeVram(deviceId);
            if (free >= neededBytes) {
                return List.of();
            }

            List<LoadedModel> plan = new ArrayList<>();
            long reclaimed = 0;
            for (LoadedModel m : loadedModels(deviceId)) {
                if (!m.isEvictable()) {
                    continue;
                }
                plan.add(m);
                reclaimed += m.vramBytes();
                if (free + reclaimed >= neededBytes) {
                    break;
                }
            }

            if (free + reclaimed < neededBytes) {
                throw new EvictionFailedException(deviceId, neededBytes, free + reclaimed);
            }

            plan.forEach(this::unload);
            log.info("Evicted {} model(s) from device {} to free {} bytes", plan.size(), deviceId, reclaimed);
            return plan;
        });
    }

    /**
     * Non-throwing form of {@link #evict}. A device removed in the meantime
     * counts as a failed eviction.
     *
     * @return true if the device now has at least {@code neededBytes} free
     */
    public boolean tryFreeCapacity(int deviceId, long neededBytes) {
        try {
            evict(deviceId, neededBytes);
            return true;
        } catch (EvictionFailedException e) {
            log.debug("Eviction on device {} not possible: {}", deviceId, e.getMessage());
            return false;
        } catch (UnknownDeviceException e) {
            log.debug("Eviction on removed device {} skipped", deviceId);
            return false;
        }
    }

    /**
     * Among the candidates, the device where eviction can reach
     * {@code neededBytes} with the most free VRAM already, lowest id first.
     * Devices no longer tracked by the ledger are skipped.
     */
    public Optional<Integer> pickEvictionTarget(List<Integer> deviceIds, long neededBytes) {
        return ledger.atomically(() -> {
            Integer best = null;
            long bestFree = -1;
            for (int id : deviceIds) {
                if (!ledger.tracks(id)) {
                    log.debug("Device {} no longer tracked, not an eviction target", id);
                    continue;
                }
                long free = ledger.freeVram(id);
                if (free + evictableBytes(id) < neededBytes) {
                    continue;
                }
                if (free > bestFree || (free == bestFree && id < best)) {
                    best = id;
                    bestFree = free;
                }
            }
            return Optional.ofNullable(best);
        });
    }

    /**
     * Unload evictable models not used since the cutoff.
     *
     * @return the unloaded models
     */
    public List<LoadedModel> unloadIdle(int deviceId, Instant cutoff) {
        return ledger.atomically(() -> {
            List<LoadedModel> idle = loadedModels(deviceId).stream()
                    .filter(LoadedModel::isEvictable)
                    .filter(m -> m.lastUsedAt().isBefore(cutoff))
                    .toList();
            idle.forEach(this::unload);
            return idle;
        });
    }

    /** Drop all catalogue entries of a removed device */
    public void forgetDevice(int deviceId) {
        models.remove(deviceId);
    }

    private void unload(LoadedModel model) {
        ledger.removeResident(model.deviceId(), model.vramBytes());
        models.get(model.deviceId()).remove(model.name());
        log.info("Unloaded model {} from device {}", model.name(), model.deviceId());
    }
}
