package mediagate.gpu.eviction;

import mediagate.gpu.MutableClock;
import mediagate.gpu.error.EvictionFailedException;
import mediagate.gpu.error.InsufficientCapacityException;
import mediagate.gpu.ledger.AllocationLedger;
import mediagate.gpu.model.LoadedModel;
import mediagate.gpu.model.PriorityTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VramOptimizerTest {

    private MutableClock clock;
    private AllocationLedger ledger;
    private VramOptimizer optimizer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        ledger = new AllocationLedger(0, clock);
        ledger.addDevice(0, 5_000);
        ledger.addDevice(1, 20_000);
        optimizer = new VramOptimizer(ledger, clock);
    }

    @Test
    @DisplayName("Evicting an idle model makes room for a job that fits after unloading")
    void evictsToMakeRoom() {
        optimizer.loadModel(0, "SDXL", 5_000, false);
        assertEquals(0, ledger.freeVram(0));

        List<LoadedModel> evicted = optimizer.evict(0, 4_000);

        assertEquals(List.of("SDXL"), evicted.stream().map(LoadedModel::name).toList());
        assertEquals(5_000, ledger.freeVram(0));
        assertFalse(optimizer.isLoaded(0, "SDXL"));
    }

    @Test
    @DisplayName("Eviction that cannot reach the target changes nothing")
    void evictionIsAllOrNothing() {
        optimizer.loadModel(0, "SDXL", 5_000, false);

        EvictionFailedException e = assertThrows(EvictionFailedException.class, () -> optimizer.evict(0, 6_000));

        assertEquals(5_000, e.reachableBytes());
        assertTrue(optimizer.isLoaded(0, "SDXL"));
        assertEquals(5_000, ledger.residentVram(0));
        assertFalse(optimizer.tryFreeCapacity(0, 6_000));
    }

    @Test
    void nothingEvictedWhenAlreadyFree() {
        optimizer.loadModel(1, "SDXL", 8_000, false);

        assertTrue(optimizer.evict(1, 10_000).isEmpty());
        assertTrue(optimizer.isLoaded(1, "SDXL"));
    }

    @Test
    void leastRecentlyUsedGoesFirst() {
        optimizer.loadModel(1, "SDXL", 8_000, false);
        clock.advance(Duration.ofMinutes(1));
        optimizer.loadModel(1, "FastHuayuan", 6_000, false);
        clock.advance(Duration.ofMinutes(1));
        optimizer.touch(1, "SDXL");
        ledger.tryReserve(1, "job-1", 5_000, PriorityTier.NORMAL);

        // free = 20000 - 14000 - 5000 = 1000
        List<LoadedModel> evicted = optimizer.evict(1, 6_000);

        assertEquals(List.of("FastHuayuan"), evicted.stream().map(LoadedModel::name).toList());
        assertTrue(optimizer.isLoaded(1, "SDXL"));
        assertEquals(7_000, ledger.freeVram(1));
    }

    @Test
    void baselineModelsAreNeverEvicted() {
        optimizer.loadModel(0, "ComfyUI", 4_000, true);

        assertThrows(EvictionFailedException.class, () -> optimizer.evict(0, 2_000));
        assertThrows(IllegalStateException.class, () -> optimizer.unloadModel(0, "ComfyUI"));
        assertEquals(0, optimizer.evictableBytes(0));
    }

    @Test
    void reservationsAreNeverTouched() {
        ledger.tryReserve(0, "job-1", 3_000, PriorityTier.NORMAL);
        optimizer.loadModel(0, "SDXL", 2_000, false);

        assertThrows(EvictionFailedException.class, () -> optimizer.evict(0, 3_000));
        optimizer.evict(0, 2_000);
        assertEquals(3_000, ledger.reservedVram(0));
    }

    @Test
    void loadingAResidentModelOnlyTouchesIt() {
        optimizer.loadModel(1, "SDXL", 8_000, false);
        clock.advance(Duration.ofMinutes(5));

        LoadedModel again = optimizer.loadModel(1, "SDXL", 8_000, false);

        assertEquals(clock.instant(), again.lastUsedAt());
        assertEquals(8_000, ledger.residentVram(1));
    }

    @Test
    void loadFailsWhenModelDoesNotFit() {
        assertThrows(InsufficientCapacityException.class, () -> optimizer.loadModel(0, "huge", 6_000, false));
        assertFalse(optimizer.isLoaded(0, "huge"));
    }

    @Test
    void pickEvictionTargetPrefersMostFreeThenLowestId() {
        ledger.addDevice(2, 20_000);
        optimizer.loadModel(1, "SDXL", 15_000, false);
        optimizer.loadModel(2, "SDXL", 15_000, false);

        assertEquals(1, optimizer.pickEvictionTarget(List.of(0, 1, 2), 12_000).orElseThrow());

        ledger.tryReserve(1, "job-1", 2_000, PriorityTier.NORMAL);
        assertEquals(2, optimizer.pickEvictionTarget(List.of(0, 1, 2), 12_000).orElseThrow());
        assertTrue(optimizer.pickEvictionTarget(List.of(0), 12_000).isEmpty());
    }

    @Test
    @DisplayName("A device removed after the candidate list was taken is neither picked nor evicted")
    void removedDeviceIsSkippedForEviction() {
        optimizer.loadModel(1, "SDXL", 15_000, false);
        ledger.removeDevice(1);

        assertTrue(optimizer.pickEvictionTarget(List.of(0, 1), 12_000).isEmpty());
        assertFalse(optimizer.tryFreeCapacity(1, 12_000));
    }

    @Test
    void unloadIdleSparesRecentAndBaselineModels() {
        optimizer.loadModel(1, "ComfyUI", 4_000, true);
        optimizer.loadModel(1, "SDXL", 8_000, false);
        clock.advance(Duration.ofHours(2));
        optimizer.loadModel(1, "FastHuayuan", 6_000, false);

        List<LoadedModel> unloaded = optimizer.unloadIdle(1, clock.instant().minus(Duration.ofHours(1)));

        assertEquals(List.of("SDXL"), unloaded.stream().map(LoadedModel::name).toList());
        assertEquals(10_000, ledger.residentVram(1));
    }
}
