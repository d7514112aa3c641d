package mediagate.gpu.ledger;

import mediagate.gpu.MutableClock;
import mediagate.gpu.error.DeviceUnhealthyException;
import mediagate.gpu.error.InsufficientCapacityException;
import mediagate.gpu.error.LedgerInvariantException;
import mediagate.gpu.error.UnknownDeviceException;
import mediagate.gpu.model.PriorityTier;
import mediagate.gpu.model.Reservation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AllocationLedgerTest {

    private MutableClock clock;
    private AllocationLedger ledger;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        ledger = new AllocationLedger(0, clock);
        ledger.addDevice(0, 20_000);
        ledger.addDevice(1, 10_000);
    }

    @Test
    void reserveReducesFreeVram() {
        Reservation r = ledger.tryReserve(0, "job-1", 6_000, PriorityTier.NORMAL);

        assertEquals(0, r.deviceId());
        assertEquals(6_000, r.vramBytes());
        assertEquals(14_000, ledger.freeVram(0));
        assertEquals(6_000, ledger.reservedVram(0));
        assertEquals(r, ledger.reservation("job-1").orElseThrow());
    }

    @Test
    void reserveFailsWhenItDoesNotFit() {
        ledger.tryReserve(1, "job-1", 6_000, PriorityTier.NORMAL);

        InsufficientCapacityException e = assertThrows(InsufficientCapacityException.class,
                () -> ledger.tryReserve(1, "job-2", 4_001, PriorityTier.NORMAL));
        assertEquals(1, e.deviceId());
        assertEquals(4_001, e.requestedBytes());
        assertEquals(4_000, e.freeBytes());
        assertEquals(4_000, ledger.freeVram(1));
    }

    @Test
    void exactFitIsAllowed() {
        ledger.tryReserve(1, "job-1", 10_000, PriorityTier.NORMAL);
        assertEquals(0, ledger.freeVram(1));
    }

    @Test
    void rejectsNonPositiveSizeAndDuplicates() {
        assertThrows(LedgerInvariantException.class, () -> ledger.tryReserve(0, "job-1", 0, PriorityTier.NORMAL));
        ledger.tryReserve(0, "job-1", 100, PriorityTier.NORMAL);
        assertThrows(LedgerInvariantException.class, () -> ledger.tryReserve(1, "job-1", 100, PriorityTier.NORMAL));
        assertThrows(IllegalArgumentException.class, () -> ledger.tryReserve(0, " ", 100, PriorityTier.NORMAL));
    }

    @Test
    void unknownDeviceIsRejected() {
        assertThrows(UnknownDeviceException.class, () -> ledger.tryReserve(7, "job-1", 100, PriorityTier.NORMAL));
    }

    @Test
    @DisplayName("Releasing twice is a no-op the second time")
    void releaseIsIdempotent() {
        ledger.tryReserve(0, "job-1", 6_000, PriorityTier.NORMAL);

        assertTrue(ledger.release("job-1").isPresent());
        assertTrue(ledger.release("job-1").isEmpty());
        assertTrue(ledger.release("never-reserved").isEmpty());
        assertEquals(20_000, ledger.freeVram(0));
    }

    @Test
    void headroomIsNeverHandedOut() {
        AllocationLedger withHeadroom = new AllocationLedger(1_000, clock);
        withHeadroom.addDevice(0, 10_000);

        assertEquals(9_000, withHeadroom.freeVram(0));
        assertThrows(InsufficientCapacityException.class,
                () -> withHeadroom.tryReserve(0, "job-1", 9_500, PriorityTier.NORMAL));
        withHeadroom.tryReserve(0, "job-1", 9_000, PriorityTier.NORMAL);
        assertEquals(0, withHeadroom.freeVram(0));
    }

    @Test
    void residentModelsCountAgainstFreeVram() {
        ledger.addResident(1, 4_000);
        assertEquals(6_000, ledger.freeVram(1));

        assertThrows(InsufficientCapacityException.class, () -> ledger.addResident(1, 7_000));
        assertThrows(InsufficientCapacityException.class,
                () -> ledger.tryReserve(1, "job-1", 6_001, PriorityTier.NORMAL));

        ledger.removeResident(1, 4_000);
        assertEquals(10_000, ledger.freeVram(1));
        assertThrows(LedgerInvariantException.class, () -> ledger.removeResident(1, 1));
    }

    @Test
    @DisplayName("Closing a device releases its reservations oldest first and blocks admission")
    void closeDeviceReleasesEverything() {
        ledger.tryReserve(0, "job-a", 1_000, PriorityTier.NORMAL);
        clock.advance(Duration.ofSeconds(1));
        ledger.tryReserve(0, "job-b", 2_000, PriorityTier.HIGH);
        clock.advance(Duration.ofSeconds(1));
        ledger.tryReserve(1, "job-c", 3_000, PriorityTier.NORMAL);

        List<Reservation> released = ledger.closeDevice(0);

        assertEquals(List.of("job-a", "job-b"), released.stream().map(Reservation::jobId).toList());
        assertEquals(0, ledger.reservedVram(0));
        assertFalse(ledger.isOpen(0));
        assertTrue(ledger.reservation("job-a").isEmpty());
        assertTrue(ledger.reservation("job-c").isPresent());
        assertThrows(DeviceUnhealthyException.class,
                () -> ledger.tryReserve(0, "job-d", 1, PriorityTier.NORMAL));

        ledger.openDevice(0);
        assertNotNull(ledger.tryReserve(0, "job-d", 1, PriorityTier.NORMAL));
    }

    @Test
    void snapshotIsConsistent() {
        ledger.tryReserve(0, "job-1", 5_000, PriorityTier.NORMAL);
        ledger.addResident(0, 2_000);

        Map<Integer, DeviceCapacity> view = ledger.snapshot();

        DeviceCapacity c = view.get(0);
        assertEquals(20_000, c.totalBytes());
        assertEquals(5_000, c.reservedBytes());
        assertEquals(2_000, c.residentBytes());
        assertEquals(13_000, c.freeBytes());
        assertEquals(1, c.reservations());
        assertTrue(c.open());
        assertEquals(10_000, view.get(1).freeBytes());
    }

    @Test
    void removeDeviceReturnsHeldReservations() {
        ledger.tryReserve(1, "job-1", 1_000, PriorityTier.NORMAL);

        List<Reservation> dropped = ledger.removeDevice(1);

        assertEquals(1, dropped.size());
        assertTrue(ledger.reservation("job-1").isEmpty());
        assertThrows(UnknownDeviceException.class, () -> ledger.freeVram(1));
    }

    @Test
    @DisplayName("Concurrent reservations never overcommit a device")
    void concurrentReservationsNeverOvercommit() throws Exception {
        int threads = 16;
        int perThread = 50;
        AllocationLedger shared = new AllocationLedger(0, clock);
        shared.addDevice(0, 100_000);

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger granted = new AtomicInteger();
        AtomicInteger refused = new AtomicInteger();

        for (int t = 0; t < threads; t++) {
            int thread = t;
            pool.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        String jobId = "job-" + thread + "-" + i;
                        try {
                            shared.tryReserve(0, jobId, 1_000, PriorityTier.NORMAL);
                            granted.incrementAndGet();
                            if (i % 3 == 0) {
                                shared.release(jobId);
                                granted.decrementAndGet();
                            }
                        } catch (InsufficientCapacityException e) {
                            refused.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        pool.shutdown();

        assertEquals(100, granted.get(), "exactly the capacity is held at the end");
        assertTrue(refused.get() > 0);
        assertEquals(100_000, shared.reservedVram(0));
        assertEquals(0, shared.freeVram(0));
        assertEquals(100, shared.activeReservations().size());
    }
}
