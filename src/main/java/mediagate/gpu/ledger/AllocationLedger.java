package mediagate.gpu.ledger;

import mediagate.gpu.error.DeviceUnhealthyException;
import mediagate.gpu.error.InsufficientCapacityException;
import mediagate.gpu.error.LedgerInvariantException;
import mediagate.gpu.error.UnknownDeviceException;
import mediagate.gpu.model.PriorityTier;
import mediagate.gpu.model.Reservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Tracks which job holds which VRAM reservation on which device.
 *
 * Every read used for an admission decision and every mutation runs under
 * one lock, held only for the in-memory check-and-commit. For each device
 * {@code reserved + resident + headroom <= total} holds after every
 * operation.
 */
public class AllocationLedger {

    private static final Logger log = LoggerFactory.getLogger(AllocationLedger.class);

    private static final class Account {
        final int deviceId;
        final long totalBytes;
        long reservedBytes;
        long residentBytes;
        boolean open = true;
        final Map<String, Reservation> reservations = new LinkedHashMap<>();

        Account(int deviceId, long totalBytes) {
            this.deviceId = deviceId;
            this.totalBytes = totalBytes;
        }
    }

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Map<Integer, Account> accounts = new TreeMap<>();
    private final Map<String, Reservation> byJob = new HashMap<>();
    private final long headroomBytes;
    private final Clock clock;

    public AllocationLedger(long headroomBytes, Clock clock) {
        if (headroomBytes < 0) {
            throw new IllegalArgumentException("headroom must be non-negative");
        }
        this.headroomBytes = headroomBytes;
        this.clock = clock;
    }

    public void addDevice(int deviceId, long totalBytes) {
        lock.lock();
        try {
            if (accounts.containsKey(deviceId)) {
                throw new IllegalArgumentException("device " + deviceId + " already tracked");
            }
            accounts.put(deviceId, new Account(deviceId, totalBytes));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop tracking a device.
     *
     * @return reservations that were still held on it
     */
    public List<Reservation> removeDevice(int deviceId) {
        lock.lock();
        try {
            Account a = accounts.remove(deviceId);
            if (a == null) {
                return List.of();
            }
            List<Reservation> dropped = new ArrayList<>(a.reservations.values());
            dropped.forEach(r -> byJob.remove(r.jobId()));
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reserve VRAM for a job: one atomic check-then-commit.
     *
     * @throws InsufficientCapacityException if the device lacks free VRAM
     * @throws DeviceUnhealthyException      if the device is quarantined
     * @throws LedgerInvariantException      if the job already holds a reservation
     */
    public Reservation tryReserve(int deviceId, String jobId, long vramBytes, PriorityTier tier) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId is required");
        }
        if (vramBytes <= 0) {
            throw invariant("reservation size must be positive, got " + vramBytes + " for job " + jobId);
        }

        lock.lock();
        try {
            Account a = account(deviceId);
            Reservation existing = byJob.get(jobId);
            if (existing != null) {
                throw invariant("job " + jobId + " already holds a reservation on device " + existing.deviceId());
            }
            if (!a.open) {
                throw new DeviceUnhealthyException(deviceId, vramBytes);
            }
            long free = free(a);
            if (free < vramBytes) {
                throw new InsufficientCapacityException(deviceId, vramBytes, free);
            }

            Reservation r = new Reservation(jobId, deviceId, vramBytes, clock.instant(), tier);
            a.reservations.put(jobId, r);
            a.reservedBytes += vramBytes;
            byJob.put(jobId, r);
            verify(a);

            log.debug("Reserved {} bytes on device {} for job {}", vramBytes, deviceId, jobId);
            return r;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release a job's reservation. Releasing an unknown or already released
     * job is a no-op.
     */
    public Optional<Reservation> release(String jobId) {
        lock.lock();
        try {
            Reservation r = byJob.remove(jobId);
            if (r == null) {
                return Optional.empty();
            }
            Account a = accounts.get(r.deviceId());
            if (a != null) {
                a.reservations.remove(jobId);
                a.reservedBytes -= r.vramBytes();
                verify(a);
            }
            log.debug("Released {} bytes on device {} from job {}", r.vramBytes(), r.deviceId(), jobId);
            return Optional.of(r);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close a device for admission and release every reservation on it in
     * the same critical section.
     *
     * @return the released reservations, oldest first
     */
    public List<Reservation> closeDevice(int deviceId) {
        lock.lock();
        try {
            Account a = account(deviceId);
            a.open = false;
            List<Reservation> released = new ArrayList<>(a.reservations.values());
            released.sort(Comparator.comparing(Reservation::createdAt));
            for (Reservation r : released) {
                byJob.remove(r.jobId());
            }
            a.reservations.clear();
            a.reservedBytes = 0;
            if (!released.isEmpty()) {
                log.info("Device {} closed, force-released {} reservations", deviceId, released.size());
            }
            return released;
        } finally {
            lock.unlock();
        }
    }

    public void openDevice(int deviceId) {
        lock.lock();
        try {
            account(deviceId).open = true;
        } finally {
            lock.unlock();
        }
    }

    public boolean tracks(int deviceId) {
        lock.lock();
        try {
            return accounts.containsKey(deviceId);
        } finally {
            lock.unlock();
        }
    }

    public boolean isOpen(int deviceId) {
        lock.lock();
        try {
            return account(deviceId).open;
        } finally {
            lock.unlock();
        }
    }

    public long freeVram(int deviceId) {
        lock.lock();
        try {
            return free(account(deviceId));
        } finally {
            lock.unlock();
        }
    }

    public long reservedVram(int deviceId) {
        lock.lock();
        try {
            return account(deviceId).reservedBytes;
        } finally {
            lock.unlock();
        }
    }

    public long residentVram(int deviceId) {
        lock.lock();
        try {
            return account(deviceId).residentBytes;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Reservation> reservation(String jobId) {
        lock.lock();
        try {
            return Optional.ofNullable(byJob.get(jobId));
        } finally {
            lock.unlock();
        }
    }

    public List<Reservation> reservationsOn(int deviceId) {
        lock.lock();
        try {
            return List.copyOf(account(deviceId).reservations.values());
        } finally {
            lock.unlock();
        }
    }

    public List<Reservation> activeReservations() {
        lock.lock();
        try {
            return List.copyOf(byJob.values());
        } finally {
            lock.unlock();
        }
    }

    /** Consistent capacity view of every device */
    public Map<Integer, DeviceCapacity> snapshot() {
        lock.lock();
        try {
            Map<Integer, DeviceCapacity> view = new LinkedHashMap<>();
            for (Account a : accounts.values()) {
                view.put(a.deviceId, new DeviceCapacity(a.deviceId, a.totalBytes, a.reservedBytes,
                        a.residentBytes, free(a), a.reservations.size(), a.open));
            }
            return view;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Account VRAM for a model becoming resident.
     *
     * @throws InsufficientCapacityException if it does not fit
     */
    public void addResident(int deviceId, long bytes) {
        if (bytes <= 0) {
            throw invariant("resident size must be positive, got " + bytes);
        }
        lock.lock();
        try {
            Account a = account(deviceId);
            long free = free(a);
            if (free < bytes) {
                throw new InsufficientCapacityException(deviceId, bytes, free);
            }
            a.residentBytes += bytes;
            verify(a);
        } finally {
            lock.unlock();
        }
    }

    public void removeResident(int deviceId, long bytes) {
        lock.lock();
        try {
            Account a = account(deviceId);
            if (bytes <= 0 || bytes > a.residentBytes) {
                throw invariant("cannot unload " + bytes + " bytes from device " + deviceId + " holding "
                        + a.residentBytes + " resident");
            }
            a.residentBytes -= bytes;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run a compound read-modify-write against the ledger without any other
     * ledger operation interleaving. The action must not block.
     */
    public <T> T atomically(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public long headroomBytes() {
        return headroomBytes;
    }

    private long free(Account a) {
        return Math.max(0, a.totalBytes - a.reservedBytes - a.residentBytes - headroomBytes);
    }

    private void verify(Account a) {
        if (a.reservedBytes < 0 || a.reservedBytes + a.residentBytes > a.totalBytes) {
            throw invariant("device " + a.deviceId + " overcommitted: reserved=" + a.reservedBytes
                    + " resident=" + a.residentBytes + " total=" + a.totalBytes);
        }
    }

    private Account account(int deviceId) {
        Account a = accounts.get(deviceId);
        if (a == null) {
            throw new UnknownDeviceException(deviceId);
        }
        return a;
    }

    private LedgerInvariantException invariant(String message) {
        log.error("Ledger invariant violation: {}", message);
        return new LedgerInvariantException(message);
    }
}
