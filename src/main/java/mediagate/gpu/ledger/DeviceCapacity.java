package mediagate.gpu.ledger;

/**
 * Point-in-time capacity accounting of one device, taken under the ledger lock.
 *
 * @param reservedBytes sum of job reservations
 * @param residentBytes sum of resident models
 * @param freeBytes     what admission may still hand out
 * @param open          false while the device is quarantined
 */
public record DeviceCapacity(
        int deviceId,
        long totalBytes,
        long reservedBytes,
        long residentBytes,
        long freeBytes,
        int reservations,
        boolean open) {
}
