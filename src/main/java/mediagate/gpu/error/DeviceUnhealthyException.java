package mediagate.gpu.error;

/**
 * Reservation refused because the device is quarantined.
 * Handled like {@link InsufficientCapacityException} for queuing purposes.
 */
public class DeviceUnhealthyException extends InsufficientCapacityException {

    public DeviceUnhealthyException(int deviceId, long requestedBytes) {
        super("device " + deviceId + " is quarantined", deviceId, requestedBytes, 0);
    }
}
