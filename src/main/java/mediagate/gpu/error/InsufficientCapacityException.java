package mediagate.gpu.error;

/**
 * No VRAM left on the requested device for the requested reservation.
 * Recoverable: callers queue the job instead of failing it.
 */
public class InsufficientCapacityException extends GatewayException {

    private final int deviceId;
    private final long requestedBytes;
    private final long freeBytes;

    public InsufficientCapacityException(int deviceId, long requestedBytes, long freeBytes) {
        this("device " + deviceId + " has " + freeBytes + " bytes free, " + requestedBytes + " requested",
                deviceId, requestedBytes, freeBytes);
    }

    protected InsufficientCapacityException(String message, int deviceId, long requestedBytes, long freeBytes) {
        super(message);
        this.deviceId = deviceId;
        this.requestedBytes = requestedBytes;
        this.freeBytes = freeBytes;
    }

    public int deviceId() {
        return deviceId;
    }

    public long requestedBytes() {
        return requestedBytes;
    }

    public long freeBytes() {
        return freeBytes;
    }
}
