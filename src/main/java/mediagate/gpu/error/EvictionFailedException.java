package mediagate.gpu.error;

/**
 * Unloading every evictable model would still not free enough VRAM.
 * Non-fatal: the job falls through to the queue.
 */
public class EvictionFailedException extends GatewayException {

    private final int deviceId;
    private final long neededBytes;
    private final long reachableBytes;

    public EvictionFailedException(int deviceId, long neededBytes, long reachableBytes) {
        super("cannot free " + neededBytes + " bytes on device " + deviceId + ", at most " + reachableBytes
                + " reachable");
        this.deviceId = deviceId;
        this.neededBytes = neededBytes;
        this.reachableBytes = reachableBytes;
    }

    public int deviceId() {
        return deviceId;
    }

    public long neededBytes() {
        return neededBytes;
    }

    public long reachableBytes() {
        return reachableBytes;
    }
}
