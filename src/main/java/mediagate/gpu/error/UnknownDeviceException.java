package mediagate.gpu.error;

/**
 * A device id that is not (or no longer) registered.
 */
public class UnknownDeviceException extends GatewayException {

    private final int deviceId;

    public UnknownDeviceException(int deviceId) {
        super("unknown device " + deviceId);
        this.deviceId = deviceId;
    }

    public int deviceId() {
        return deviceId;
    }
}
