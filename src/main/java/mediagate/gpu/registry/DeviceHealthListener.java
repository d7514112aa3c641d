package mediagate.gpu.registry;

/**
 * Notified synchronously when a device changes health state.
 */
public interface DeviceHealthListener {

    void onDeviceUnhealthy(int deviceId, String reason);

    void onDeviceHealthy(int deviceId);
}
