package mediagate.gpu.maintenance;

/**
 * One telemetry reading for a device.
 *
 * @param utilization percent, 0 to 100
 * @param usedVram    bytes in use as seen by the driver
 * @param errors      device errors observed since the previous sample
 */
public record DeviceSample(int deviceId, double utilization, double temperature, long usedVram, int errors) {
}
