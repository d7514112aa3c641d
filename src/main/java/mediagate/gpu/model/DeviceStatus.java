package mediagate.gpu.model;

import mediagate.gpu.ledger.DeviceCapacity;

import java.util.List;

/**
 * Combined health and capacity view of one device.
 */
public record DeviceStatus(Device device, DeviceCapacity capacity, List<LoadedModel> models) {
}
