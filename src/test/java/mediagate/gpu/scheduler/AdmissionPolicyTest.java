package mediagate.gpu.scheduler;

import mediagate.gpu.ledger.DeviceCapacity;
import mediagate.gpu.model.Device;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionPolicyTest {

    private static Device device(int id, double utilization, boolean healthy) {
        return Device.builder()
                .id(id)
                .name("gpu-" + id)
                .totalVram(20_000)
                .utilizationPct(utilization)
                .healthy(healthy)
                .build();
    }

    private static DeviceCapacity capacity(int id, long free) {
        return new DeviceCapacity(id, 20_000, 20_000 - free, 0, free, 0, true);
    }

    @Test
    void mostFreeVramWins() {
        List<Device> devices = List.of(device(0, 0, true), device(1, 0, true));
        Map<Integer, DeviceCapacity> cap = Map.of(0, capacity(0, 8_000), 1, capacity(1, 10_000));

        assertEquals(1, AdmissionPolicy.select(5_000, devices, cap, List.of()).orElseThrow());
    }

    @Test
    void utilizationThenIdBreakTies() {
        List<Device> devices = List.of(device(0, 50, true), device(1, 10, true), device(2, 10, true));
        Map<Integer, DeviceCapacity> cap = Map.of(
                0, capacity(0, 10_000), 1, capacity(1, 10_000), 2, capacity(2, 10_000));

        assertEquals(1, AdmissionPolicy.select(5_000, devices, cap, List.of()).orElseThrow());
    }

    @Test
    void skipsUnhealthyClosedAndFullDevices() {
        List<Device> devices = List.of(device(0, 0, false), device(1, 0, true), device(2, 0, true));
        Map<Integer, DeviceCapacity> cap = Map.of(
                0, capacity(0, 20_000),
                1, new DeviceCapacity(1, 20_000, 0, 0, 20_000, 0, false),
                2, capacity(2, 4_000));

        assertTrue(AdmissionPolicy.select(5_000, devices, cap, List.of()).isEmpty());
    }

    @Test
    void preferredDeviceBeatsMoreFreeOne() {
        List<Device> devices = List.of(device(0, 0, true), device(1, 0, true));
        Map<Integer, DeviceCapacity> cap = Map.of(0, capacity(0, 20_000), 1, capacity(1, 6_000));

        assertEquals(1, AdmissionPolicy.select(5_000, devices, cap, List.of(1)).orElseThrow());
        // falls back when the preferred device cannot take it
        assertEquals(0, AdmissionPolicy.select(8_000, devices, cap, List.of(1)).orElseThrow());
    }

    @Test
    void detectsJobsThatOnlyFitQuarantinedDevices() {
        List<Device> devices = List.of(device(0, 0, false), device(1, 0, true));
        Map<Integer, DeviceCapacity> cap = Map.of(
                0, new DeviceCapacity(0, 40_000, 0, 0, 40_000, 0, false),
                1, capacity(1, 20_000));

        assertTrue(AdmissionPolicy.onlyQuarantinedDevicesFit(30_000, devices, cap));
        assertFalse(AdmissionPolicy.onlyQuarantinedDevicesFit(10_000, devices, cap));
    }
}
