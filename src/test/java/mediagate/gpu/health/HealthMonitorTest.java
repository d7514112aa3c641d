package mediagate.gpu.health;

import mediagate.gpu.MutableClock;
import mediagate.gpu.config.DeviceSpec;
import mediagate.gpu.config.GatewayConfig;
import mediagate.gpu.model.Device;
import mediagate.gpu.registry.DeviceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HealthMonitorTest {

    private MutableClock clock;
    private DeviceRegistry registry;
    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        GatewayConfig config = GatewayConfig.defaults()
                .withClock(clock)
                .withTemperatureLimit(85)
                .withErrorThreshold(3, Duration.ofMinutes(5))
                .withRecoverySweeps(3);
        registry = new DeviceRegistry(clock, config.errorWindow());
        registry.register(new DeviceSpec(0, "gpu-0", 24_000));
        registry.register(new DeviceSpec(1, "gpu-1", 24_000));
        monitor = new HealthMonitor(registry, config);
    }

    private Device device(int id) {
        return registry.find(id).orElseThrow();
    }

    @Test
    void healthyDevicesStayHealthy() {
        registry.updateMetrics(0, 60, 70, 1_000);

        assertEquals(0, monitor.sweep());
        assertTrue(device(0).isHealthy());
    }

    @Test
    void overTemperatureQuarantines() {
        registry.updateMetrics(0, 60, 91, 1_000);

        assertEquals(1, monitor.sweep());

        assertFalse(device(0).isHealthy());
        assertTrue(device(0).unhealthyReason().startsWith("temperature"));
        assertTrue(device(1).isHealthy());
        assertEquals(0, monitor.sweep());
    }

    @Test
    void errorThresholdIsExclusive() {
        for (int i = 0; i < 3; i++) {
            registry.recordError(0);
        }
        assertEquals(0, monitor.sweep());

        registry.recordError(0);
        assertEquals(1, monitor.sweep());
        assertFalse(device(0).isHealthy());
    }

    @Test
    void recoveryNeedsConsecutiveCleanSweeps() {
        registry.updateMetrics(0, 60, 91, 1_000);
        monitor.sweep();
        registry.updateMetrics(0, 60, 70, 1_000);

        assertEquals(0, monitor.sweep());
        assertEquals(0, monitor.sweep());
        // relapse resets the count
        registry.updateMetrics(0, 60, 90, 1_000);
        assertEquals(0, monitor.sweep());
        registry.updateMetrics(0, 60, 70, 1_000);
        assertEquals(0, monitor.sweep());
        assertEquals(0, monitor.sweep());
        assertFalse(device(0).isHealthy());

        assertEquals(1, monitor.sweep());
        assertTrue(device(0).isHealthy());
    }

    @Test
    void errorsAgeOutOfTheWindow() {
        for (int i = 0; i < 4; i++) {
            registry.recordError(0);
        }
        monitor.sweep();
        assertFalse(device(0).isHealthy());

        clock.advance(Duration.ofMinutes(6));
        monitor.sweep();
        monitor.sweep();
        monitor.sweep();

        assertTrue(device(0).isHealthy());
        assertEquals(0, device(0).recentErrors());
    }

    @Test
    void manualQuarantineIsNeverLifted() {
        registry.quarantine(1, "maintenance");

        for (int i = 0; i < 5; i++) {
            assertEquals(0, monitor.sweep());
        }

        Device d = device(1);
        assertFalse(d.isHealthy());
        assertTrue(d.isManuallyQuarantined());
        assertEquals("maintenance", d.unhealthyReason());
    }
}
