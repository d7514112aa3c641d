package mediagate.gpu.health;

import mediagate.gpu.config.GatewayConfig;
import mediagate.gpu.model.Device;
import mediagate.gpu.registry.DeviceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Periodic sweep over the device table.
 *
 * A device goes unhealthy as soon as one sweep sees it over the
 * temperature limit or over the error threshold. It comes back only after
 * the configured number of consecutive clean sweeps, and never while an
 * operator quarantine holds it.
 */
public class HealthMonitor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final DeviceRegistry registry;
    private final GatewayConfig config;
    private final Map<Integer, Integer> cleanSweeps = new ConcurrentHashMap<>();

    public HealthMonitor(DeviceRegistry registry, GatewayConfig config) {
        this.registry = registry;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Health monitor error", e);
        }
    }

    /**
     * Check every device once.
     *
     * @return number of devices whose health changed
     */
    public int sweep() {
        int changed = 0;
        for (Device device : registry.listDevices()) {
            String problem = problem(device);
            if (problem != null) {
                cleanSweeps.remove(device.id());
                if (device.isHealthy() && registry.markUnhealthy(device.id(), problem)) {
                    changed++;
                }
                continue;
            }

            if (device.isHealthy() || device.isManuallyQuarantined()) {
                cleanSweeps.remove(device.id());
                continue;
            }

            int clean = cleanSweeps.merge(device.id(), 1, Integer::sum);
            if (clean < config.recoverySweeps()) {
                log.debug("Device {} clean for {}/{} sweeps", device.id(), clean, config.recoverySweeps());
                continue;
            }
            cleanSweeps.remove(device.id());
            if (registry.markHealthy(device.id())) {
                changed++;
            }
        }
        return changed;
    }

    private String problem(Device device) {
        if (device.temperatureC() > config.temperatureLimitC()) {
            return "temperature " + device.temperatureC() + "C over limit " + config.temperatureLimitC() + "C";
        }
        if (device.recentErrors() > config.errorThreshold()) {
            return device.recentErrors() + " errors within " + config.errorWindow().toMinutes()
                    + " min, threshold " + config.errorThreshold();
        }
        return null;
    }
}
