package mediagate.gpu.maintenance;

import mediagate.gpu.config.GatewayConfig;
import mediagate.gpu.error.UnknownDeviceException;
import mediagate.gpu.registry.DeviceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Feeds telemetry into the device registry, either polled from a
 * {@link MetricsSource} on a schedule or pushed over HTTP.
 */
public class MetricsCollector implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

    private final DeviceRegistry registry;
    private final MetricsSource source;
    private final GatewayConfig config;

    public MetricsCollector(DeviceRegistry registry, MetricsSource source, GatewayConfig config) {
        this.registry = registry;
        this.source = source;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            collect();
        } catch (Exception e) {
            log.error("Metrics collector error", e);
        }
    }

    /**
     * Poll the source once. A malformed sample is logged and skipped; the
     * rest of the batch is still applied.
     *
     * @return number of samples applied
     */
    public int collect() {
        List<DeviceSample> samples = source.sample();
        int applied = 0;
        for (DeviceSample sample : samples) {
            try {
                if (ingest(sample)) {
                    applied++;
                }
            } catch (IllegalArgumentException e) {
                log.warn("Malformed metrics for device {} skipped: {}", sample.deviceId(), e.getMessage());
            }
        }
        return applied;
    }

    /**
     * Apply one sample. Samples for unknown devices are dropped since
     * telemetry can race with device removal.
     *
     * @return false if the device is unknown
     * @throws IllegalArgumentException if the sample is malformed
     */
    public boolean ingest(DeviceSample sample) {
        if (sample.errors() < 0) {
            throw new IllegalArgumentException("errors must be non-negative");
        }
        try {
            registry.updateMetrics(sample.deviceId(), sample.utilization(), sample.temperature(), sample.usedVram());
            for (int i = 0; i < sample.errors(); i++) {
                registry.recordError(sample.deviceId());
            }
        } catch (UnknownDeviceException e) {
            log.warn("Metrics for unknown device {} ignored", sample.deviceId());
            return false;
        }

        if (sample.utilization() >= config.utilizationWarnPct()) {
            log.warn("Device {} utilization at {}%", sample.deviceId(), sample.utilization());
        }
        if (sample.temperature() > config.temperatureLimitC()) {
            log.warn("Device {} temperature {}C over limit {}C", sample.deviceId(), sample.temperature(),
                    config.temperatureLimitC());
        }
        return true;
    }
}
