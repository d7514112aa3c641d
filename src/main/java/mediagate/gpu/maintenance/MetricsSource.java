package mediagate.gpu.maintenance;

import java.util.List;

/**
 * Device-level telemetry polled by {@link MetricsCollector}.
 */
@FunctionalInterface
public interface MetricsSource {

    List<DeviceSample> sample();
}
