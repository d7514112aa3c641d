package mediagate.gpu.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import mediagate.gpu.maintenance.DeviceSample;

/**
 * Telemetry push for one device.
 * POST /internal/v1/metrics
 */
public record MetricsRequest(
        @JsonProperty("deviceId") Integer deviceId,
        @JsonProperty("utilization") double utilization,
        @JsonProperty("temperature") double temperature,
        @JsonProperty("usedVram") long usedVram, // bytes
        @JsonProperty("errors") int errors) {

    public void validate() {
        if (deviceId == null) {
            throw new IllegalArgumentException("deviceId is required");
        }
        if (utilization < 0 || utilization > 100) {
            throw new IllegalArgumentException("utilization must be between 0 and 100");
        }
        if (usedVram < 0) {
            throw new IllegalArgumentException("usedVram must be non-negative");
        }
        if (errors < 0) {
            throw new IllegalArgumentException("errors must be non-negative");
        }
    }

    public DeviceSample toSample() {
        return new DeviceSample(deviceId, utilization, temperature, usedVram, errors);
    }
}
