package mediagate.gpu.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("devices") int devices,
        @JsonProperty("healthyDevices") int healthyDevices,
        @JsonProperty("queuedJobs") int queuedJobs,
        @JsonProperty("runningJobs") int runningJobs) {

    /** Healthy while at least one device accepts work */
    public static HealthResponse of(String uptime, String version, int devices, int healthyDevices,
            int queuedJobs, int runningJobs) {
        String status = healthyDevices > 0 ? "healthy" : "degraded";
        return new HealthResponse(status, uptime, version, devices, healthyDevices, queuedJobs, runningJobs);
    }

    @JsonIgnore
    public boolean isHealthy() {
        return "healthy".equals(status);
    }
}
