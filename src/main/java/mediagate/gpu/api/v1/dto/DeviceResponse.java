package mediagate.gpu.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import mediagate.gpu.ledger.DeviceCapacity;
import mediagate.gpu.model.Device;
import mediagate.gpu.model.DeviceStatus;
import mediagate.gpu.model.LoadedModel;

import java.util.List;

/**
 * One row of the device table.
 * GET /api/v1/devices
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeviceResponse(
        @JsonProperty("id") int id,
        @JsonProperty("name") String name,
        @JsonProperty("totalVramMb") long totalVramMb,
        @JsonProperty("freeVramMb") long freeVramMb,
        @JsonProperty("reservedVramMb") long reservedVramMb,
        @JsonProperty("residentVramMb") long residentVramMb,
        @JsonProperty("usedVramMb") long usedVramMb,
        @JsonProperty("utilization") double utilization,
        @JsonProperty("temperature") double temperature,
        @JsonProperty("healthy") boolean healthy,
        @JsonProperty("reason") String reason,
        @JsonProperty("jobs") int jobs,
        @JsonProperty("models") List<String> models) {

    private static final long MB = 1024L * 1024L;

    public static DeviceResponse from(DeviceStatus status) {
        Device d = status.device();
        DeviceCapacity c = status.capacity();
        return new DeviceResponse(
                d.id(),
                d.name(),
                d.totalVram() / MB,
                c == null ? 0 : c.freeBytes() / MB,
                c == null ? 0 : c.reservedBytes() / MB,
                c == null ? 0 : c.residentBytes() / MB,
                d.usedVram() / MB,
                d.utilizationPct(),
                d.temperatureC(),
                d.isHealthy(),
                d.unhealthyReason(),
                c == null ? 0 : c.reservations(),
                status.models().stream().map(LoadedModel::name).toList());
    }
}
