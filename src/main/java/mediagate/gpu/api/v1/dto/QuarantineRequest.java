package mediagate.gpu.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional body of POST /api/v1/admin/devices/{id}/quarantine
 */
public record QuarantineRequest(@JsonProperty("reason") String reason) {
}
