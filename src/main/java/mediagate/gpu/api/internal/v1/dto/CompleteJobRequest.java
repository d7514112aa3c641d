package mediagate.gpu.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Executor callback body.
 * POST /internal/v1/jobs/{jobId}/complete
 */
public record CompleteJobRequest(
        @JsonProperty("success") Boolean success,
        @JsonProperty("error") String error) {

    public void validate() {
        if (success == null) {
            throw new IllegalArgumentException("success is required");
        }
    }
}
