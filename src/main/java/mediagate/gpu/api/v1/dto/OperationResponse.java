package mediagate.gpu.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for state-changing operations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("result") String result,
        @JsonProperty("error") String error) {

    public static OperationResponse success(String result) {
        return new OperationResponse(true, result, null);
    }

    public static OperationResponse error(String error) {
        return new OperationResponse(false, null, error);
    }
}
