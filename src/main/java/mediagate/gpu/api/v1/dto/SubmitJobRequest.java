package mediagate.gpu.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import mediagate.gpu.config.GatewayConfig;
import mediagate.gpu.model.Job;
import mediagate.gpu.model.JobKind;
import mediagate.gpu.model.JobPayload;
import mediagate.gpu.model.PriorityTier;
import mediagate.gpu.scheduler.GpuScheduler;

import java.util.Locale;

/**
 * Request DTO for submitting a job.
 * POST /api/v1/jobs
 *
 * {@code kind} may be omitted when the payload carries it.
 * {@code vramEstimateMb} may be omitted to let the gateway estimate.
 */
public record SubmitJobRequest(
        @JsonProperty("kind") String kind,
        @JsonProperty("tier") String tier,
        @JsonProperty("vramEstimateMb") Long vramEstimateMb,
        @JsonProperty("payload") JobPayload payload) {

    public void validate() {
        if ((kind == null || kind.isBlank()) && payload == null) {
            throw new IllegalArgumentException("kind or payload is required");
        }
        if (vramEstimateMb != null && vramEstimateMb < 0) {
            throw new IllegalArgumentException("vramEstimateMb must be non-negative");
        }
        if (kind != null && !kind.isBlank()) {
            JobKind parsed = parseKind();
            if (payload != null && parsed != payload.kind()) {
                throw new IllegalArgumentException("kind " + kind + " does not match payload kind " + payload.kind());
            }
        }
        PriorityTier.parse(tier);
        if (payload != null) {
            payload.validate();
        }
    }

    /** Build a fresh job with a new id */
    public Job toJob() {
        return Job.builder()
                .id(GpuScheduler.newJobId())
                .kind(kind == null || kind.isBlank() ? payload.kind() : parseKind())
                .payload(payload)
                .vramEstimate(vramEstimateMb == null ? 0 : vramEstimateMb * GatewayConfig.MB)
                .tier(PriorityTier.parse(tier))
                .build();
    }

    private JobKind parseKind() {
        try {
            return JobKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown job kind: " + kind);
        }
    }
}
