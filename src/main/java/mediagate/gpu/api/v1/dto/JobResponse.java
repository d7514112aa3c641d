package mediagate.gpu.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import mediagate.gpu.model.Job;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Response DTO for job status.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("id") String id,
        @JsonProperty("kind") String kind,
        @JsonProperty("tier") String tier,
        @JsonProperty("state") String state,
        @JsonProperty("vramEstimateMb") long vramEstimateMb,
        @JsonProperty("deviceId") Integer deviceId,
        @JsonProperty("queuePosition") Integer queuePosition,
        @JsonProperty("estimatedWaitSeconds") Long estimatedWaitSeconds,
        @JsonProperty("admissions") int admissions,
        @JsonProperty("error") String error,
        @JsonProperty("submittedAt") Instant submittedAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt) {

    public static JobResponse from(Job job, OptionalInt position) {
        return from(job, position, Optional.empty());
    }

    public static JobResponse from(Job job, OptionalInt position, Optional<Duration> estimatedWait) {
        return new JobResponse(
                job.id(),
                job.kind().name().toLowerCase(),
                job.tier().name().toLowerCase(),
                job.state().name().toLowerCase(),
                job.vramEstimate() / (1024 * 1024),
                job.deviceId(),
                position.isPresent() ? position.getAsInt() : null,
                estimatedWait.map(Duration::toSeconds).orElse(null),
                job.admissions(),
                job.errorMessage(),
                job.submittedAt(),
                job.startedAt(),
                job.finishedAt());
    }
}
