package mediagate.gpu.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Strongly typed parameters of a job, resolved at the API boundary.
 * The {@code kind} property selects the variant on the wire.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = JobPayload.ImagePayload.class, name = "image"),
        @JsonSubTypes.Type(value = JobPayload.VideoPayload.class, name = "video"),
        @JsonSubTypes.Type(value = JobPayload.SpeechPayload.class, name = "speech")
})
public interface JobPayload {

    JobKind kind();

    /** Resident model the job runs on, or null when the executor picks one */
    String model();

    void validate();

    record ImagePayload(
            @JsonProperty("model") String model,
            @JsonProperty("prompt") String prompt,
            @JsonProperty("width") int width,
            @JsonProperty("height") int height,
            @JsonProperty("batchSize") int batchSize) implements JobPayload {

        @Override
        public JobKind kind() {
            return JobKind.IMAGE;
        }

        @Override
        public void validate() {
            if (prompt == null || prompt.isBlank()) {
                throw new IllegalArgumentException("prompt is required");
            }
            if (width <= 0 || height <= 0) {
                throw new IllegalArgumentException("width and height must be positive");
            }
            if (batchSize < 0) {
                throw new IllegalArgumentException("batchSize must be non-negative");
            }
        }
    }

    record VideoPayload(
            @JsonProperty("model") String model,
            @JsonProperty("prompt") String prompt,
            @JsonProperty("durationSeconds") int durationSeconds,
            @JsonProperty("fps") int fps) implements JobPayload {

        @Override
        public JobKind kind() {
            return JobKind.VIDEO;
        }

        @Override
        public void validate() {
            if (prompt == null || prompt.isBlank()) {
                throw new IllegalArgumentException("prompt is required");
            }
            if (durationSeconds <= 0) {
                throw new IllegalArgumentException("durationSeconds must be positive");
            }
            if (fps < 0) {
                throw new IllegalArgumentException("fps must be non-negative");
            }
        }
    }

    record SpeechPayload(
            @JsonProperty("model") String model,
            @JsonProperty("text") String text,
            @JsonProperty("voice") String voice) implements JobPayload {

        @Override
        public JobKind kind() {
            return JobKind.SPEECH;
        }

        @Override
        public void validate() {
            if (text == null || text.isBlank()) {
                throw new IllegalArgumentException("text is required");
            }
        }
    }
}
