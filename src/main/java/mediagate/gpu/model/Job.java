package mediagate.gpu.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing a GPU-bound media generation job.
 * State changes produce a new instance through {@link #toBuilder()}.
 */
public final class Job {
    private final String id;
    private final JobKind kind;
    private final JobPayload payload; // null when the producer only needs capacity accounting
    private final long vramEstimate; // bytes
    private final PriorityTier tier;
    private final JobState state;
    private final Integer deviceId; // device holding the reservation, or null
    private final int admissions;
    private final String errorMessage;
    private final Instant submittedAt;
    private final Instant enqueuedAt;
    private final Instant startedAt;
    private final Instant finishedAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.payload = builder.payload;
        this.vramEstimate = builder.vramEstimate;
        this.tier = Objects.requireNonNull(builder.tier, "tier is required");
        this.state = Objects.requireNonNull(builder.state, "state is required");
        this.deviceId = builder.deviceId;
        this.admissions = builder.admissions;
        this.errorMessage = builder.errorMessage;
        this.submittedAt = builder.submittedAt;
        this.enqueuedAt = builder.enqueuedAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public JobKind kind() {
        return kind;
    }

    public JobPayload payload() {
        return payload;
    }

    public long vramEstimate() {
        return vramEstimate;
    }

    public PriorityTier tier() {
        return tier;
    }

    public JobState state() {
        return state;
    }

    public Integer deviceId() {
        return deviceId;
    }

    public int admissions() {
        return admissions;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Instant submittedAt() {
        return submittedAt;
    }

    public Instant enqueuedAt() {
        return enqueuedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    /** Model named by the payload, if any */
    public String modelName() {
        return payload == null ? null : payload.model();
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .kind(kind)
                .payload(payload)
                .vramEstimate(vramEstimate)
                .tier(tier)
                .state(state)
                .deviceId(deviceId)
                .admissions(admissions)
                .errorMessage(errorMessage)
                .submittedAt(submittedAt)
                .enqueuedAt(enqueuedAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private JobKind kind;
        private JobPayload payload;
        private long vramEstimate;
        private PriorityTier tier = PriorityTier.NORMAL;
        private JobState state = JobState.QUEUED;
        private Integer deviceId;
        private int admissions = 0;
        private String errorMessage;
        private Instant submittedAt;
        private Instant enqueuedAt;
        private Instant startedAt;
        private Instant finishedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(JobKind kind) {
            this.kind = kind;
            return this;
        }

        /** Sets the payload and, when not yet set, the kind it carries */
        public Builder payload(JobPayload payload) {
            this.payload = payload;
            if (payload != null && this.kind == null) {
                this.kind = payload.kind();
            }
            return this;
        }

        public Builder vramEstimate(long vramEstimate) {
            this.vramEstimate = vramEstimate;
            return this;
        }

        public Builder tier(PriorityTier tier) {
            this.tier = tier;
            return this;
        }

        public Builder state(JobState state) {
            this.state = state;
            return this;
        }

        public Builder deviceId(Integer deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder admissions(int admissions) {
            this.admissions = admissions;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public Builder enqueuedAt(Instant enqueuedAt) {
            this.enqueuedAt = enqueuedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Job build() {
            if (payload != null && kind != null && payload.kind() != kind) {
                throw new IllegalArgumentException("payload kind " + payload.kind() + " does not match job kind " + kind);
            }
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', kind=" + kind + ", tier=" + tier + ", state=" + state
                + ", vram=" + vramEstimate + ", device=" + deviceId + "}";
    }
}
