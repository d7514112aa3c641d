package mediagate.gpu.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of one GPU: fixed identity plus the live metrics
 * last reported by the metrics collector.
 */
public final class Device {
    private final int id;
    private final String name;
    private final long totalVram; // bytes
    private final long usedVram; // bytes, as reported by device telemetry
    private final double utilizationPct;
    private final double temperatureC;
    private final boolean healthy;
    private final String unhealthyReason;
    private final boolean manuallyQuarantined;
    private final int recentErrors;
    private final Set<Integer> nvlinkPeers;
    private final Instant lastMetricsAt;

    private Device(Builder builder) {
        if (builder.totalVram <= 0) {
            throw new IllegalArgumentException("totalVram must be positive");
        }
        this.id = builder.id;
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.totalVram = builder.totalVram;
        this.usedVram = builder.usedVram;
        this.utilizationPct = builder.utilizationPct;
        this.temperatureC = builder.temperatureC;
        this.healthy = builder.healthy;
        this.unhealthyReason = builder.unhealthyReason;
        this.manuallyQuarantined = builder.manuallyQuarantined;
        this.recentErrors = builder.recentErrors;
        this.nvlinkPeers = Set.copyOf(builder.nvlinkPeers);
        this.lastMetricsAt = builder.lastMetricsAt;
    }

    // Getters
    public int id() {
        return id;
    }

    public String name() {
        return name;
    }

    public long totalVram() {
        return totalVram;
    }

    public long usedVram() {
        return usedVram;
    }

    public double utilizationPct() {
        return utilizationPct;
    }

    public double temperatureC() {
        return temperatureC;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public String unhealthyReason() {
        return unhealthyReason;
    }

    public boolean isManuallyQuarantined() {
        return manuallyQuarantined;
    }

    public int recentErrors() {
        return recentErrors;
    }

    public Set<Integer> nvlinkPeers() {
        return nvlinkPeers;
    }

    public Instant lastMetricsAt() {
        return lastMetricsAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .totalVram(totalVram)
                .usedVram(usedVram)
                .utilizationPct(utilizationPct)
                .temperatureC(temperatureC)
                .healthy(healthy)
                .unhealthyReason(unhealthyReason)
                .manuallyQuarantined(manuallyQuarantined)
                .recentErrors(recentErrors)
                .nvlinkPeers(nvlinkPeers)
                .lastMetricsAt(lastMetricsAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int id;
        private String name;
        private long totalVram;
        private long usedVram;
        private double utilizationPct;
        private double temperatureC;
        private boolean healthy = true;
        private String unhealthyReason;
        private boolean manuallyQuarantined;
        private int recentErrors;
        private Set<Integer> nvlinkPeers = Set.of();
        private Instant lastMetricsAt;

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder totalVram(long totalVram) {
            this.totalVram = totalVram;
            return this;
        }

        public Builder usedVram(long usedVram) {
            this.usedVram = usedVram;
            return this;
        }

        public Builder utilizationPct(double utilizationPct) {
            this.utilizationPct = utilizationPct;
            return this;
        }

        public Builder temperatureC(double temperatureC) {
            this.temperatureC = temperatureC;
            return this;
        }

        public Builder healthy(boolean healthy) {
            this.healthy = healthy;
            return this;
        }

        public Builder unhealthyReason(String unhealthyReason) {
            this.unhealthyReason = unhealthyReason;
            return this;
        }

        public Builder manuallyQuarantined(boolean manuallyQuarantined) {
            this.manuallyQuarantined = manuallyQuarantined;
            return this;
        }

        public Builder recentErrors(int recentErrors) {
            this.recentErrors = recentErrors;
            return this;
        }

        public Builder nvlinkPeers(Set<Integer> nvlinkPeers) {
            this.nvlinkPeers = nvlinkPeers == null ? Set.of() : nvlinkPeers;
            return this;
        }

        public Builder lastMetricsAt(Instant lastMetricsAt) {
            this.lastMetricsAt = lastMetricsAt;
            return this;
        }

        public Device build() {
            return new Device(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Device device))
            return false;
        return id == device.id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return "Device{id=" + id + ", name='" + name + "', healthy=" + healthy + ", totalVram=" + totalVram + "}";
    }
}
