package mediagate.gpu.config;

import mediagate.gpu.model.JobKind;
import mediagate.gpu.model.PriorityTier;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration holder for the GPU gateway.
 * All settings have sensible defaults.
 */
public final class GatewayConfig {

    public static final long MB = 1024L * 1024L;
    public static final long GB = 1024L * MB;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Device inventory
    private List<DeviceSpec> devices = defaultDevices(4, 24 * GB);
    private List<ModelSpec> residentModels = List.of();
    private long memoryHeadroomBytes = 0;

    // Admission settings
    private int maxAdmissionAttempts = 3;
    private int drainSkipLimit = 8;
    private final Map<JobKind, Long> defaultVramEstimates = new EnumMap<>(JobKind.class);
    private final Map<JobKind, List<Integer>> preferredDevices = new EnumMap<>(JobKind.class);

    // Queue settings
    private final Map<PriorityTier, Integer> queueCapacity = new EnumMap<>(PriorityTier.class);
    private Duration maxQueueWait = Duration.ofMinutes(10);
    private Duration queueTimeoutReaperInterval = Duration.ofSeconds(5);

    // Health settings
    private double temperatureLimitC = 85.0;
    private int errorThreshold = 10;
    private Duration errorWindow = Duration.ofMinutes(5);
    private double utilizationWarnPct = 95.0;
    private int recoverySweeps = 3;
    private Duration healthCheckInterval = Duration.ofSeconds(15);
    private Duration metricsInterval = Duration.ofSeconds(15);

    // VRAM optimizer settings
    private double rebalanceThreshold = 0.20;
    private Duration rebalanceInterval = Duration.ofSeconds(30);
    private Duration idleModelTtl = Duration.ofHours(1);

    private Clock clock = Clock.systemUTC();

    private GatewayConfig() {
        defaultVramEstimates.put(JobKind.IMAGE, 12000 * MB);
        defaultVramEstimates.put(JobKind.SPEECH, 8000 * MB);
        defaultVramEstimates.put(JobKind.VIDEO, 16000 * MB);

        queueCapacity.put(PriorityTier.REALTIME, 100);
        queueCapacity.put(PriorityTier.HIGH, 200);
        queueCapacity.put(PriorityTier.NORMAL, 500);
        queueCapacity.put(PriorityTier.BATCH, 1000);
    }

    public static GatewayConfig defaults() {
        return new GatewayConfig();
    }

    public static GatewayConfig fromEnv() {
        GatewayConfig config = new GatewayConfig();

        String port = System.getenv("MEDIAGATE_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String deviceCount = System.getenv("MEDIAGATE_DEVICE_COUNT");
        String deviceVramMb = System.getenv("MEDIAGATE_DEVICE_VRAM_MB");
        if (isSet(deviceCount) || isSet(deviceVramMb)) {
            int count = isSet(deviceCount) ? Integer.parseInt(deviceCount.trim()) : 4;
            long vram = isSet(deviceVramMb) ? Long.parseLong(deviceVramMb.trim()) * MB : 24 * GB;
            config.devices = defaultDevices(count, vram);
        }

        String models = System.getenv("MEDIAGATE_RESIDENT_MODELS");
        if (isSet(models)) {
            List<ModelSpec> parsed = new ArrayList<>();
            for (String entry : models.split(",")) {
                if (!entry.isBlank()) {
                    parsed.add(ModelSpec.parse(entry));
                }
            }
            config.residentModels = List.copyOf(parsed);
        }

        String headroomMb = System.getenv("MEDIAGATE_HEADROOM_MB");
        if (isSet(headroomMb)) {
            config.memoryHeadroomBytes = Long.parseLong(headroomMb.trim()) * MB;
        }

        String maxWait = System.getenv("MEDIAGATE_MAX_QUEUE_WAIT_SEC");
        if (isSet(maxWait)) {
            config.maxQueueWait = Duration.ofSeconds(Long.parseLong(maxWait.trim()));
        }

        String tempLimit = System.getenv("MEDIAGATE_TEMP_LIMIT");
        if (isSet(tempLimit)) {
            config.temperatureLimitC = Double.parseDouble(tempLimit.trim());
        }

        for (JobKind kind : JobKind.values()) {
            String affinity = System.getenv("MEDIAGATE_AFFINITY_" + kind.name());
            if (isSet(affinity)) {
                config.preferredDevices.put(kind, parseIds(affinity));
            }
        }

        return config;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    private static List<Integer> parseIds(String csv) {
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Integer::valueOf)
                .toList();
    }

    private static List<DeviceSpec> defaultDevices(int count, long vramBytes) {
        List<DeviceSpec> specs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            specs.add(new DeviceSpec(i, "RTX 4090-" + (i + 1), vramBytes));
        }
        return List.copyOf(specs);
    }

    // Getters
    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public List<DeviceSpec> devices() {
        return devices;
    }

    public List<ModelSpec> residentModels() {
        return residentModels;
    }

    public long memoryHeadroomBytes() {
        return memoryHeadroomBytes;
    }

    public int maxAdmissionAttempts() {
        return maxAdmissionAttempts;
    }

    public int drainSkipLimit() {
        return drainSkipLimit;
    }

    public long defaultVramEstimate(JobKind kind) {
        return defaultVramEstimates.get(kind);
    }

    public List<Integer> preferredDevices(JobKind kind) {
        return preferredDevices.getOrDefault(kind, List.of());
    }

    public int queueCapacity(PriorityTier tier) {
        return queueCapacity.get(tier);
    }

    public Duration maxQueueWait() {
        return maxQueueWait;
    }

    public Duration queueTimeoutReaperInterval() {
        return queueTimeoutReaperInterval;
    }

    public double temperatureLimitC() {
        return temperatureLimitC;
    }

    public int errorThreshold() {
        return errorThreshold;
    }

    public Duration errorWindow() {
        return errorWindow;
    }

    public double utilizationWarnPct() {
        return utilizationWarnPct;
    }

    public int recoverySweeps() {
        return recoverySweeps;
    }

    public Duration healthCheckInterval() {
        return healthCheckInterval;
    }

    public Duration metricsInterval() {
        return metricsInterval;
    }

    public double rebalanceThreshold() {
        return rebalanceThreshold;
    }

    public Duration rebalanceInterval() {
        return rebalanceInterval;
    }

    public Duration idleModelTtl() {
        return idleModelTtl;
    }

    public Clock clock() {
        return clock;
    }

    // Fluent setters for testing/customization
    public GatewayConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public GatewayConfig withDevices(List<DeviceSpec> devices) {
        this.devices = List.copyOf(devices);
        return this;
    }

    public GatewayConfig withResidentModels(List<ModelSpec> models) {
        this.residentModels = List.copyOf(models);
        return this;
    }

    public GatewayConfig withMemoryHeadroom(long bytes) {
        this.memoryHeadroomBytes = bytes;
        return this;
    }

    public GatewayConfig withMaxAdmissionAttempts(int attempts) {
        this.maxAdmissionAttempts = attempts;
        return this;
    }

    public GatewayConfig withDrainSkipLimit(int limit) {
        this.drainSkipLimit = limit;
        return this;
    }

    public GatewayConfig withDefaultVramEstimate(JobKind kind, long bytes) {
        this.defaultVramEstimates.put(kind, bytes);
        return this;
    }

    public GatewayConfig withPreferredDevices(JobKind kind, List<Integer> deviceIds) {
        this.preferredDevices.put(kind, List.copyOf(deviceIds));
        return this;
    }

    public GatewayConfig withQueueCapacity(PriorityTier tier, int capacity) {
        this.queueCapacity.put(tier, capacity);
        return this;
    }

    public GatewayConfig withMaxQueueWait(Duration maxWait) {
        this.maxQueueWait = maxWait;
        return this;
    }

    public GatewayConfig withTemperatureLimit(double celsius) {
        this.temperatureLimitC = celsius;
        return this;
    }

    public GatewayConfig withErrorThreshold(int threshold, Duration window) {
        this.errorThreshold = threshold;
        this.errorWindow = window;
        return this;
    }

    public GatewayConfig withRecoverySweeps(int sweeps) {
        this.recoverySweeps = sweeps;
        return this;
    }

    public GatewayConfig withHealthCheckInterval(Duration interval) {
        this.healthCheckInterval = interval;
        return this;
    }

    public GatewayConfig withRebalanceThreshold(double threshold) {
        this.rebalanceThreshold = threshold;
        return this;
    }

    public GatewayConfig withIdleModelTtl(Duration ttl) {
        this.idleModelTtl = ttl;
        return this;
    }

    public GatewayConfig withClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /** Tier capacities, for logging */
    public Map<PriorityTier, Integer> queueCapacities() {
        return Collections.unmodifiableMap(queueCapacity);
    }

    @Override
    public String toString() {
        return "GatewayConfig{" +
                "serverPort=" + serverPort +
                ", devices=" + devices.size() +
                ", residentModels=" + residentModels.size() +
                ", headroom=" + memoryHeadroomBytes +
                ", maxQueueWait=" + maxQueueWait +
                ", temperatureLimitC=" + temperatureLimitC +
                '}';
    }
}
