package mediagate.gpu.config;

/**
 * A model preloaded on every device at startup.
 */
public record ModelSpec(String name, long vramBytes, boolean baseline) {

    public ModelSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("model name is required");
        }
        if (vramBytes <= 0) {
            throw new IllegalArgumentException("model vramBytes must be positive");
        }
    }

    /**
     * Parse {@code name:megabytes[:baseline]}.
     */
    public static ModelSpec parse(String entry) {
        String[] parts = entry.trim().split(":");
        if (parts.length < 2 || parts.length > 3) {
            throw new IllegalArgumentException("expected name:megabytes[:baseline], got '" + entry + "'");
        }
        long mb;
        try {
            mb = Long.parseLong(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid model size in '" + entry + "'", e);
        }
        boolean baseline = parts.length == 3 && "baseline".equalsIgnoreCase(parts[2].trim());
        return new ModelSpec(parts[0].trim(), mb * GatewayConfig.MB, baseline);
    }
}
