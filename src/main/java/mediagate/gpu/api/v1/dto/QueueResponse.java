package mediagate.gpu.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import mediagate.gpu.model.PriorityTier;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Queue depth per priority tier.
 * GET /api/v1/queue
 */
public record QueueResponse(
        @JsonProperty("total") int total,
        @JsonProperty("tiers") Map<String, Integer> tiers) {

    public static QueueResponse from(Map<PriorityTier, Integer> depths) {
        Map<String, Integer> tiers = new LinkedHashMap<>();
        int total = 0;
        for (PriorityTier tier : PriorityTier.values()) {
            int depth = depths.getOrDefault(tier, 0);
            tiers.put(tier.name().toLowerCase(), depth);
            total += depth;
        }
        return new QueueResponse(total, tiers);
    }
}
