package mediagate.gpu.eviction;

import mediagate.gpu.config.GatewayConfig;
import mediagate.gpu.model.JobKind;
import mediagate.gpu.model.JobPayload;

import java.util.function.ToLongFunction;

/**
 * Per-kind base estimate plus a linear increment for the payload's size
 * dimension: extra batch items for images, seconds of footage for video,
 * thousands of characters for speech.
 */
public class KindVramEstimator implements VramEstimator {

    static final long PER_EXTRA_IMAGE = 1500 * GatewayConfig.MB;
    static final long PER_VIDEO_SECOND = 256 * GatewayConfig.MB;
    static final long PER_1000_CHARS = 64 * GatewayConfig.MB;

    private final ToLongFunction<JobKind> base;

    public KindVramEstimator(ToLongFunction<JobKind> base) {
        this.base = base;
    }

    public KindVramEstimator(GatewayConfig config) {
        this(config::defaultVramEstimate);
    }

    @Override
    public long estimate(JobKind kind, JobPayload payload) {
        long bytes = base.applyAsLong(kind);
        if (payload instanceof JobPayload.ImagePayload image) {
            bytes += Math.max(0, image.batchSize() - 1) * PER_EXTRA_IMAGE;
        } else if (payload instanceof JobPayload.VideoPayload video) {
            bytes += (long) video.durationSeconds() * PER_VIDEO_SECOND;
        } else if (payload instanceof JobPayload.SpeechPayload speech && speech.text() != null) {
            bytes += (speech.text().length() / 1000) * PER_1000_CHARS;
        }
        return bytes;
    }
}
