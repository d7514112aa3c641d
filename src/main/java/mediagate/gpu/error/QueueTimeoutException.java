package mediagate.gpu.error;

import java.time.Duration;

/**
 * A queued job waited longer than the configured maximum.
 */
public class QueueTimeoutException extends GatewayException {

    private final String jobId;

    public QueueTimeoutException(String jobId, Duration waited, Duration limit) {
        super("queue timeout: waited " + waited.toSeconds() + "s, limit " + limit.toSeconds() + "s");
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
