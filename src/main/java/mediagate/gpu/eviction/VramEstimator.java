package mediagate.gpu.eviction;

import mediagate.gpu.model.JobKind;
import mediagate.gpu.model.JobPayload;

/**
 * Estimates the VRAM a job needs when the producer did not state it.
 */
@FunctionalInterface
public interface VramEstimator {

    /**
     * @param kind    job kind
     * @param payload job parameters, may be null
     * @return estimated bytes, always positive
     */
    long estimate(JobKind kind, JobPayload payload);
}
