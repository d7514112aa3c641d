package mediagate.gpu.scheduler;

import mediagate.gpu.model.Job;

/**
 * Hands admitted jobs to the external executor. Called outside every
 * scheduler lock; implementations must not block.
 */
public interface JobDispatcher {

    /**
     * Start executing a job on a device. The executor reports the outcome
     * through {@link GpuScheduler#complete}.
     */
    void dispatch(Job job, int deviceId);

    /**
     * Ask the executor to stop a job. Cooperative: the capacity is already
     * released when this is called.
     */
    void stop(String jobId);
}
