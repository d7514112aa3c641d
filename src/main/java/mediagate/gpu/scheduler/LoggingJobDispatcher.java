package mediagate.gpu.scheduler;

import mediagate.gpu.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatcher for deployments where executors discover their work by
 * polling job status. Records the current assignment of every running job.
 */
public class LoggingJobDispatcher implements JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(LoggingJobDispatcher.class);

    private final Map<String, Integer> assignments = new ConcurrentHashMap<>();

    @Override
    public void dispatch(Job job, int deviceId) {
        assignments.put(job.id(), deviceId);
        log.info("Job {} ({}, {}) dispatched to device {}", job.id(), job.kind(), job.tier(), deviceId);
    }

    @Override
    public void stop(String jobId) {
        Integer deviceId = assignments.remove(jobId);
        if (deviceId != null) {
            log.info("Job {} asked to stop on device {}", jobId, deviceId);
        }
    }

    /** Device a job was last dispatched to and not stopped on */
    public Integer assignment(String jobId) {
        return assignments.get(jobId);
    }
}
