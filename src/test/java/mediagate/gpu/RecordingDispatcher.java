package mediagate.gpu;

import mediagate.gpu.model.Job;
import mediagate.gpu.scheduler.JobDispatcher;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Dispatcher that remembers what it was told.
 */
public class RecordingDispatcher implements JobDispatcher {

    public final Map<String, Integer> dispatched = new ConcurrentHashMap<>();
    public final List<String> stopped = new CopyOnWriteArrayList<>();

    @Override
    public void dispatch(Job job, int deviceId) {
        dispatched.put(job.id(), deviceId);
    }

    @Override
    public void stop(String jobId) {
        stopped.add(jobId);
    }
}
