package mediagate.gpu.scheduler;

import mediagate.gpu.model.Job;
import mediagate.gpu.model.JobKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LoggingJobDispatcherTest {

    @Test
    void tracksAssignmentUntilStopped() {
        LoggingJobDispatcher dispatcher = new LoggingJobDispatcher();
        Job job = Job.builder().id("job-1").kind(JobKind.VIDEO).vramEstimate(1_000).build();

        dispatcher.dispatch(job, 2);
        assertEquals(2, dispatcher.assignment("job-1"));

        dispatcher.stop("job-1");
        assertNull(dispatcher.assignment("job-1"));
        dispatcher.stop("job-1");
    }
}
