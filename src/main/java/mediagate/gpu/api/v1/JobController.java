package mediagate.gpu.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import mediagate.gpu.api.Controller;
import mediagate.gpu.api.v1.dto.JobResponse;
import mediagate.gpu.api.v1.dto.OperationResponse;
import mediagate.gpu.api.v1.dto.SubmitJobRequest;
import mediagate.gpu.model.CancelResult;
import mediagate.gpu.model.Job;
import mediagate.gpu.scheduler.GpuScheduler;
import mediagate.gpu.server.RouterHandler;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for jobs (public API).
 *
 * POST /api/v1/jobs - Submit a job
 * GET /api/v1/jobs/{jobId} - Job status
 * POST /api/v1/jobs/{jobId}/cancel - Cancel a job
 */
public class JobController implements Controller {

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern CANCEL_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/cancel$");

    private final GpuScheduler scheduler;

    public JobController(GpuScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return JOBS_PATTERN.matcher(path).matches() || CANCEL_PATTERN.matcher(path).matches();
        }
        return method.equals(HttpMethod.GET) && JOB_BY_ID_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (req.method().equals(HttpMethod.POST) && JOBS_PATTERN.matcher(path).matches()) {
            return handleSubmit(req);
        }

        Matcher cancelMatcher = CANCEL_PATTERN.matcher(path);
        if (req.method().equals(HttpMethod.POST) && cancelMatcher.matches()) {
            return handleCancel(cancelMatcher.group(1));
        }

        Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
        if (req.method().equals(HttpMethod.GET) && jobMatcher.matches()) {
            return handleGetJob(jobMatcher.group(1));
        }

        return ControllerResponse.notFound("unknown job endpoint");
    }

    /**
     * POST /api/v1/jobs. Answers 202 with the stored job: it may already be
     * running, queued, or failed with a reason.
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        SubmitJobRequest request = RouterHandler.mapper().readValue(body, SubmitJobRequest.class);
        request.validate();

        Job job = scheduler.submit(request.toJob());
        JobResponse response = JobResponse.from(job, scheduler.queuePosition(job.id()),
                scheduler.estimatedWait(job.id()));
        return ControllerResponse.json(HttpResponseStatus.ACCEPTED,
                RouterHandler.mapper().writeValueAsString(response));
    }

    private ControllerResponse handleGetJob(String jobId) throws Exception {
        Optional<Job> job = scheduler.status(jobId);
        if (job.isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }
        JobResponse response = JobResponse.from(job.get(), scheduler.queuePosition(jobId),
                scheduler.estimatedWait(jobId));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private ControllerResponse handleCancel(String jobId) throws Exception {
        CancelResult result = scheduler.cancel(jobId);
        return switch (result) {
            case CANCELLED_QUEUED, CANCELLED_RUNNING -> ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(OperationResponse.success(result.name().toLowerCase())));
            case ALREADY_TERMINAL -> ControllerResponse.json(HttpResponseStatus.CONFLICT,
                    RouterHandler.mapper().writeValueAsString(OperationResponse.error("already_terminal")));
            case NOT_FOUND -> ControllerResponse.notFound("job not found");
        };
    }
}
