package mediagate.gpu.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import mediagate.gpu.api.Controller;
import mediagate.gpu.api.internal.v1.dto.CompleteJobRequest;
import mediagate.gpu.api.v1.dto.OperationResponse;
import mediagate.gpu.model.CompleteResult;
import mediagate.gpu.scheduler.GpuScheduler;
import mediagate.gpu.server.RouterHandler;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Executor completion callback (internal API).
 * POST /internal/v1/jobs/{jobId}/complete (idempotent)
 */
public class CompletionController implements Controller {

    private static final Pattern COMPLETE_PATTERN = Pattern.compile("^/internal/v1/jobs/([^/]+)/complete$");

    private final GpuScheduler scheduler;

    public CompletionController(GpuScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && COMPLETE_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        Matcher m = COMPLETE_PATTERN.matcher(path);
        if (!m.matches()) {
            return ControllerResponse.notFound("unknown completion endpoint");
        }
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        CompleteJobRequest request = RouterHandler.mapper().readValue(body, CompleteJobRequest.class);
        request.validate();

        CompleteResult result = scheduler.complete(m.group(1), request.success(), request.error());
        return switch (result) {
            case COMPLETED, FAILED -> respond(HttpResponseStatus.OK, OperationResponse.success(result.name().toLowerCase()));
            // repeated callback, nothing to do
            case ALREADY_TERMINAL -> respond(HttpResponseStatus.OK, OperationResponse.success("already_terminal"));
            case NOT_RUNNING -> respond(HttpResponseStatus.CONFLICT, OperationResponse.error("not_running"));
            case NOT_FOUND -> respond(HttpResponseStatus.NOT_FOUND, OperationResponse.error("job_not_found"));
        };
    }

    private ControllerResponse respond(HttpResponseStatus status, OperationResponse body) throws Exception {
        return ControllerResponse.json(status, RouterHandler.mapper().writeValueAsString(body));
    }
}
