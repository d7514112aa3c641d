package mediagate.gpu.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import mediagate.gpu.api.Controller;
import mediagate.gpu.api.v1.dto.OperationResponse;
import mediagate.gpu.api.v1.dto.QuarantineRequest;
import mediagate.gpu.scheduler.GpuScheduler;
import mediagate.gpu.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Operator interventions.
 *
 * POST /api/v1/admin/jobs/{jobId}/force-release
 * POST /api/v1/admin/devices/{deviceId}/quarantine
 * POST /api/v1/admin/devices/{deviceId}/restore
 * DELETE /api/v1/admin/devices/{deviceId}
 */
public class AdminController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private static final Pattern FORCE_RELEASE_PATTERN = Pattern.compile("^/api/v1/admin/jobs/([^/]+)/force-release$");
    private static final Pattern QUARANTINE_PATTERN = Pattern.compile("^/api/v1/admin/devices/(\\d+)/quarantine$");
    private static final Pattern RESTORE_PATTERN = Pattern.compile("^/api/v1/admin/devices/(\\d+)/restore$");
    private static final Pattern DEVICE_PATTERN = Pattern.compile("^/api/v1/admin/devices/(\\d+)$");

    private final GpuScheduler scheduler;

    public AdminController(GpuScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.DELETE)) {
            return DEVICE_PATTERN.matcher(path).matches();
        }
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return FORCE_RELEASE_PATTERN.matcher(path).matches()
                || QUARANTINE_PATTERN.matcher(path).matches()
                || RESTORE_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (req.method().equals(HttpMethod.DELETE)) {
            Matcher d = DEVICE_PATTERN.matcher(path);
            if (d.matches() && scheduler.removeDevice(Integer.parseInt(d.group(1)))) {
                return ok("removed");
            }
            return ControllerResponse.notFound("unknown device");
        }

        Matcher m = FORCE_RELEASE_PATTERN.matcher(path);
        if (m.matches()) {
            String jobId = m.group(1);
            boolean released = scheduler.forceRelease(jobId);
            log.info("Operator force release of job {}: {}", jobId, released ? "released" : "nothing held");
            return ok(released ? "released" : "not_held");
        }

        m = QUARANTINE_PATTERN.matcher(path);
        if (m.matches()) {
            int deviceId = Integer.parseInt(m.group(1));
            String body = req.content().toString(StandardCharsets.UTF_8);
            String reason = body.isBlank() ? null
                    : RouterHandler.mapper().readValue(body, QuarantineRequest.class).reason();
            boolean changed = scheduler.quarantineDevice(deviceId, reason);
            return ok(changed ? "quarantined" : "already_unhealthy");
        }

        m = RESTORE_PATTERN.matcher(path);
        if (m.matches()) {
            boolean changed = scheduler.restoreDevice(Integer.parseInt(m.group(1)));
            return ok(changed ? "restored" : "already_healthy");
        }

        return ControllerResponse.notFound("unknown admin endpoint");
    }

    private ControllerResponse ok(String result) throws Exception {
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success(result)));
    }
}
