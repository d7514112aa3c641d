package mediagate.gpu.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import mediagate.gpu.api.Controller;
import mediagate.gpu.api.v1.dto.HealthResponse;
import mediagate.gpu.model.DeviceStatus;
import mediagate.gpu.scheduler.GpuScheduler;
import mediagate.gpu.server.RouterHandler;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.List;

/**
 * Health check controller.
 * GET /api/v1/health
 *
 * Answers 503 when no device accepts work.
 */
public class HealthController implements Controller {

    private static final String VERSION = "1.0.0";

    private final GpuScheduler scheduler;

    public HealthController(GpuScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        List<DeviceStatus> devices = scheduler.deviceTable();
        int healthy = (int) devices.stream().filter(d -> d.device().isHealthy()).count();

        HealthResponse response = HealthResponse.of(formatUptime(), VERSION, devices.size(), healthy,
                scheduler.queueSize(), scheduler.runningJobs());

        return ControllerResponse.json(
                response.isHealthy() ? HttpResponseStatus.OK : HttpResponseStatus.SERVICE_UNAVAILABLE,
                RouterHandler.mapper().writeValueAsString(response));
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
