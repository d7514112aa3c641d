package mediagate.gpu.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import mediagate.gpu.api.Controller;
import mediagate.gpu.api.internal.v1.dto.MetricsRequest;
import mediagate.gpu.api.v1.dto.OperationResponse;
import mediagate.gpu.maintenance.MetricsCollector;
import mediagate.gpu.server.RouterHandler;

import java.nio.charset.StandardCharsets;

/**
 * Telemetry push (internal API).
 * POST /internal/v1/metrics
 */
public class MetricsController implements Controller {

    private final MetricsCollector collector;

    public MetricsController(MetricsCollector collector) {
        this.collector = collector;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/internal/v1/metrics".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        MetricsRequest request = RouterHandler.mapper().readValue(body, MetricsRequest.class);
        request.validate();

        if (!collector.ingest(request.toSample())) {
            return ControllerResponse.notFound("unknown device " + request.deviceId());
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success("ok")));
    }
}
