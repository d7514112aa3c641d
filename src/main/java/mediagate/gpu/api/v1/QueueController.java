package mediagate.gpu.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import mediagate.gpu.api.Controller;
import mediagate.gpu.api.v1.dto.QueueResponse;
import mediagate.gpu.scheduler.GpuScheduler;
import mediagate.gpu.server.RouterHandler;

/**
 * GET /api/v1/queue
 */
public class QueueController implements Controller {

    private final GpuScheduler scheduler;

    public QueueController(GpuScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/queue".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        QueueResponse response = QueueResponse.from(scheduler.queueDepths());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }
}
