package mediagate.gpu.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import mediagate.gpu.api.Controller;
import mediagate.gpu.api.v1.dto.DeviceResponse;
import mediagate.gpu.scheduler.GpuScheduler;
import mediagate.gpu.server.RouterHandler;

import java.util.List;
import java.util.Map;

/**
 * Device table.
 * GET /api/v1/devices
 */
public class DeviceController implements Controller {

    private final GpuScheduler scheduler;

    public DeviceController(GpuScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/devices".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        List<DeviceResponse> devices = scheduler.deviceTable().stream()
                .map(DeviceResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("count", devices.size(), "devices", devices)));
    }
}
