package mediagate.gpu.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import mediagate.gpu.api.Controller;
import mediagate.gpu.api.Controller.ControllerResponse;
import mediagate.gpu.error.GatewayException;
import mediagate.gpu.error.UnknownDeviceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.CONFLICT;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only handles versioned API endpoints:
 * - /api/v1/* (public and operator API)
 * - /internal/v1/* (executor and telemetry callbacks)
 *
 * All other endpoints return 404.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new ArrayList<>();

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    writeSafe(ctx, response.status(), response.contentType(), response.body());
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            writeSafe(ctx, NOT_FOUND, "application/json", "{\"error\":\"not found\"}");

        } catch (IllegalArgumentException e) {
            log.warn("Validation error on {} {}: {}", method, path, e.getMessage());
            writeError(ctx, BAD_REQUEST, e.getMessage());
        } catch (JsonProcessingException e) {
            log.warn("Malformed JSON on {} {}: {}", method, path, e.getOriginalMessage());
            writeError(ctx, BAD_REQUEST, "malformed request body: " + e.getOriginalMessage());
        } catch (UnknownDeviceException e) {
            writeError(ctx, NOT_FOUND, e.getMessage());
        } catch (IllegalStateException | GatewayException e) {
            log.warn("Rejected {} {}: {}", method, path, e.getMessage());
            writeError(ctx, CONFLICT, e.getMessage());
        } catch (Throwable t) {
            String requestBody = req.content().toString(StandardCharsets.UTF_8);
            log.error("Handler error: {} {} - Body: [{}]", method, path, requestBody, t);

            // Build full error chain for debugging
            StringBuilder errorChain = new StringBuilder(t.toString());
            Throwable cause = t.getCause();
            while (cause != null) {
                errorChain.append(" <- ").append(cause);
                cause = cause.getCause();
            }
            writeError(ctx, INTERNAL_SERVER_ERROR, errorChain.toString());
        }
    }

    private void writeError(ChannelHandlerContext ctx, HttpResponseStatus status, String message) {
        writeSafe(ctx, status, "application/json", "{\"error\":\"" + escapeJson(message) + "\"}");
    }

    /**
     * Safe write that catches any exceptions during response writing.
     * Ensures we never silently close the connection.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            if (body == null) {
                body = "";
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (Throwable t) {
            log.error("Failed to write response: {}", t.getMessage(), t);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            writeError(ctx, INTERNAL_SERVER_ERROR, "channel error: " + cause.getMessage());
        } finally {
            ctx.close();
        }
    }

    private static String escapeJson(String s) {
        if (s == null)
            return "";
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
