package aiadmin.queue.server;

import aiadmin.queue.api.Controller;
import aiadmin.queue.api.Controller.ControllerResponse;
import aiadmin.queue.model.TaskNotFoundException;
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
import io.netty.handler.codec.http.HttpVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Dispatches requests to the first {@link Controller} that matches and writes its
 * {@link ControllerResponse} as JSON.
 * <p>
 * Failures thrown by a controller become error responses:
 * <ul>
 * <li>{@link TaskNotFoundException}: 404</li>
 * <li>malformed JSON and {@link IllegalArgumentException}: 400</li>
 * <li>{@link IllegalStateException} (queue shutting down): 503</li>
 * <li>anything else: 500</li>
 * </ul>
 * Stateless per channel, so one instance serves all connections.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new CopyOnWriteArrayList<>();

    /**
     * Add a controller. Earlier registrations win when several match.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        HttpMethod method = req.method();
        String uri = req.uri();
        int query = uri.indexOf('?');
        String path = query >= 0 ? uri.substring(0, query) : uri;

        ControllerResponse response;
        try {
            response = dispatch(ctx, req, method, path);
        } catch (Exception e) {
            response = toErrorResponse(method, path, e);
        }
        write(ctx, response);
    }

    private ControllerResponse dispatch(ChannelHandlerContext ctx, FullHttpRequest req, HttpMethod method,
            String path) throws Exception {
        for (Controller controller : controllers) {
            if (controller.matches(method, path)) {
                return controller.handle(ctx, req, path);
            }
        }
        log.debug("No handler for: {} {}", method, path);
        return ControllerResponse.error(HttpResponseStatus.NOT_FOUND, "not found");
    }

    private ControllerResponse toErrorResponse(HttpMethod method, String path, Exception e) {
        if (e instanceof TaskNotFoundException) {
            log.debug("Task not found: {}", ((TaskNotFoundException) e).taskId());
            return ControllerResponse.error(HttpResponseStatus.NOT_FOUND, "task not found");
        }
        if (e instanceof JsonProcessingException) {
            String detail = ((JsonProcessingException) e).getOriginalMessage();
            log.warn("Malformed request body for {} {}: {}", method, path, detail);
            return ControllerResponse.error(HttpResponseStatus.BAD_REQUEST, "malformed JSON: " + detail);
        }
        if (e instanceof IllegalArgumentException) {
            log.warn("Rejected {} {}: {}", method, path, e.getMessage());
            return ControllerResponse.error(HttpResponseStatus.BAD_REQUEST, e.getMessage());
        }
        if (e instanceof IllegalStateException) {
            log.warn("Unavailable {} {}: {}", method, path, e.getMessage());
            return ControllerResponse.error(HttpResponseStatus.SERVICE_UNAVAILABLE, e.getMessage());
        }
        log.error("Handler error: {} {}", method, path, e);
        return ControllerResponse.error(HttpResponseStatus.INTERNAL_SERVER_ERROR, "internal error");
    }

    private void write(ChannelHandlerContext ctx, ControllerResponse response) {
        byte[] bytes;
        HttpResponseStatus status = response.status();
        try {
            bytes = response.body() != null ? MAPPER.writeValueAsBytes(response.body()) : new byte[0];
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} response body", status, e);
            status = HttpResponseStatus.INTERNAL_SERVER_ERROR;
            bytes = "{\"error\":\"internal error\"}".getBytes(StandardCharsets.UTF_8);
        }

        FullHttpResponse http = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status,
                Unpooled.wrappedBuffer(bytes));
        http.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=utf-8");
        http.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(http);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }

    /**
     * Shared mapper for request and response bodies (ISO-8601 instants).
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
