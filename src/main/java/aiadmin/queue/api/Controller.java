package aiadmin.queue.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.Map;

/**
 * An HTTP endpoint group under /api/v1.
 * The router asks each controller in turn whether it owns a request.
 */
public interface Controller {

    /**
     * @param method HTTP method
     * @param path   request path without query string
     * @return true if this controller serves the request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Serve a matched request.
     * <p>
     * Bad input and unknown task IDs are reported by throwing ({@link IllegalArgumentException},
     * {@code TaskNotFoundException}); the router turns them into 400 and 404 responses.
     *
     * @param path request path without query string
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception;

    /**
     * Status plus a body object; the router writes the body as JSON.
     */
    record ControllerResponse(HttpResponseStatus status, Object body) {

        public static ControllerResponse ok(Object body) {
            return new ControllerResponse(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse created(Object body) {
            return new ControllerResponse(HttpResponseStatus.CREATED, body);
        }

        public static ControllerResponse of(HttpResponseStatus status, Object body) {
            return new ControllerResponse(status, body);
        }

        /** {@code {"error": message}} with the given status */
        public static ControllerResponse error(HttpResponseStatus status, String message) {
            return new ControllerResponse(status, Map.of("error", message != null ? message : status.reasonPhrase()));
        }
    }
}
