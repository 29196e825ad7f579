package automihomo.control.server;

import automihomo.control.api.Controller;
import automihomo.control.api.Controller.ControllerResponse;
import automihomo.control.engine.EngineApiException;
import automihomo.control.engine.EngineException;
import automihomo.control.engine.EngineProtocolException;
import automihomo.control.engine.EngineUnreachableException;
import automihomo.control.engine.GroupNotFoundException;
import automihomo.control.engine.NodeNotInGroupException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Controllers let domain exceptions bubble; they are mapped here:
 * <ul>
 * <li>{@link IllegalArgumentException}, {@link NodeNotInGroupException}: 400</li>
 * <li>{@link GroupNotFoundException}: 404</li>
 * <li>{@link EngineUnreachableException}, {@link EngineProtocolException}: 502</li>
 * <li>{@link EngineApiException} and anything else: 500</li>
 * </ul>
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private final List<Controller> controllers = new CopyOnWriteArrayList<>();

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
        boolean keepAlive = HttpUtil.isKeepAlive(req);

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf('?')) : uri;

        ControllerResponse response;
        try {
            response = dispatch(ctx, req, method, path);
        } catch (Throwable t) {
            response = toErrorResponse(method, path, t);
        }
        writeSafe(ctx, response, keepAlive);
    }

    private ControllerResponse dispatch(ChannelHandlerContext ctx, FullHttpRequest req, HttpMethod method,
            String path) {
        for (Controller controller : controllers) {
            if (controller.matches(method, path)) {
                return controller.handle(ctx, req, path);
            }
        }
        log.debug("No handler for: {} {}", method, path);
        return ControllerResponse.notFound("not found: " + method + " " + path);
    }

    /**
     * Map an exception escaping a controller to a JSON error response.
     */
    static ControllerResponse toErrorResponse(HttpMethod method, String path, Throwable t) {
        if (t instanceof IllegalArgumentException || t instanceof NodeNotInGroupException) {
            log.warn("Bad request {} {}: {}", method, path, t.getMessage());
            return ControllerResponse.badRequest(t.getMessage());
        }
        if (t instanceof GroupNotFoundException) {
            log.warn("{} {}: {}", method, path, t.getMessage());
            return ControllerResponse.notFound(t.getMessage());
        }
        if (t instanceof EngineUnreachableException || t instanceof EngineProtocolException) {
            log.warn("Engine failure on {} {}: {}", method, path, t.getMessage());
            return ControllerResponse.badGateway(t.getMessage());
        }
        if (t instanceof EngineException) {
            log.error("Engine rejected {} {}: {}", method, path, t.getMessage());
            return ControllerResponse.error(t.getMessage());
        }

        log.error("Handler error: {} {}", method, path, t);

        // Build full error chain for debugging
        StringBuilder errorChain = new StringBuilder(t.toString());
        Throwable cause = t.getCause();
        while (cause != null) {
            errorChain.append(" <- ").append(cause);
            cause = cause.getCause();
        }
        return ControllerResponse.error(errorChain.toString());
    }

    /**
     * Safe write that catches any exceptions during response writing.
     * Ensures we never silently close the connection.
     */
    private void writeSafe(ChannelHandlerContext ctx, ControllerResponse response, boolean keepAlive) {
        try {
            FullHttpResponse httpResponse = toHttpResponse(response.status(), response.contentType(),
                    response.body());
            if (keepAlive) {
                HttpUtil.setKeepAlive(httpResponse, true);
                ctx.writeAndFlush(httpResponse);
            } else {
                ctx.writeAndFlush(httpResponse).addListener(ChannelFutureListener.CLOSE);
            }
        } catch (Throwable t) {
            // Last resort - log and try to send simple error
            log.error("Failed to write response: {}", t.getMessage(), t);
            try {
                ctx.writeAndFlush(toHttpResponse(INTERNAL_SERVER_ERROR, "application/json",
                        "{\"error\":\"failed to write response\"}"))
                        .addListener(ChannelFutureListener.CLOSE);
            } catch (Throwable t2) {
                log.error("Complete failure writing error response", t2);
                ctx.close();
            }
        }
    }

    private static FullHttpResponse toHttpResponse(HttpResponseStatus status, String contentType, String body) {
        byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        return response;
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            ctx.writeAndFlush(toHttpResponse(INTERNAL_SERVER_ERROR, "application/json",
                    "{\"error\":\"channel error\"}"));
        } finally {
            ctx.close();
        }
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
