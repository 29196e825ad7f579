package automihomo.control.api.v1;

import automihomo.control.api.Controller;
import automihomo.control.api.v1.dto.HealthResponse;
import automihomo.control.model.EngineHealth;
import automihomo.control.server.RouterHandler;
import automihomo.control.service.NodeService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Health check controller.
 * GET /health
 *
 * Answers 200 even when the engine is down; the engine state is in the body.
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final NodeService nodeService;
    private final Clock clock;

    public HealthController(NodeService nodeService) {
        this(nodeService, Clock.systemUTC());
    }

    public HealthController(NodeService nodeService, Clock clock) {
        this.nodeService = nodeService;
        this.clock = clock;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        EngineHealth engine = nodeService.engineHealth();
        if (!engine.reachable()) {
            log.warn("Health check: engine unreachable");
        }
        try {
            HealthResponse response = HealthResponse.from(engine, clock.instant());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.error("health check failed");
        }
    }
}
