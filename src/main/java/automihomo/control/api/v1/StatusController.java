package automihomo.control.api.v1;

import automihomo.control.api.Controller;
import automihomo.control.api.v1.dto.StatusResponse;
import automihomo.control.server.RouterHandler;
import automihomo.control.service.UpdateOrchestrator;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

/**
 * GET /status
 */
public class StatusController implements Controller {

    private final UpdateOrchestrator orchestrator;

    public StatusController(UpdateOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/status".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        StatusResponse response = StatusResponse.from(orchestrator.status());
        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize status response", e);
        }
    }
}
