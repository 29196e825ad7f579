package automihomo.control.api.v1;

import automihomo.control.api.Controller;
import automihomo.control.api.v1.dto.UpdateResponse;
import automihomo.control.model.TriggerResult;
import automihomo.control.server.RouterHandler;
import automihomo.control.service.UpdateOrchestrator;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts a subscription update in the background.
 * POST /update
 *
 * Always answers 200; a run already in progress is reported as {@code busy}.
 */
public class UpdateController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(UpdateController.class);

    private final UpdateOrchestrator orchestrator;

    public UpdateController(UpdateOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/update".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        TriggerResult result = orchestrator.trigger();
        log.debug("Update trigger: {}", result.status());
        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(UpdateResponse.from(result)));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize update response", e);
        }
    }
}
