package automihomo.control.api.v1;

import automihomo.control.api.Controller;
import automihomo.control.api.v1.dto.SwitchRequest;
import automihomo.control.api.v1.dto.SwitchResponse;
import automihomo.control.server.RouterHandler;
import automihomo.control.service.NodeService;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Switches the active node of a proxy group.
 * POST /switch {"target": "...", "group": "..."}
 *
 * Engine exceptions bubble to RouterHandler, which maps them to 400/404/500/502.
 */
public class SwitchController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(SwitchController.class);

    private final NodeService nodeService;

    public SwitchController(NodeService nodeService) {
        this.nodeService = nodeService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/switch".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        SwitchRequest request = parse(req.content().toString(StandardCharsets.UTF_8));
        request.validate();

        String group = request.groupOrDefault();
        nodeService.switchNode(group, request.target());
        log.debug("Switch request completed: {} -> {}", group, request.target());

        try {
            return ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(SwitchResponse.ok(group, request.target())));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize switch response", e);
        }
    }

    private static SwitchRequest parse(String body) {
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        try {
            SwitchRequest request = RouterHandler.mapper().readValue(body, SwitchRequest.class);
            if (request == null) {
                throw new IllegalArgumentException("request body is required");
            }
            return request;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid JSON body: " + e.getOriginalMessage());
        }
    }
}
