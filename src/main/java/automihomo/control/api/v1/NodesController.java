package automihomo.control.api.v1;

import automihomo.control.api.Controller;
import automihomo.control.api.v1.dto.NodesResponse;
import automihomo.control.server.RouterHandler;
import automihomo.control.service.NodeService;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.util.List;

/**
 * Lists the members of a proxy group.
 * GET /nodes?group=Proxy
 */
public class NodesController implements Controller {

    private final NodeService nodeService;

    public NodesController(NodeService nodeService) {
        this.nodeService = nodeService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/nodes".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        List<String> groups = new QueryStringDecoder(req.uri()).parameters().get("group");
        String group = groups == null || groups.isEmpty() || groups.get(0).isBlank()
                ? NodeService.DEFAULT_GROUP
                : groups.get(0);

        NodesResponse response = NodesResponse.from(nodeService.listNodes(group));
        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize nodes response", e);
        }
    }
}
