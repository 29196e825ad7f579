package automihomo.control.service;

import automihomo.control.engine.EngineClient;
import automihomo.control.engine.EngineException;
import automihomo.control.engine.NodeNotInGroupException;
import automihomo.control.engine.ProxyGroup;
import automihomo.control.engine.ProxyNode;
import automihomo.control.model.EngineHealth;
import automihomo.control.model.GroupNodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Node switching and listing on top of the engine management API.
 * Engine failures propagate as typed {@link EngineException}s.
 */
public class NodeService {

    private static final Logger log = LoggerFactory.getLogger(NodeService.class);

    public static final String DEFAULT_GROUP = "Proxy";

    private final EngineClient engine;

    public NodeService(EngineClient engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Make {@code target} the active node of {@code group}.
     *
     * @throws automihomo.control.engine.GroupNotFoundException if the group is unknown
     * @throws NodeNotInGroupException                          if the target is not a member
     */
    public void switchNode(String group, String target) {
        ProxyGroup proxyGroup = engine.group(group);
        if (!proxyGroup.contains(target)) {
            throw new NodeNotInGroupException(target, group, proxyGroup.all());
        }
        engine.select(group, target);
        log.info("Switched group '{}' from '{}' to '{}'", group, proxyGroup.current(), target);
    }

    /**
     * List the members of a group with their latest health-check delay.
     */
    public GroupNodes listNodes(String group) {
        ProxyGroup proxyGroup = engine.group(group);
        List<ProxyNode> nodes = engine.nodes(proxyGroup.all());
        log.debug("Group '{}' has {} members, {} with details", group, proxyGroup.all().size(), nodes.size());
        return new GroupNodes(group, proxyGroup.current(), nodes);
    }

    /**
     * Engine liveness; never throws.
     */
    public EngineHealth engineHealth() {
        try {
            return EngineHealth.up(engine.version());
        } catch (EngineException e) {
            log.debug("Engine health check failed: {}", e.getMessage());
            return EngineHealth.down();
        }
    }
}
