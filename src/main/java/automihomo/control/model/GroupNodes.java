package automihomo.control.model;

import automihomo.control.engine.ProxyNode;

import java.util.List;

/**
 * Members of a proxy group with their details, in group order.
 */
public record GroupNodes(String group, String current, List<ProxyNode> nodes) {

    public GroupNodes {
        nodes = List.copyOf(nodes);
    }
}
