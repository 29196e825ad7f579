package automihomo.control.engine;

import java.util.List;

/**
 * The requested node is not a member of the proxy group.
 */
public class NodeNotInGroupException extends EngineException {

    private static final int PREVIEW = 20;

    private final String node;
    private final String group;

    public NodeNotInGroupException(String node, String group, List<String> available) {
        super("node '" + node + "' is not in proxy group '" + group + "', available: "
                + preview(available));
        this.node = node;
        this.group = group;
    }

    public String node() {
        return node;
    }

    public String group() {
        return group;
    }

    private static String preview(List<String> available) {
        if (available.size() <= PREVIEW) {
            return available.toString();
        }
        return available.subList(0, PREVIEW) + " and " + (available.size() - PREVIEW) + " more";
    }
}
