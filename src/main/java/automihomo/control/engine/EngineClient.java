package automihomo.control.engine;

import java.util.List;

/**
 * Client for the proxy engine's management API.
 *
 * All methods throw {@link EngineUnreachableException} when the engine cannot be
 * contacted and {@link EngineProtocolException} when a reply lacks required fields.
 */
public interface EngineClient {

    /**
     * Engine version string ({@code GET /version}).
     */
    String version();

    /**
     * Proxy group details.
     *
     * @throws GroupNotFoundException if the group does not exist or is not a group
     */
    ProxyGroup group(String name);

    /**
     * Details for several proxies; unknown names are left out, order is kept.
     */
    List<ProxyNode> nodes(List<String> names);

    /**
     * Make {@code node} the active member of {@code group}.
     *
     * @throws EngineApiException if the engine refuses the switch
     */
    void select(String group, String node);
}
