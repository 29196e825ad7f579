package automihomo.control.api.v1.dto;

import automihomo.control.engine.ProxyNode;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One member of a proxy group. {@code latencyMs} is null when the engine
 * has no successful health check on record.
 */
public record NodeInfo(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("alive") boolean alive,
        @JsonProperty("latencyMs") Integer latencyMs,
        @JsonProperty("current") boolean current) {

    public static NodeInfo from(ProxyNode node, String currentName) {
        return new NodeInfo(
                node.name(),
                node.typeOrUnknown(),
                node.isAlive(),
                node.lastDelayMs(),
                Objects.equals(node.name(), currentName));
    }
}
