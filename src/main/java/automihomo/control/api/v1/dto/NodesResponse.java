package automihomo.control.api.v1.dto;

import automihomo.control.model.GroupNodes;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for listing a proxy group.
 * GET /nodes?group=
 */
public record NodesResponse(
        @JsonProperty("group") String group,
        @JsonProperty("current") String current,
        @JsonProperty("total") int total,
        @JsonProperty("nodes") List<NodeInfo> nodes) {

    public static NodesResponse from(GroupNodes groupNodes) {
        List<NodeInfo> nodes = groupNodes.nodes().stream()
                .map(n -> NodeInfo.from(n, groupNodes.current()))
                .toList();
        return new NodesResponse(groupNodes.group(), groupNodes.current(), nodes.size(), nodes);
    }
}
