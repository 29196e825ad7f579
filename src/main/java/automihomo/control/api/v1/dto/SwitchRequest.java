package automihomo.control.api.v1.dto;

import automihomo.control.service.NodeService;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for switching the active node of a group.
 * POST /switch
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SwitchRequest(
        @JsonProperty("target") String target,
        @JsonProperty("group") String group) {

    /** Group to switch, {@value NodeService#DEFAULT_GROUP} when omitted */
    public String groupOrDefault() {
        return group == null || group.isBlank() ? NodeService.DEFAULT_GROUP : group;
    }

    /** Validate the request */
    public void validate() {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target is required");
        }
    }
}
