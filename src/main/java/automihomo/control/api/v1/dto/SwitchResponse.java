package automihomo.control.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for a successful node switch.
 */
public record SwitchResponse(
        @JsonProperty("status") String status,
        @JsonProperty("message") String message,
        @JsonProperty("target") String target,
        @JsonProperty("group") String group) {

    public static SwitchResponse ok(String group, String target) {
        return new SwitchResponse("ok", "switched " + group + " to " + target, target, group);
    }
}
