package automihomo.control.api.v1.dto;

import automihomo.control.model.TriggerResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Locale;

/**
 * Response DTO for an update trigger.
 * POST /update
 */
public record UpdateResponse(
        @JsonProperty("status") String status,
        @JsonProperty("message") String message,
        @JsonProperty("timestamp") Instant timestamp) {

    public static UpdateResponse from(TriggerResult result) {
        return new UpdateResponse(
                result.status().name().toLowerCase(Locale.ROOT),
                result.message(),
                result.timestamp());
    }
}
