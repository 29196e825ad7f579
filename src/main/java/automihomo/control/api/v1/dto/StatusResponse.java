package automihomo.control.api.v1.dto;

import automihomo.control.model.UpdateStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Response DTO for the orchestrator state.
 * GET /status
 */
public record StatusResponse(
        @JsonProperty("running") boolean running,
        @JsonProperty("lastRunAt") Instant lastRunAt,
        @JsonProperty("lastResult") RunResultResponse lastResult,
        @JsonProperty("runCount") long runCount) {

    public static StatusResponse from(UpdateStatus status) {
        return new StatusResponse(
                status.running(),
                status.lastRunAt(),
                RunResultResponse.from(status.lastResult()),
                status.runCount());
    }
}
