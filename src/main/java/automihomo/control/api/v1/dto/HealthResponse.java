package automihomo.control.api.v1.dto;

import automihomo.control.model.EngineHealth;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Response DTO for health check.
 * GET /health
 */
public record HealthResponse(
        @JsonProperty("controlSurface") String controlSurface,
        @JsonProperty("engine") String engine,
        @JsonProperty("engineVersion") String engineVersion,
        @JsonProperty("timestamp") Instant timestamp) {

    public static HealthResponse from(EngineHealth health, Instant now) {
        return new HealthResponse(
                "ok",
                health.reachable() ? "ok" : "unreachable",
                health.version(),
                now);
    }
}
