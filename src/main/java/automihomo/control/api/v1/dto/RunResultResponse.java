package automihomo.control.api.v1.dto;

import automihomo.control.model.RunResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Locale;

/**
 * Outcome of one pipeline run as reported by GET /status.
 * {@code exitCode} and {@code error} are serialized as null when absent.
 */
public record RunResultResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("outcome") String outcome,
        @JsonProperty("exitCode") Integer exitCode,
        @JsonProperty("error") String error,
        @JsonProperty("stdoutTail") String stdoutTail,
        @JsonProperty("stderrTail") String stderrTail,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("durationMs") long durationMs) {

    public static RunResultResponse from(RunResult result) {
        if (result == null) {
            return null;
        }
        return new RunResultResponse(
                result.success(),
                result.outcome().name().toLowerCase(Locale.ROOT),
                result.exitCode(),
                result.error(),
                result.stdoutTail(),
                result.stderrTail(),
                result.startedAt(),
                result.finishedAt(),
                result.durationMs());
    }
}
