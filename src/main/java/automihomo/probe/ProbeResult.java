package automihomo.probe;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Outcome of probing one target in one round. Never mutated after creation.
 *
 * @param target     the probed target
 * @param ordinal    position of the target in the round input, used as the ranking tie-break
 * @param reachable  whether the connection succeeded within the timeout
 * @param latencyMs  connect latency, present only when reachable
 * @param failure    failure kind, present only when unreachable
 * @param measuredAt when the probe finished
 */
public record ProbeResult(
        ProbeTarget target,
        int ordinal,
        boolean reachable,
        Long latencyMs,
        ProbeFailure failure,
        Instant measuredAt) {

    public ProbeResult {
        Objects.requireNonNull(target, "target is required");
        Objects.requireNonNull(measuredAt, "measuredAt is required");
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must be non-negative");
        }
        if (reachable) {
            if (latencyMs == null || latencyMs < 0) {
                throw new IllegalArgumentException("reachable result needs a non-negative latency");
            }
            if (failure != null) {
                throw new IllegalArgumentException("reachable result cannot carry a failure");
            }
        } else {
            if (latencyMs != null) {
                throw new IllegalArgumentException("unreachable result cannot carry a latency");
            }
            Objects.requireNonNull(failure, "unreachable result needs a failure");
        }
    }

    public static ProbeResult reachable(ProbeTarget target, int ordinal, long latencyMs, Instant measuredAt) {
        return new ProbeResult(target, ordinal, true, latencyMs, null, measuredAt);
    }

    public static ProbeResult unreachable(ProbeTarget target, int ordinal, ProbeFailure failure, Instant measuredAt) {
        return new ProbeResult(target, ordinal, false, null, failure, measuredAt);
    }

    public OptionalLong latency() {
        return reachable ? OptionalLong.of(latencyMs) : OptionalLong.empty();
    }
}
