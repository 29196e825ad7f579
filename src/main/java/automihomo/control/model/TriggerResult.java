package automihomo.control.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Answer to an update trigger. Accepted means "started, poll for the outcome".
 */
public record TriggerResult(Status status, String message, Instant timestamp) {

    public enum Status {
        ACCEPTED,
        BUSY
    }

    public TriggerResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static TriggerResult accepted(Instant now) {
        return new TriggerResult(Status.ACCEPTED, "update accepted, poll /status for progress", now);
    }

    public static TriggerResult busy(Instant now) {
        return new TriggerResult(Status.BUSY, "an update is already in progress, try again later", now);
    }

    public boolean accepted() {
        return status == Status.ACCEPTED;
    }
}
