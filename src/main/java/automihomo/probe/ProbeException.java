package automihomo.probe;

import java.util.Objects;

/**
 * Raised by a {@link TargetProbe} when a target could not be measured.
 */
public class ProbeException extends Exception {

    private final ProbeFailure failure;

    public ProbeException(ProbeFailure failure, String message) {
        super(message);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public ProbeException(ProbeFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public ProbeFailure failure() {
        return failure;
    }
}
