package automihomo.control.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of a finished pipeline run.
 * Output tails are already truncated to the configured length.
 */
public final class RunResult {
    private final RunOutcome outcome;
    private final Integer exitCode;
    private final String error;
    private final String stdoutTail;
    private final String stderrTail;
    private final Instant startedAt;
    private final Instant finishedAt;

    private RunResult(Builder builder) {
        this.outcome = Objects.requireNonNull(builder.outcome, "outcome is required");
        this.startedAt = Objects.requireNonNull(builder.startedAt, "startedAt is required");
        this.finishedAt = Objects.requireNonNull(builder.finishedAt, "finishedAt is required");
        this.exitCode = builder.exitCode;
        this.error = builder.error;
        this.stdoutTail = builder.stdoutTail == null ? "" : builder.stdoutTail;
        this.stderrTail = builder.stderrTail == null ? "" : builder.stderrTail;
    }

    // Getters
    public RunOutcome outcome() {
        return outcome;
    }

    public boolean success() {
        return outcome == RunOutcome.SUCCESS;
    }

    /** Exit status, absent for timeouts and start failures */
    public Integer exitCode() {
        return exitCode;
    }

    public String error() {
        return error;
    }

    public String stdoutTail() {
        return stdoutTail;
    }

    public String stderrTail() {
        return stderrTail;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public long durationMs() {
        return Math.max(0, Duration.between(startedAt, finishedAt).toMillis());
    }

    /** Run that exited normally; outcome follows the exit status */
    public static RunResult exited(int exitCode, String stdoutTail, String stderrTail,
            Instant startedAt, Instant finishedAt) {
        return builder()
                .outcome(exitCode == 0 ? RunOutcome.SUCCESS : RunOutcome.FAILURE)
                .exitCode(exitCode)
                .error(exitCode == 0 ? null : "pipeline exited with status " + exitCode)
                .stdoutTail(stdoutTail)
                .stderrTail(stderrTail)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .build();
    }

    public static RunResult timedOut(Duration timeout, String stdoutTail, String stderrTail,
            Instant startedAt, Instant finishedAt) {
        return builder()
                .outcome(RunOutcome.TIMEOUT)
                .error("update timed out after " + timeout.toSeconds() + "s")
                .stdoutTail(stdoutTail)
                .stderrTail(stderrTail)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .build();
    }

    public static RunResult failed(String error, Instant startedAt, Instant finishedAt) {
        return builder()
                .outcome(RunOutcome.ERROR)
                .error(error)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RunOutcome outcome;
        private Integer exitCode;
        private String error;
        private String stdoutTail;
        private String stderrTail;
        private Instant startedAt;
        private Instant finishedAt;

        public Builder outcome(RunOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder exitCode(Integer exitCode) {
            this.exitCode = exitCode;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder stdoutTail(String stdoutTail) {
            this.stdoutTail = stdoutTail;
            return this;
        }

        public Builder stderrTail(String stderrTail) {
            this.stderrTail = stderrTail;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public RunResult build() {
            return new RunResult(this);
        }
    }

    @Override
    public String toString() {
        return "RunResult{" +
                "outcome=" + outcome +
                ", exitCode=" + exitCode +
                ", durationMs=" + durationMs() +
                ", error='" + error + '\'' +
                '}';
    }
}
