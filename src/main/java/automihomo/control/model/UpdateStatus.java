package automihomo.control.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of the update orchestrator state.
 *
 * The orchestrator swaps whole snapshots, so {@code runCount},
 * {@code lastRunAt} and {@code lastResult} are always mutually consistent.
 */
public final class UpdateStatus {

    private static final UpdateStatus INITIAL = new UpdateStatus(false, null, null, 0);

    private final boolean running;
    private final Instant lastRunAt;
    private final RunResult lastResult;
    private final long runCount;

    private UpdateStatus(boolean running, Instant lastRunAt, RunResult lastResult, long runCount) {
        this.running = running;
        this.lastRunAt = lastRunAt;
        this.lastResult = lastResult;
        this.runCount = runCount;
    }

    public static UpdateStatus initial() {
        return INITIAL;
    }

    public boolean running() {
        return running;
    }

    /** Completion time of the last run, null before the first run finished */
    public Instant lastRunAt() {
        return lastRunAt;
    }

    public RunResult lastResult() {
        return lastResult;
    }

    public long runCount() {
        return runCount;
    }

    /** Idle to Running; counters untouched */
    public UpdateStatus markRunning() {
        if (running) {
            throw new IllegalStateException("update already running");
        }
        return new UpdateStatus(true, lastRunAt, lastResult, runCount);
    }

    /** Running to Idle with the outcome recorded */
    public UpdateStatus complete(RunResult result, Instant completedAt) {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(completedAt, "completedAt");
        return new UpdateStatus(false, completedAt, result, runCount + 1);
    }

    @Override
    public String toString() {
        return "UpdateStatus{" +
                "running=" + running +
                ", lastRunAt=" + lastRunAt +
                ", runCount=" + runCount +
                ", lastResult=" + lastResult +
                '}';
    }
}
