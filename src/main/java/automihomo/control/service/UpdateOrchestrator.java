package automihomo.control.service;

import automihomo.control.model.RunResult;
import automihomo.control.model.TriggerResult;
import automihomo.control.model.UpdateStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-flight runner for the update pipeline.
 *
 * State lives in one atomic cell holding an immutable {@link UpdateStatus}.
 * {@link #trigger()} flips Idle to Running with a compare-and-set and hands
 * the run to a background thread; the run always ends by swapping in a
 * completed snapshot, whatever the outcome.
 */
public final class UpdateOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UpdateOrchestrator.class);

    private final AtomicReference<UpdateStatus> state = new AtomicReference<>(UpdateStatus.initial());
    private final UpdatePipeline pipeline;
    private final ExecutorService executor;
    private final Clock clock;

    public UpdateOrchestrator(UpdatePipeline pipeline) {
        this(pipeline, Clock.systemUTC());
    }

    public UpdateOrchestrator(UpdatePipeline pipeline, Clock clock) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "update-pipeline");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start a run unless one is already in progress. Never waits for the run.
     *
     * @throws IllegalStateException if the orchestrator has been closed
     */
    public TriggerResult trigger() {
        UpdateStatus current;
        do {
            current = state.get();
            if (current.running()) {
                log.info("Update trigger rejected: run already in progress");
                return TriggerResult.busy(clock.instant());
            }
        } while (!state.compareAndSet(current, current.markRunning()));

        Instant acceptedAt = clock.instant();
        try {
            executor.execute(() -> execute(acceptedAt));
        } catch (RejectedExecutionException e) {
            complete(RunResult.failed("orchestrator is shut down", acceptedAt, clock.instant()));
            throw new IllegalStateException("update orchestrator is shut down", e);
        }
        log.info("Update accepted (run #{})", current.runCount() + 1);
        return TriggerResult.accepted(acceptedAt);
    }

    /**
     * Current state snapshot; safe from any thread, never blocks.
     */
    public UpdateStatus status() {
        return state.get();
    }

    private void execute(Instant acceptedAt) {
        RunResult result = RunResult.failed("pipeline aborted", acceptedAt, acceptedAt);
        try {
            result = pipeline.run();
            if (result == null) {
                result = RunResult.failed("pipeline returned no result", acceptedAt, clock.instant());
            }
        } catch (RuntimeException e) {
            log.error("Update pipeline crashed", e);
            String message = e.getMessage() != null ? e.getMessage() : e.toString();
            result = RunResult.failed(message, acceptedAt, clock.instant());
        } finally {
            complete(result);
        }
    }

    private void complete(RunResult result) {
        UpdateStatus done = state.updateAndGet(s -> s.complete(result, clock.instant()));
        switch (result.outcome()) {
            case SUCCESS -> log.info("Update #{} succeeded in {}ms", done.runCount(), result.durationMs());
            case FAILURE -> log.warn("Update #{} failed with exit status {}", done.runCount(), result.exitCode());
            case TIMEOUT, ERROR -> log.warn("Update #{} {}: {}", done.runCount(),
                    result.outcome().name().toLowerCase(), result.error());
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Update pipeline thread did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
