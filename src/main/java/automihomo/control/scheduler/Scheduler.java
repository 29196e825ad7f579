package automihomo.control.scheduler;

import automihomo.control.model.TriggerResult;
import automihomo.control.service.UpdateOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically triggers a subscription update.
 *
 * Triggers go through the orchestrator like any HTTP request, so a tick that
 * lands on a running update is reported busy and skipped.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final UpdateOrchestrator orchestrator;
    private final Duration interval;

    private volatile boolean running = false;

    /**
     * @param orchestrator update orchestrator to trigger
     * @param interval     period between triggers; zero or negative disables the schedule
     */
    public Scheduler(UpdateOrchestrator orchestrator, Duration interval) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "update-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.orchestrator = orchestrator;
        this.interval = interval;
    }

    /**
     * Start the scheduler. The first trigger fires after one full interval.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        if (interval.isZero() || interval.isNegative()) {
            log.info("Periodic updates disabled");
            return;
        }

        running = true;
        long intervalMs = interval.toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("periodic-update", this::tick),
                intervalMs, // initial delay
                intervalMs, // interval
                TimeUnit.MILLISECONDS);
        log.info("Periodic update scheduled every {}ms", intervalMs);
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Check if scheduler is running.
     */
    public boolean isRunning() {
        return running;
    }

    /**
     * One scheduled trigger. Package-private for tests.
     */
    TriggerResult tick() {
        TriggerResult result = orchestrator.trigger();
        if (result.accepted()) {
            log.info("Periodic update started");
        } else {
            log.info("Periodic update skipped: {}", result.message());
        }
        return result;
    }

    /**
     * Wrap a runnable with error handling.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
