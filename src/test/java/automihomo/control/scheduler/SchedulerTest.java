package automihomo.control.scheduler;

import automihomo.control.model.RunResult;
import automihomo.control.model.TriggerResult;
import automihomo.control.service.UpdateOrchestrator;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    @Test
    void periodicTicksTriggerUpdates() throws Exception {
        CountDownLatch ran = new CountDownLatch(2);
        try (UpdateOrchestrator orchestrator = new UpdateOrchestrator(() -> {
            ran.countDown();
            Instant now = Instant.now();
            return RunResult.exited(0, "", "", now, now);
        })) {
            Scheduler scheduler = new Scheduler(orchestrator, Duration.ofMillis(50));
            scheduler.start();
            try {
                assertTrue(scheduler.isRunning());
                assertTrue(ran.await(5, TimeUnit.SECONDS));
            } finally {
                scheduler.stop();
            }
            assertFalse(scheduler.isRunning());
        }
    }

    @Test
    void disabledIntervalNeverStarts() {
        AtomicInteger runs = new AtomicInteger();
        try (UpdateOrchestrator orchestrator = new UpdateOrchestrator(() -> {
            runs.incrementAndGet();
            return null;
        })) {
            Scheduler scheduler = new Scheduler(orchestrator, Duration.ZERO);
            scheduler.start();

            assertFalse(scheduler.isRunning());
            scheduler.stop();
            assertEquals(0, runs.get());
        }
    }

    @Test
    void tickWhileRunningIsSkipped() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        try (UpdateOrchestrator orchestrator = new UpdateOrchestrator(() -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            Instant now = Instant.now();
            return RunResult.exited(0, "", "", now, now);
        })) {
            Scheduler scheduler = new Scheduler(orchestrator, Duration.ofHours(1));

            assertTrue(scheduler.tick().accepted());
            assertTrue(started.await(5, TimeUnit.SECONDS));
            assertEquals(TriggerResult.Status.BUSY, scheduler.tick().status());

            release.countDown();
            scheduler.stop();
        }
    }
}
