package automihomo.probe;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LatencyProber with scripted probes.
 */
class LatencyProberTest {

    private static final Duration TIMEOUT = Duration.ofMillis(500);

    @Test
    void producesOneResultPerTargetInInputOrder() {
        Map<String, Long> latencies = Map.of("a", 50L, "b", 10L, "c", 30L);
        LatencyProber prober = new LatencyProber((t, timeout) -> latencies.get(t.name()), 4, TIMEOUT);

        List<ProbeTarget> targets = List.of(
                new ProbeTarget("a", "10.0.0.1", 443),
                new ProbeTarget("b", "10.0.0.2", 443),
                new ProbeTarget("c", "10.0.0.3", 443));

        List<ProbeResult> results = prober.probeAll(targets);

        assertEquals(3, results.size());
        for (int i = 0; i < targets.size(); i++) {
            assertEquals(targets.get(i), results.get(i).target());
            assertEquals(i, results.get(i).ordinal());
            assertTrue(results.get(i).reachable());
        }
        assertEquals(50L, results.get(0).latencyMs());
        assertEquals(10L, results.get(1).latencyMs());
    }

    @Test
    void invalidTargetsAreReportedWithoutProbing() {
        AtomicInteger calls = new AtomicInteger();
        LatencyProber prober = new LatencyProber((t, timeout) -> {
            calls.incrementAndGet();
            return 5;
        }, 4, TIMEOUT);

        List<ProbeResult> results = prober.probeAll(List.of(
                new ProbeTarget("blank-host", "  ", 443),
                new ProbeTarget("port-zero", "example.org", 0),
                new ProbeTarget("port-high", "example.org", 70000),
                new ProbeTarget("ok", "example.org", 443)));

        assertEquals(4, results.size());
        assertEquals(1, calls.get());
        for (int i = 0; i < 3; i++) {
            assertFalse(results.get(i).reachable());
            assertEquals(ProbeFailure.INVALID_TARGET, results.get(i).failure());
            assertNull(results.get(i).latencyMs());
        }
        assertTrue(results.get(3).reachable());
    }

    @Test
    void probeFailuresAndCrashesDoNotAbortTheRound() {
        LatencyProber prober = new LatencyProber((t, timeout) -> {
            switch (t.name()) {
                case "refused":
                    throw new ProbeException(ProbeFailure.REFUSED, "connection refused");
                case "crash":
                    throw new IllegalStateException("boom");
                default:
                    return 7;
            }
        }, 2, TIMEOUT);

        List<ProbeResult> results = prober.probeAll(List.of(
                new ProbeTarget("refused", "h1", 1),
                new ProbeTarget("crash", "h2", 2),
                new ProbeTarget("fine", "h3", 3)));

        assertEquals(ProbeFailure.REFUSED, results.get(0).failure());
        assertEquals(ProbeFailure.IO_ERROR, results.get(1).failure());
        assertTrue(results.get(2).reachable());
        assertEquals(7L, results.get(2).latencyMs());
    }

    @Test
    void latencyAboveTimeoutCountsAsTimeout() {
        LatencyProber prober = new LatencyProber((t, timeout) -> timeout.toMillis() + 1, 1, TIMEOUT);

        ProbeResult result = prober.probeAll(List.of(new ProbeTarget("slow", "h", 80))).get(0);

        assertFalse(result.reachable());
        assertEquals(ProbeFailure.TIMEOUT, result.failure());
    }

    @Test
    void blockedTargetIsCutOffAtTheTimeout() {
        Duration timeout = Duration.ofMillis(200);
        LatencyProber prober = new LatencyProber((t, limit) -> {
            if (t.name().equals("stuck")) {
                sleepUninterruptibly(2000);
            }
            return 5;
        }, 50, timeout);

        long start = System.nanoTime();
        List<ProbeResult> results = prober.probeAll(List.of(
                new ProbeTarget("stuck", "h1", 1),
                new ProbeTarget("fine", "h2", 2)));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertTrue(elapsedMs < 1000, "round took " + elapsedMs + "ms");
        assertEquals(ProbeFailure.TIMEOUT, results.get(0).failure());
        assertTrue(results.get(1).reachable());
    }

    @Test
    void queuedTargetsStillFinishWithinTheirRoundBound() {
        Duration timeout = Duration.ofMillis(150);
        LatencyProber prober = new LatencyProber((t, limit) -> {
            sleepUninterruptibly(2000);
            return 5;
        }, 1, timeout);

        long start = System.nanoTime();
        List<ProbeResult> results = prober.probeAll(List.of(
                new ProbeTarget("a", "h1", 1),
                new ProbeTarget("b", "h2", 2),
                new ProbeTarget("c", "h3", 3)));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertTrue(elapsedMs < 1500, "round took " + elapsedMs + "ms");
        assertTrue(results.stream().allMatch(r -> r.failure() == ProbeFailure.TIMEOUT));
    }

    @Test
    void neverRunsMoreProbesAtOnceThanConfigured() {
        int concurrency = 3;
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        LatencyProber prober = new LatencyProber((t, timeout) -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            return 1;
        }, concurrency, Duration.ofSeconds(2));

        List<ProbeTarget> targets = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            targets.add(new ProbeTarget("n" + i, "h" + i, 1000 + i));
        }

        List<ProbeResult> results = prober.probeAll(targets);

        assertEquals(20, results.size());
        assertTrue(maxInFlight.get() <= concurrency, "max in flight was " + maxInFlight.get());
        assertTrue(results.stream().allMatch(ProbeResult::reachable));
    }

    @Test
    void emptyInputGivesEmptyResult() {
        LatencyProber prober = new LatencyProber((t, timeout) -> 1, 5, TIMEOUT);
        assertTrue(prober.probeAll(List.of()).isEmpty());
    }

    @Test
    void rejectsNonPositiveSettings() {
        TargetProbe probe = (t, timeout) -> 1;
        assertThrows(IllegalArgumentException.class, () -> new LatencyProber(probe, 0, TIMEOUT));
        assertThrows(IllegalArgumentException.class, () -> new LatencyProber(probe, 1, Duration.ZERO));
    }

    private static void sleepUninterruptibly(long millis) {
        long deadline = System.nanoTime() + Duration.ofMillis(millis).toNanos();
        while (System.nanoTime() < deadline) {
            try {
                Thread.sleep(Math.max(1, Duration.ofNanos(deadline - System.nanoTime()).toMillis()));
            } catch (InterruptedException ignored) {
                // keep blocking like a resolver call would
            }
        }
    }
}
