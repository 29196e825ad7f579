package automihomo.probe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Probes a list of targets concurrently on a bounded worker pool.
 *
 * Every call is an independent round: a pool of {@code min(concurrency, N)}
 * threads is created for it and torn down afterwards. Exactly one
 * {@link ProbeResult} is produced per input target, returned in input order.
 * A failing target never aborts the round.
 *
 * Each probe runs on its own attempt thread and its worker waits at most the
 * probe timeout for it, so a round takes at most {@code ceil(N / concurrency)}
 * timeouts. Attempts that outlive their timeout are interrupted and abandoned.
 */
public final class LatencyProber {

    private static final Logger log = LoggerFactory.getLogger(LatencyProber.class);

    private static final AtomicInteger ROUND_IDS = new AtomicInteger(1);

    private final TargetProbe probe;
    private final int concurrency;
    private final Duration timeout;
    private final Clock clock;

    public LatencyProber(TargetProbe probe, int concurrency, Duration timeout) {
        this(probe, concurrency, timeout, Clock.systemUTC());
    }

    public LatencyProber(TargetProbe probe, int concurrency, Duration timeout, Clock clock) {
        this.probe = Objects.requireNonNull(probe, "probe");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.concurrency = concurrency;
    }

    /**
     * Run one probing round.
     *
     * @param targets targets to probe, possibly empty
     * @return one result per target, in input order
     * @throws CancellationException if the calling thread is interrupted while waiting
     */
    public List<ProbeResult> probeAll(List<ProbeTarget> targets) {
        Objects.requireNonNull(targets, "targets");
        List<ProbeResult> results = new ArrayList<>(Collections.nCopies(targets.size(), null));

        List<Integer> pending = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            ProbeTarget target = targets.get(i);
            if (target.isValid()) {
                pending.add(i);
            } else {
                log.debug("Skipping invalid target {} ({})", target.name(), target.address());
                results.set(i, ProbeResult.unreachable(target, i, ProbeFailure.INVALID_TARGET, clock.instant()));
            }
        }

        if (pending.isEmpty()) {
            return List.copyOf(results);
        }

        int poolSize = Math.min(concurrency, pending.size());
        int round = ROUND_IDS.getAndIncrement();
        ExecutorService workers = Executors.newFixedThreadPool(poolSize, threadFactory("latency-probe-" + round));
        ExecutorService attempts = Executors.newCachedThreadPool(threadFactory("latency-attempt-" + round));
        try {
            List<Future<ProbeResult>> futures = new ArrayList<>(pending.size());
            for (int index : pending) {
                ProbeTarget target = targets.get(index);
                futures.add(workers.submit(() -> probeOne(attempts, target, index)));
            }
            for (int k = 0; k < pending.size(); k++) {
                int index = pending.get(k);
                results.set(index, await(futures.get(k), targets.get(index), index));
            }
        } finally {
            workers.shutdownNow();
            attempts.shutdownNow();
        }

        return List.copyOf(results);
    }

    public int concurrency() {
        return concurrency;
    }

    public Duration timeout() {
        return timeout;
    }

    private ProbeResult probeOne(ExecutorService attempts, ProbeTarget target, int ordinal) {
        Future<Long> attempt = attempts.submit(() -> probe.probe(target, timeout));
        try {
            long latencyMs = attempt.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (latencyMs > timeout.toMillis()) {
                return ProbeResult.unreachable(target, ordinal, ProbeFailure.TIMEOUT, clock.instant());
            }
            return ProbeResult.reachable(target, ordinal, Math.max(0, latencyMs), clock.instant());
        } catch (TimeoutException e) {
            attempt.cancel(true);
            log.debug("Probe {} -> TIMEOUT after {}ms", target.name(), timeout.toMillis());
            return ProbeResult.unreachable(target, ordinal, ProbeFailure.TIMEOUT, clock.instant());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProbeException failure) {
                log.debug("Probe {} -> {}: {}", target.name(), failure.failure(), failure.getMessage());
                return ProbeResult.unreachable(target, ordinal, failure.failure(), clock.instant());
            }
            log.warn("Probe {} failed unexpectedly: {}", target.name(), String.valueOf(cause));
            return ProbeResult.unreachable(target, ordinal, ProbeFailure.IO_ERROR, clock.instant());
        } catch (InterruptedException e) {
            attempt.cancel(true);
            Thread.currentThread().interrupt();
            return ProbeResult.unreachable(target, ordinal, ProbeFailure.TIMEOUT, clock.instant());
        }
    }

    private ProbeResult await(Future<ProbeResult> future, ProbeTarget target, int ordinal) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.warn("Probe {} crashed: {}", target.name(), String.valueOf(e.getCause()));
            return ProbeResult.unreachable(target, ordinal, ProbeFailure.IO_ERROR, clock.instant());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("probe round interrupted");
            cancelled.initCause(e);
            throw cancelled;
        }
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger seq = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + seq.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
