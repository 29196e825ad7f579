package automihomo.probe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * One-shot selection: probe, rank, pick the fastest reachable target.
 */
public final class NodeSelector {

    private static final Logger log = LoggerFactory.getLogger(NodeSelector.class);

    private final LatencyProber prober;

    public NodeSelector(LatencyProber prober) {
        this.prober = Objects.requireNonNull(prober, "prober");
    }

    /**
     * Probe and rank the targets supplied.
     */
    public RankedList rank(TargetSupplier supplier) {
        return rank(supplier.targets());
    }

    public RankedList rank(List<ProbeTarget> targets) {
        log.info("Probing {} targets (workers={}, timeout={}ms)",
                targets.size(), prober.concurrency(), prober.timeout().toMillis());
        long started = System.currentTimeMillis();
        RankedList ranked = Ranker.rank(prober.probeAll(targets));
        log.info("Reachable {}/{} in {}ms, failures: {}",
                ranked.reachableCount(), ranked.size(),
                System.currentTimeMillis() - started, ranked.failureCounts());
        return ranked;
    }

    /**
     * @throws NoReachableTargetsException when no target answered
     */
    public ProbeTarget selectBest(List<ProbeTarget> targets) {
        return rank(targets).requireBest().target();
    }
}
