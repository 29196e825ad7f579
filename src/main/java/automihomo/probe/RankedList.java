package automihomo.probe;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Results of one round in ranking order: reachable before unreachable,
 * ascending latency, ties in input order.
 */
public final class RankedList {

    private final List<ProbeResult> entries;

    RankedList(List<ProbeResult> sorted) {
        this.entries = List.copyOf(sorted);
    }

    public List<ProbeResult> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** First {@code limit} entries. */
    public List<ProbeResult> top(int limit) {
        return entries.subList(0, Math.min(Math.max(limit, 0), entries.size()));
    }

    public int reachableCount() {
        int count = 0;
        for (ProbeResult result : entries) {
            if (!result.reachable()) {
                break;
            }
            count++;
        }
        return count;
    }

    /** Unreachable results grouped by failure kind. */
    public Map<ProbeFailure, Integer> failureCounts() {
        Map<ProbeFailure, Integer> counts = new EnumMap<>(ProbeFailure.class);
        for (ProbeResult result : entries) {
            if (!result.reachable()) {
                counts.merge(result.failure(), 1, Integer::sum);
            }
        }
        return Collections.unmodifiableMap(counts);
    }

    public Selection selection() {
        if (entries.isEmpty() || !entries.get(0).reachable()) {
            return Selection.empty();
        }
        return Selection.of(entries.get(0).target());
    }

    /**
     * The fastest reachable result.
     *
     * @throws NoReachableTargetsException when nothing is reachable
     */
    public ProbeResult requireBest() {
        if (entries.isEmpty() || !entries.get(0).reachable()) {
            throw new NoReachableTargetsException(entries.size());
        }
        return entries.get(0);
    }
}
