package automihomo.probe;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Orders probe results. Pure: the output depends only on the set of results,
 * not on the order they are handed in or completed in.
 */
public final class Ranker {

    static final Comparator<ProbeResult> ORDER = Comparator
            .comparing((ProbeResult r) -> !r.reachable())
            .thenComparingLong(r -> r.reachable() ? r.latencyMs() : 0L)
            .thenComparingInt(ProbeResult::ordinal);

    private Ranker() {
    }

    public static RankedList rank(Collection<ProbeResult> results) {
        Objects.requireNonNull(results, "results");
        List<ProbeResult> sorted = new ArrayList<>(results);
        sorted.sort(ORDER);
        return new RankedList(sorted);
    }
}
