package automihomo.probe;

import java.util.Objects;
import java.util.Optional;

/**
 * The best reachable target of a round, or nothing when no target answered.
 */
public final class Selection {

    private static final Selection EMPTY = new Selection(null);

    private final ProbeTarget best;

    private Selection(ProbeTarget best) {
        this.best = best;
    }

    public static Selection of(ProbeTarget best) {
        return new Selection(Objects.requireNonNull(best, "best"));
    }

    public static Selection empty() {
        return EMPTY;
    }

    public Optional<ProbeTarget> best() {
        return Optional.ofNullable(best);
    }

    public boolean isEmpty() {
        return best == null;
    }

    @Override
    public String toString() {
        return best == null ? "Selection{none}" : "Selection{" + best.name() + "}";
    }
}
