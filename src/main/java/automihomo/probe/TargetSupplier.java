package automihomo.probe;

import java.util.List;

/**
 * Source of the candidate targets for one probing round.
 */
@FunctionalInterface
public interface TargetSupplier {

    /**
     * @return targets in their canonical order; names are unique
     */
    List<ProbeTarget> targets();
}
