package automihomo.probe;

/**
 * A probing round finished without a single reachable target.
 */
public class NoReachableTargetsException extends RuntimeException {

    private final int probed;

    public NoReachableTargetsException(int probed) {
        super("no reachable targets out of " + probed);
        this.probed = probed;
    }

    public int probed() {
        return probed;
    }
}
