package automihomo.probe;

import java.time.Duration;

/**
 * Measures a single target. Implementations must honour the timeout on their own.
 */
@FunctionalInterface
public interface TargetProbe {

    /**
     * Probe the target once.
     *
     * @param target  a valid target
     * @param timeout upper bound for the whole attempt
     * @return latency in milliseconds
     * @throws ProbeException when the target could not be reached
     */
    long probe(ProbeTarget target, Duration timeout) throws ProbeException;
}
