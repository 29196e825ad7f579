package automihomo.probe;

import java.util.Objects;

/**
 * A named network endpoint to test for reachability and latency.
 *
 * Malformed entries (blank host, port outside 1..65535) are still representable
 * so that a probing round can report them as unreachable instead of failing.
 */
public record ProbeTarget(String name, String host, int port) {

    public ProbeTarget {
        Objects.requireNonNull(name, "name is required");
        host = host == null ? "" : host.trim();
    }

    /** True when the target can be connected to at all. */
    public boolean isValid() {
        return !host.isBlank() && port > 0 && port <= 65535;
    }

    public String address() {
        return host + ":" + port;
    }
}
