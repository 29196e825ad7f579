package automihomo.probe;

/**
 * Why a single probe did not produce a latency.
 */
public enum ProbeFailure {
    /** Blank host or port outside 1..65535, no connection attempted */
    INVALID_TARGET,
    /** Resolution plus connect did not finish within the probe timeout */
    TIMEOUT,
    /** The remote host actively refused the connection */
    REFUSED,
    /** The host name could not be resolved */
    UNRESOLVED,
    /** Any other socket-level error */
    IO_ERROR
}
