package automihomo.control.model;

/**
 * Terminal outcome of one update pipeline run.
 */
public enum RunOutcome {
    /** Pipeline exited with status 0 */
    SUCCESS,
    /** Pipeline exited with a non-zero status */
    FAILURE,
    /** Pipeline exceeded the hard deadline and was killed */
    TIMEOUT,
    /** Pipeline could not be started or crashed the runner */
    ERROR
}
