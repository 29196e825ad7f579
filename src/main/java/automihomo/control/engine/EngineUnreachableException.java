package automihomo.control.engine;

/**
 * The management API did not answer at all (engine down, wrong address, timeout).
 */
public class EngineUnreachableException extends EngineException {

    public EngineUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
