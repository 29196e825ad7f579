package automihomo.control.engine;

/**
 * The engine answered, but not with the shape we rely on.
 */
public class EngineProtocolException extends EngineException {

    public EngineProtocolException(String message) {
        super(message);
    }

    public EngineProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
