package automihomo.control.engine;

/**
 * The engine answered with an unexpected HTTP status.
 */
public class EngineApiException extends EngineException {

    private final int statusCode;

    public EngineApiException(int statusCode, String body) {
        super("engine returned HTTP " + statusCode + (body == null || body.isBlank() ? "" : " - " + body));
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
