package automihomo.control.model;

/**
 * Liveness of the proxy engine as seen from the control surface.
 */
public record EngineHealth(boolean reachable, String version) {

    public static EngineHealth up(String version) {
        return new EngineHealth(true, version);
    }

    public static EngineHealth down() {
        return new EngineHealth(false, null);
    }
}
