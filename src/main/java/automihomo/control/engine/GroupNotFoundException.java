package automihomo.control.engine;

/**
 * The named proxy group does not exist on the engine.
 */
public class GroupNotFoundException extends EngineException {

    private final String group;

    public GroupNotFoundException(String group) {
        super("proxy group '" + group + "' does not exist");
        this.group = group;
    }

    public String group() {
        return group;
    }
}
