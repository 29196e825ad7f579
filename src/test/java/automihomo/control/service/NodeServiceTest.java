package automihomo.control.service;

import automihomo.control.engine.EngineClient;
import automihomo.control.engine.EngineUnreachableException;
import automihomo.control.engine.GroupNotFoundException;
import automihomo.control.engine.NodeNotInGroupException;
import automihomo.control.engine.ProxyGroup;
import automihomo.control.engine.ProxyNode;
import automihomo.control.model.EngineHealth;
import automihomo.control.model.GroupNodes;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NodeService with an in-memory engine.
 */
class NodeServiceTest {

    /** In-memory engine; {@code down} makes every call fail as unreachable. */
    private static final class StubEngine implements EngineClient {
        final Map<String, ProxyGroup> groups = new HashMap<>();
        final Map<String, ProxyNode> nodes = new HashMap<>();
        final List<String> selects = new ArrayList<>();
        boolean down;

        @Override
        public String version() {
            checkUp();
            return "v1.18.0";
        }

        @Override
        public ProxyGroup group(String name) {
            checkUp();
            ProxyGroup group = groups.get(name);
            if (group == null) {
                throw new GroupNotFoundException(name);
            }
            return group;
        }

        @Override
        public List<ProxyNode> nodes(List<String> names) {
            checkUp();
            List<ProxyNode> found = new ArrayList<>();
            for (String name : names) {
                ProxyNode node = nodes.get(name);
                if (node != null) {
                    found.add(node);
                }
            }
            return found;
        }

        @Override
        public void select(String group, String node) {
            checkUp();
            selects.add(group + "=" + node);
        }

        private void checkUp() {
            if (down) {
                throw new EngineUnreachableException("engine down", null);
            }
        }
    }

    private StubEngine engine() {
        StubEngine engine = new StubEngine();
        engine.groups.put("Proxy", new ProxyGroup("Proxy", "Selector", "A", List.of("A", "B")));
        engine.nodes.put("A", new ProxyNode("A", "Shadowsocks", true,
                List.of(new ProxyNode.DelayRecord("t", 40))));
        engine.nodes.put("B", new ProxyNode("B", "Trojan", false, List.of()));
        return engine;
    }

    @Test
    void switchesToMember() {
        StubEngine engine = engine();
        new NodeService(engine).switchNode("Proxy", "B");

        assertEquals(List.of("Proxy=B"), engine.selects);
    }

    @Test
    void rejectsNonMemberWithoutCallingSelect() {
        StubEngine engine = engine();
        NodeService service = new NodeService(engine);

        NodeNotInGroupException e = assertThrows(NodeNotInGroupException.class,
                () -> service.switchNode("Proxy", "Z"));

        assertTrue(e.getMessage().contains("[A, B]"));
        assertTrue(engine.selects.isEmpty());
    }

    @Test
    void unknownGroupPropagates() {
        NodeService service = new NodeService(engine());
        assertThrows(GroupNotFoundException.class, () -> service.switchNode("Nope", "A"));
        assertThrows(GroupNotFoundException.class, () -> service.listNodes("Nope"));
    }

    @Test
    void listsMembersWithCurrent() {
        GroupNodes nodes = new NodeService(engine()).listNodes("Proxy");

        assertEquals("Proxy", nodes.group());
        assertEquals("A", nodes.current());
        assertEquals(2, nodes.nodes().size());
        assertEquals(40, nodes.nodes().get(0).lastDelayMs());
        assertNull(nodes.nodes().get(1).lastDelayMs());
    }

    @Test
    void healthReportsEngineState() {
        StubEngine engine = engine();
        NodeService service = new NodeService(engine);

        assertEquals(EngineHealth.up("v1.18.0"), service.engineHealth());

        engine.down = true;
        EngineHealth down = service.engineHealth();
        assertFalse(down.reachable());
        assertNull(down.version());
    }

    @Test
    void unreachableEnginePropagatesFromSwitch() {
        StubEngine engine = engine();
        engine.down = true;

        assertThrows(EngineUnreachableException.class, () -> new NodeService(engine).switchNode("Proxy", "A"));
    }
}
