package automihomo.control.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HttpEngineClient against an in-process fake engine.
 */
class HttpEngineClientTest {

    private FakeEngine engine;
    private HttpEngineClient client;

    @BeforeEach
    void setUp() throws Exception {
        engine = new FakeEngine()
                .group("Proxy", "HK 01", "HK 01", "JP 02", "US 03")
                .node("HK 01", "Shadowsocks", true, 120)
                .node("JP 02", "Vmess", true, 85)
                .node("US 03", "Trojan", false, 0);
        client = new HttpEngineClient(engine.baseUri(), null, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void readsVersion() {
        assertEquals("v1.18.0", client.version());
    }

    @Test
    void versionWithoutFieldIsProtocolError() {
        engine.rawVersionBody("{\"meta\":true}");
        assertThrows(EngineProtocolException.class, client::version);
    }

    @Test
    void malformedReplyIsProtocolError() {
        engine.rawVersionBody("<html>not json</html>");
        assertThrows(EngineProtocolException.class, client::version);
    }

    @Test
    void readsGroupWithMembers() {
        ProxyGroup group = client.group("Proxy");

        assertEquals("Proxy", group.name());
        assertEquals("HK 01", group.current());
        assertEquals(List.of("HK 01", "JP 02", "US 03"), group.all());
        assertTrue(group.contains("JP 02"));
        assertFalse(group.contains("XX"));
    }

    @Test
    void unknownGroupIsNotFound() {
        GroupNotFoundException e = assertThrows(GroupNotFoundException.class, () -> client.group("Missing"));
        assertTrue(e.getMessage().contains("Missing"));
    }

    @Test
    void plainProxyIsNotAGroup() {
        assertThrows(GroupNotFoundException.class, () -> client.group("HK 01"));
    }

    @Test
    void readsNodeDetailsWithLatestDelay() {
        List<ProxyNode> nodes = client.nodes(List.of("HK 01", "JP 02", "US 03", "gone"));

        assertEquals(3, nodes.size());
        assertEquals("HK 01", nodes.get(0).name());
        assertEquals(120, nodes.get(0).lastDelayMs());
        assertTrue(nodes.get(1).isAlive());
        assertFalse(nodes.get(2).isAlive());
        assertNull(nodes.get(2).lastDelayMs());
    }

    @Test
    void nodeTypeIsRead() {
        List<ProxyNode> nodes = client.nodes(List.of("JP 02"));
        assertEquals("Vmess", nodes.get(0).typeOrUnknown());
        assertTrue(client.nodes(List.of("nope")).isEmpty());
    }

    @Test
    void nullGroupReplyIsProtocolError() {
        engine.rawProxyBody("Proxy", "null");
        assertThrows(EngineProtocolException.class, () -> client.group("Proxy"));
    }

    @Test
    void nullNodeReplyIsProtocolError() {
        engine.rawProxyBody("JP 02", "null");
        assertThrows(EngineProtocolException.class, () -> client.nodes(List.of("HK 01", "JP 02")));
    }

    @Test
    void nonObjectVersionReplyIsProtocolError() {
        engine.rawVersionBody("[\"v1.18.0\"]");
        assertThrows(EngineProtocolException.class, client::version);
    }

    @Test
    void selectSwitchesTheGroup() {
        client.select("Proxy", "JP 02");

        assertEquals(List.of("Proxy=JP 02"), engine.selections());
        assertEquals("JP 02", engine.now("Proxy"));
    }

    @Test
    void refusedSelectIsApiError() {
        engine.selectStatus(400);

        EngineApiException e = assertThrows(EngineApiException.class, () -> client.select("Proxy", "JP 02"));
        assertEquals(400, e.statusCode());
    }

    @Test
    void selectOnUnknownGroupIsNotFound() {
        assertThrows(GroupNotFoundException.class, () -> client.select("Missing", "JP 02"));
    }

    @Test
    void sendsBearerSecretWhenConfigured() {
        HttpEngineClient withSecret = new HttpEngineClient(
                URI.create(engine.baseUri() + "/"), "s3cret", Duration.ofSeconds(5));

        withSecret.version();

        assertEquals(List.of("Bearer s3cret"), engine.authHeaders());
    }

    @Test
    void closedPortIsUnreachable() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }
        HttpEngineClient dead = new HttpEngineClient(
                URI.create("http://127.0.0.1:" + port), null, Duration.ofSeconds(2));

        assertThrows(EngineUnreachableException.class, dead::version);
        assertThrows(EngineUnreachableException.class, () -> dead.group("Proxy"));
    }

    @Test
    void encodesPathSegments() {
        assertEquals("HK%2001", HttpEngineClient.encode("HK 01"));
        assertEquals("a%2Fb", HttpEngineClient.encode("a/b"));
    }
}
