package automihomo.control.integration;

import automihomo.control.config.ControlConfig;
import automihomo.control.config.Dependencies;
import automihomo.control.engine.FakeEngine;
import automihomo.control.engine.HttpEngineClient;
import automihomo.control.model.RunResult;
import automihomo.control.server.ControlServer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints.
 * Real Netty server, fake engine over HTTP, scripted pipeline.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FakeEngine engine;
    private Dependencies deps;
    private ControlServer server;
    private HttpClient httpClient;
    private String baseUrl;

    private final CountDownLatch pipelineStarted = new CountDownLatch(1);
    private final CountDownLatch releasePipeline = new CountDownLatch(1);

    @BeforeEach
    void setUp() throws Exception {
        engine = new FakeEngine()
                .group("Proxy", "HK 01", "HK 01", "JP 02")
                .node("HK 01", "Shadowsocks", true, 120)
                .node("JP 02", "Vmess", true, 85);

        ControlConfig config = ControlConfig.defaults()
                .withServerHost("127.0.0.1")
                .withServerPort(0)
                .withEngineApiBase(engine.baseUri());

        deps = Dependencies.create(config,
                new HttpEngineClient(engine.baseUri(), null, Duration.ofSeconds(5)),
                () -> {
                    Instant start = Instant.now();
                    pipelineStarted.countDown();
                    try {
                        releasePipeline.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return RunResult.exited(0, "config.yaml written\n", "", start, Instant.now());
                });

        server = new ControlServer(config.serverHost(), config.serverPort(), deps.routerHandler());
        server.start();
        baseUrl = "http://127.0.0.1:" + server.port();

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        releasePipeline.countDown();
        server.stop();
        deps.close();
        engine.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode awaitIdleStatus() throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (System.nanoTime() < deadline) {
            JsonNode status = MAPPER.readTree(get("/status").body());
            if (!status.get("running").asBoolean() && status.get("runCount").asLong() > 0) {
                return status;
            }
            Thread.sleep(20);
        }
        fail("update did not finish");
        return null;
    }

    @Test
    @DisplayName("Update is single-flight and its result shows up in /status")
    void updateAndStatusFlow() throws Exception {
        HttpResponse<String> first = post("/update", "");
        assertEquals(200, first.statusCode(), first.body());
        assertEquals("accepted", MAPPER.readTree(first.body()).get("status").asText());

        assertTrue(pipelineStarted.await(5, TimeUnit.SECONDS));

        JsonNode running = MAPPER.readTree(get("/status").body());
        assertTrue(running.get("running").asBoolean());
        assertEquals(0, running.get("runCount").asLong());

        HttpResponse<String> second = post("/update", "");
        assertEquals(200, second.statusCode());
        assertEquals("busy", MAPPER.readTree(second.body()).get("status").asText());

        releasePipeline.countDown();
        JsonNode done = awaitIdleStatus();

        assertEquals(1, done.get("runCount").asLong());
        assertTrue(done.get("lastResult").get("success").asBoolean());
        assertEquals("config.yaml written\n", done.get("lastResult").get("stdoutTail").asText());
        assertFalse(done.get("lastRunAt").isNull());
    }

    @Test
    void switchToMemberSucceeds() throws Exception {
        HttpResponse<String> response = post("/switch", "{\"target\":\"JP 02\"}");

        assertEquals(200, response.statusCode(), response.body());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("ok", body.get("status").asText());
        assertEquals("Proxy", body.get("group").asText());
        assertEquals("JP 02", body.get("target").asText());
        assertEquals("JP 02", engine.now("Proxy"));
    }

    @Test
    void switchErrorsMapToStatusCodes() throws Exception {
        assertEquals(400, post("/switch", "{\"target\":\"XX\"}").statusCode());
        assertEquals(400, post("/switch", "{}").statusCode());
        assertEquals(400, post("/switch", "not json").statusCode());
        assertEquals(404, post("/switch", "{\"target\":\"JP 02\",\"group\":\"Auto\"}").statusCode());

        engine.selectStatus(500);
        assertEquals(500, post("/switch", "{\"target\":\"JP 02\"}").statusCode());
        assertTrue(engine.selections().isEmpty());
    }

    @Test
    void listsNodesOfDefaultGroup() throws Exception {
        HttpResponse<String> response = get("/nodes");

        assertEquals(200, response.statusCode(), response.body());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("Proxy", body.get("group").asText());
        assertEquals("HK 01", body.get("current").asText());
        assertEquals(2, body.get("total").asInt());
        assertTrue(body.get("nodes").get(0).get("current").asBoolean());
        assertEquals(85, body.get("nodes").get(1).get("latencyMs").asInt());

        assertEquals(404, get("/nodes?group=Missing").statusCode());
    }

    @Test
    void healthReportsEngineVersion() throws Exception {
        HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("ok", body.get("controlSurface").asText());
        assertEquals("ok", body.get("engine").asText());
        assertEquals("v1.18.0", body.get("engineVersion").asText());
    }

    @Test
    void engineDownGives502AndDegradedHealth() throws Exception {
        engine.close();

        assertEquals(502, get("/nodes").statusCode());
        assertEquals(502, post("/switch", "{\"target\":\"JP 02\"}").statusCode());

        HttpResponse<String> health = get("/health");
        assertEquals(200, health.statusCode());
        JsonNode body = MAPPER.readTree(health.body());
        assertEquals("unreachable", body.get("engine").asText());
        assertTrue(body.get("engineVersion").isNull());
    }

    @Test
    void nullEngineReplyGives502() throws Exception {
        engine.rawProxyBody("Proxy", "null");

        assertEquals(502, get("/nodes").statusCode());
        assertEquals(502, post("/switch", "{\"target\":\"JP 02\"}").statusCode());
    }

    @Test
    void unknownRouteIs404() throws Exception {
        HttpResponse<String> response = get("/mcp/status");

        assertEquals(404, response.statusCode());
        assertTrue(MAPPER.readTree(response.body()).has("error"));
    }

    @Test
    void bindingBusyPortFails() throws Exception {
        try (ServerSocket taken = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            ControlServer clash = new ControlServer("127.0.0.1", taken.getLocalPort(), deps.routerHandler());
            assertThrows(IllegalStateException.class, clash::start);
            assertFalse(clash.isRunning());
        }
    }
}
