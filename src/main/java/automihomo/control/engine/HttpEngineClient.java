package automihomo.control.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link EngineClient} over the engine's RESTful API using the JDK HTTP client.
 */
public final class HttpEngineClient implements EngineClient {

    private static final Logger log = LoggerFactory.getLogger(HttpEngineClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final URI baseUri;
    private final String secret;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    public HttpEngineClient(URI baseUri, String secret, Duration requestTimeout) {
        this.baseUri = normalize(Objects.requireNonNull(baseUri, "baseUri"));
        this.secret = secret;
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();
    }

    @Override
    public String version() {
        HttpResponse<String> response = send(get("/version"));
        if (response.statusCode() != 200) {
            throw new EngineApiException(response.statusCode(), response.body());
        }
        JsonNode root = parse(response.body(), JsonNode.class);
        JsonNode version = root.get("version");
        if (version == null || !version.isTextual()) {
            throw new EngineProtocolException("version reply has no 'version' field");
        }
        return version.asText();
    }

    @Override
    public ProxyGroup group(String name) {
        HttpResponse<String> response = send(get("/proxies/" + encode(name)));
        if (response.statusCode() == 404) {
            throw new GroupNotFoundException(name);
        }
        if (response.statusCode() != 200) {
            throw new EngineApiException(response.statusCode(), response.body());
        }
        ProxyGroup group = parse(response.body(), ProxyGroup.class);
        if (group.name() == null) {
            throw new EngineProtocolException("proxy reply for '" + name + "' has no 'name' field");
        }
        if (group.all() == null) {
            // a plain proxy, not a selectable group
            throw new GroupNotFoundException(name);
        }
        return group;
    }

    /**
     * Fetches all details concurrently.
     */
    @Override
    public List<ProxyNode> nodes(List<String> names) {
        List<CompletableFuture<HttpResponse<String>>> pending = new ArrayList<>(names.size());
        for (String name : names) {
            pending.add(httpClient.sendAsync(get("/proxies/" + encode(name)), HttpResponse.BodyHandlers.ofString()));
        }
        List<ProxyNode> nodes = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            HttpResponse<String> response;
            try {
                response = pending.get(i).join();
            } catch (CompletionException e) {
                pending.forEach(f -> f.cancel(true));
                throw unreachable(e.getCause() != null ? e.getCause() : e);
            }
            toNode(names.get(i), response).ifPresent(nodes::add);
        }
        return nodes;
    }

    @Override
    public void select(String group, String node) {
        String body = toJson(Map.of("name", node));
        HttpRequest request = request("/proxies/" + encode(group))
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(body))
                .build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() == 204 || response.statusCode() == 200) {
            log.info("Engine switched group '{}' to '{}'", group, node);
            return;
        }
        if (response.statusCode() == 404) {
            throw new GroupNotFoundException(group);
        }
        throw new EngineApiException(response.statusCode(), response.body());
    }

    public URI baseUri() {
        return baseUri;
    }

    private Optional<ProxyNode> toNode(String name, HttpResponse<String> response) {
        if (response.statusCode() != 200) {
            log.debug("No detail for proxy '{}': HTTP {}", name, response.statusCode());
            return Optional.empty();
        }
        ProxyNode node = parse(response.body(), ProxyNode.class);
        if (node.name() == null) {
            throw new EngineProtocolException("proxy reply for '" + name + "' has no 'name' field");
        }
        return Optional.of(node);
    }

    private HttpRequest get(String path) {
        return request(path).GET().build();
    }

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUri + path))
                .timeout(requestTimeout);
        if (secret != null && !secret.isBlank()) {
            builder.header("Authorization", "Bearer " + secret);
        }
        return builder;
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw unreachable(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineUnreachableException("interrupted while calling the engine", e);
        }
    }

    private EngineUnreachableException unreachable(Throwable cause) {
        log.warn("Engine API {} unreachable: {}", baseUri, cause.toString());
        return new EngineUnreachableException("cannot reach engine API at " + baseUri
                + ", make sure the engine is running", cause);
    }

    private static <T> T parse(String body, Class<T> type) {
        if (body == null || body.isBlank()) {
            throw new EngineProtocolException("empty reply from engine");
        }
        T value;
        try {
            value = MAPPER.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new EngineProtocolException("malformed reply from engine: " + e.getOriginalMessage(), e);
        }
        if (value == null || (value instanceof JsonNode node && !node.isObject())) {
            throw new EngineProtocolException("reply from engine is not a JSON object");
        }
        return value;
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize request", e);
        }
    }

    /** Path segment encoding: spaces as %20, not '+' */
    static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static URI normalize(URI uri) {
        String text = uri.toString();
        while (text.endsWith("/")) {
            text = text.substring(0, text.length() - 1);
        }
        return URI.create(text);
    }
}
