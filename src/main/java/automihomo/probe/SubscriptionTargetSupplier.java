package automihomo.probe;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reads probe targets from a Clash-style subscription document.
 *
 * Only {@code proxies[*].name}, {@code server} and {@code port} are used;
 * everything else in the document is ignored. Entries without a name are
 * skipped, later duplicates of a name are dropped.
 */
public final class SubscriptionTargetSupplier implements TargetSupplier {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionTargetSupplier.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path path;

    public SubscriptionTargetSupplier(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    @Override
    public List<ProbeTarget> targets() {
        if (!Files.isRegularFile(path)) {
            throw new SubscriptionException("Subscription file not found: " + path);
        }
        Object raw;
        try (Reader reader = Files.newBufferedReader(path)) {
            raw = new Yaml().load(reader);
        } catch (IOException e) {
            throw new SubscriptionException("Failed to read subscription: " + path, e);
        } catch (RuntimeException e) {
            throw new SubscriptionException("Subscription is not valid YAML: " + path, e);
        }
        if (raw == null) {
            throw new SubscriptionException("Subscription file is empty: " + path);
        }

        Document document;
        try {
            document = MAPPER.convertValue(raw, Document.class);
        } catch (IllegalArgumentException e) {
            throw new SubscriptionException("Failed to parse subscription: " + path, e);
        }
        if (document.proxies() == null || document.proxies().isEmpty()) {
            throw new SubscriptionException("Subscription has no proxies: " + path);
        }
        return toTargets(document.proxies());
    }

    static List<ProbeTarget> toTargets(List<Entry> entries) {
        List<ProbeTarget> targets = new ArrayList<>(entries.size());
        Set<String> seen = new HashSet<>();
        for (Entry entry : entries) {
            if (entry == null || entry.name() == null || entry.name().isBlank()) {
                log.warn("Skipping proxy entry without a name");
                continue;
            }
            if (!seen.add(entry.name())) {
                log.warn("Dropping duplicate proxy name: {}", entry.name());
                continue;
            }
            targets.add(new ProbeTarget(entry.name(), entry.server(), parsePort(entry.port())));
        }
        if (targets.isEmpty()) {
            throw new SubscriptionException("Subscription has no named proxies");
        }
        return List.copyOf(targets);
    }

    private static int parsePort(String port) {
        if (port == null || port.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(port.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Document(@JsonProperty("proxies") List<Entry> proxies) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Entry(
            @JsonProperty("name") String name,
            @JsonProperty("server") String server,
            @JsonProperty("port") String port) {
    }
}
