package automihomo.control.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Proxy group as returned by {@code GET /proxies/{group}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProxyGroup(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("now") String now,
        @JsonProperty("all") List<String> all) {

    public ProxyGroup {
        all = all == null ? null : List.copyOf(all);
    }

    public boolean contains(String node) {
        return all != null && all.contains(node);
    }

    /** Currently selected member, empty string when the engine reports none */
    public String current() {
        return now == null ? "" : now;
    }
}
