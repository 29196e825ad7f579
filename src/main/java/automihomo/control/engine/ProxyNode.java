package automihomo.control.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Single proxy detail as returned by {@code GET /proxies/{name}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProxyNode(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("alive") Boolean alive,
        @JsonProperty("history") List<DelayRecord> history) {

    public ProxyNode {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public boolean isAlive() {
        return Boolean.TRUE.equals(alive);
    }

    public String typeOrUnknown() {
        return type == null || type.isBlank() ? "unknown" : type;
    }

    /**
     * Delay of the most recent health check, null when there is none
     * or the engine recorded a failed check (delay 0).
     */
    public Integer lastDelayMs() {
        if (history.isEmpty()) {
            return null;
        }
        DelayRecord last = history.get(history.size() - 1);
        return last == null || last.delay() == null || last.delay() <= 0 ? null : last.delay();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DelayRecord(
            @JsonProperty("time") String time,
            @JsonProperty("delay") Integer delay) {
    }
}
