package automihomo.control.config;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Configuration holder for the control service.
 * All settings have sensible defaults.
 */
public final class ControlConfig {

    public static final String SKIP_PROXY_ARG = "--skip-proxy";

    // Server settings
    private int serverPort = 8900;
    private String serverHost = "0.0.0.0";

    // Engine settings
    private URI engineApiBase = URI.create("http://127.0.0.1:9090");
    private String engineSecret = null;
    private Duration engineRequestTimeout = Duration.ofSeconds(10);

    // Probe settings
    private Duration probeTimeout = Duration.ofMillis(3000);
    private int probeConcurrency = 50;

    // Update pipeline settings
    private Path pipelineScript = Paths.get("scripts", "update_sub.sh");
    private List<String> pipelineCommand = null; // overrides script + skip argument when set
    private Path pipelineWorkDir = Paths.get(".");
    private Duration pipelineTimeout = Duration.ofSeconds(180);
    private int outputTailChars = 3000;
    private Duration updateInterval = Duration.ZERO; // zero disables periodic updates

    private ControlConfig() {
    }

    public static ControlConfig defaults() {
        return new ControlConfig();
    }

    /**
     * Defaults overridden by {@code ./.env} and then by the process environment.
     */
    public static ControlConfig fromEnv() {
        Map<String, String> fileValues = DotEnv.read(Paths.get(".env"));
        return fromEnv(DotEnv.merge(fileValues, System.getenv()));
    }

    public static ControlConfig fromEnv(Map<String, String> env) {
        ControlConfig config = new ControlConfig();

        String port = value(env, "MCP_SERVER_PORT");
        if (port != null) {
            config.serverPort = parseInt("MCP_SERVER_PORT", port);
        }

        String host = value(env, "MCP_SERVER_HOST");
        if (host != null) {
            config.serverHost = host;
        }

        String apiBase = value(env, "MIHOMO_API_BASE");
        String apiPort = value(env, "MIHOMO_API_PORT");
        if (apiBase != null) {
            config.engineApiBase = parseUri("MIHOMO_API_BASE", apiBase);
        } else if (apiPort != null) {
            config.engineApiBase = URI.create("http://127.0.0.1:" + parseInt("MIHOMO_API_PORT", apiPort));
        }

        String secret = value(env, "MIHOMO_API_SECRET");
        if (secret != null) {
            config.engineSecret = secret;
        }

        String tcpTimeout = value(env, "MIHOMO_TCP_TIMEOUT");
        if (tcpTimeout != null) {
            config.probeTimeout = Duration.ofSeconds(parseInt("MIHOMO_TCP_TIMEOUT", tcpTimeout));
        }

        String workers = value(env, "MIHOMO_TEST_WORKERS");
        if (workers != null) {
            config.probeConcurrency = parseInt("MIHOMO_TEST_WORKERS", workers);
        }

        String script = value(env, "UPDATE_SCRIPT");
        if (script != null) {
            config.pipelineScript = Paths.get(script);
        }

        String workDir = value(env, "UPDATE_WORKDIR");
        if (workDir != null) {
            config.pipelineWorkDir = Paths.get(workDir);
        }

        String updateTimeout = value(env, "UPDATE_TIMEOUT_SECONDS");
        if (updateTimeout != null) {
            config.pipelineTimeout = Duration.ofSeconds(parseInt("UPDATE_TIMEOUT_SECONDS", updateTimeout));
        }

        String tailChars = value(env, "UPDATE_TAIL_CHARS");
        if (tailChars != null) {
            config.outputTailChars = parseInt("UPDATE_TAIL_CHARS", tailChars);
        }

        String interval = value(env, "UPDATE_INTERVAL_MINUTES");
        if (interval != null) {
            config.updateInterval = Duration.ofMinutes(parseInt("UPDATE_INTERVAL_MINUTES", interval));
        }

        config.validate();
        return config;
    }

    // Getters
    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public URI engineApiBase() {
        return engineApiBase;
    }

    public String engineSecret() {
        return engineSecret;
    }

    public Duration engineRequestTimeout() {
        return engineRequestTimeout;
    }

    public Duration probeTimeout() {
        return probeTimeout;
    }

    public int probeConcurrency() {
        return probeConcurrency;
    }

    public Path pipelineWorkDir() {
        return pipelineWorkDir;
    }

    public Duration pipelineTimeout() {
        return pipelineTimeout;
    }

    public int outputTailChars() {
        return outputTailChars;
    }

    public Duration updateInterval() {
        return updateInterval;
    }

    public boolean periodicUpdatesEnabled() {
        return !updateInterval.isZero() && !updateInterval.isNegative();
    }

    /**
     * Command line of the update pipeline: the script followed by the
     * argument that suppresses system-level side effects.
     */
    public List<String> pipelineCommand() {
        if (pipelineCommand != null) {
            return pipelineCommand;
        }
        List<String> command = new ArrayList<>();
        String script = pipelineScript.toString();
        if (script.endsWith(".sh")) {
            command.add("bash");
        }
        command.add(script);
        command.add(SKIP_PROXY_ARG);
        return List.copyOf(command);
    }

    // Fluent setters for testing/customization
    public ControlConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public ControlConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public ControlConfig withEngineApiBase(URI base) {
        this.engineApiBase = base;
        return this;
    }

    public ControlConfig withEngineSecret(String secret) {
        this.engineSecret = secret;
        return this;
    }

    public ControlConfig withEngineRequestTimeout(Duration timeout) {
        this.engineRequestTimeout = timeout;
        return this;
    }

    public ControlConfig withProbeTimeout(Duration timeout) {
        this.probeTimeout = timeout;
        return this;
    }

    public ControlConfig withProbeConcurrency(int concurrency) {
        this.probeConcurrency = concurrency;
        return this;
    }

    public ControlConfig withPipelineCommand(List<String> command) {
        this.pipelineCommand = List.copyOf(command);
        return this;
    }

    public ControlConfig withPipelineWorkDir(Path workDir) {
        this.pipelineWorkDir = workDir;
        return this;
    }

    public ControlConfig withPipelineTimeout(Duration timeout) {
        this.pipelineTimeout = timeout;
        return this;
    }

    public ControlConfig withOutputTailChars(int chars) {
        this.outputTailChars = chars;
        return this;
    }

    public ControlConfig withUpdateInterval(Duration interval) {
        this.updateInterval = interval;
        return this;
    }

    private void validate() {
        if (serverPort < 0 || serverPort > 65535) {
            throw new IllegalArgumentException("MCP_SERVER_PORT out of range: " + serverPort);
        }
        if (probeConcurrency <= 0) {
            throw new IllegalArgumentException("MIHOMO_TEST_WORKERS must be positive");
        }
        if (probeTimeout.isZero() || probeTimeout.isNegative()) {
            throw new IllegalArgumentException("MIHOMO_TCP_TIMEOUT must be positive");
        }
        if (pipelineTimeout.isZero() || pipelineTimeout.isNegative()) {
            throw new IllegalArgumentException("UPDATE_TIMEOUT_SECONDS must be positive");
        }
        if (outputTailChars < 0) {
            throw new IllegalArgumentException("UPDATE_TAIL_CHARS must be non-negative");
        }
    }

    private static String value(Map<String, String> env, String key) {
        String value = env.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static URI parseUri(String key, String value) {
        try {
            return URI.create(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(key + " is not a valid URI: '" + value + "'", e);
        }
    }

    @Override
    public String toString() {
        return "ControlConfig{" +
                "serverPort=" + serverPort +
                ", engineApiBase=" + engineApiBase +
                ", engineSecretSet=" + (engineSecret != null && !engineSecret.isBlank()) +
                ", probeTimeout=" + probeTimeout.toMillis() + "ms" +
                ", probeConcurrency=" + probeConcurrency +
                ", pipeline=" + pipelineCommand() +
                ", pipelineTimeout=" + pipelineTimeout.toSeconds() + "s" +
                ", updateInterval=" + updateInterval.toMinutes() + "m" +
                '}';
    }
}
