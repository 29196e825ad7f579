package automihomo;

import automihomo.control.config.ControlConfig;
import automihomo.control.config.Dependencies;
import automihomo.control.server.ControlServer;
import automihomo.probe.LatencyProber;
import automihomo.probe.NoReachableTargetsException;
import automihomo.probe.NodeSelector;
import automihomo.probe.ProbeResult;
import automihomo.probe.RankedList;
import automihomo.probe.SubscriptionException;
import automihomo.probe.SubscriptionTargetSupplier;
import automihomo.probe.TcpTargetProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.CountDownLatch;

/**
 * Process entry point.
 *
 * <pre>
 * serve                          run the HTTP control surface (default)
 * probe --subscription FILE      print the fastest reachable node name
 *       [--workers N] [--timeout SECONDS] [--top K]
 * </pre>
 *
 * Exit codes: 0 success, 1 nothing reachable or unreadable subscription,
 * 2 bad arguments.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_NO_TARGET = 1;
    static final int EXIT_USAGE = 2;

    private static final int DEFAULT_TOP = 10;

    private App() {
    }

    public static void main(String[] args) {
        int code = run(args, System.out);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * Run a command; returns the process exit code.
     */
    static int run(String[] args, PrintStream out) {
        String command = args == null || args.length == 0 ? "serve" : args[0];
        String[] rest = args == null || args.length == 0 ? new String[0] : Arrays.copyOfRange(args, 1, args.length);
        try {
            switch (command) {
                case "serve":
                    return serve(ControlConfig.fromEnv());
                case "probe":
                    return probe(parseProbeArgs(rest, ControlConfig.fromEnv()), out);
                default:
                    throw new IllegalArgumentException("unknown command: " + command);
            }
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println("Usage: serve | probe --subscription FILE [--workers N] [--timeout SECONDS] [--top K]");
            return EXIT_USAGE;
        }
    }

    private static int serve(ControlConfig config) {
        Dependencies deps = Dependencies.create(config);
        ControlServer server = new ControlServer(config.serverHost(), config.serverPort(), deps.routerHandler());
        try {
            server.start();
        } catch (IllegalStateException e) {
            deps.close();
            throw e;
        }
        deps.startScheduler();

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            deps.close();
            latch.countDown();
        }, "shutdown"));

        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return EXIT_OK;
    }

    /**
     * One-shot selection. Only the winner's name goes to {@code out}; diagnostics are logged.
     */
    static int probe(ProbeOptions options, PrintStream out) {
        NodeSelector selector = new NodeSelector(prober(options));
        try {
            RankedList ranked = selector.rank(new SubscriptionTargetSupplier(options.subscription()));
            logTable(ranked, options.top());
            ProbeResult best = ranked.requireBest();
            log.info("Best node: {} ({}ms)", best.target().name(), best.latencyMs());
            out.println(best.target().name());
            return EXIT_OK;
        } catch (SubscriptionException e) {
            log.error("Cannot read subscription: {}", e.getMessage());
            return EXIT_NO_TARGET;
        } catch (NoReachableTargetsException e) {
            log.error("No reachable nodes among {} probed", e.probed());
            return EXIT_NO_TARGET;
        }
    }

    static LatencyProber prober(ProbeOptions options) {
        return new LatencyProber(new TcpTargetProbe(), options.workers(), options.timeout());
    }

    private static void logTable(RankedList ranked, int top) {
        int rank = 1;
        for (ProbeResult result : ranked.top(top)) {
            if (!result.reachable()) {
                break;
            }
            log.info(String.format("%3d. %6dms  %s", rank++, result.latencyMs(), result.target().name()));
        }
    }

    /**
     * Flags override the worker count and timeout taken from {@code config}.
     */
    static ProbeOptions parseProbeArgs(String[] args, ControlConfig config) {
        Path subscription = null;
        int workers = config.probeConcurrency();
        Duration timeout = config.probeTimeout();
        int top = DEFAULT_TOP;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--subscription", "-s" -> subscription = Paths.get(value(args, ++i, arg));
                case "--workers", "-w" -> workers = positiveInt(value(args, ++i, arg), arg);
                case "--timeout", "-t" -> timeout = Duration.ofSeconds(positiveInt(value(args, ++i, arg), arg));
                case "--top" -> top = positiveInt(value(args, ++i, arg), arg);
                default -> throw new IllegalArgumentException("unknown argument: " + arg);
            }
        }
        if (subscription == null) {
            throw new IllegalArgumentException("--subscription is required");
        }
        return new ProbeOptions(subscription, workers, timeout, top);
    }

    private static String value(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return args[index];
    }

    private static int positiveInt(String value, String flag) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed <= 0) {
                throw new IllegalArgumentException(flag + " must be positive");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " must be an integer, got '" + value + "'");
        }
    }

    record ProbeOptions(Path subscription, int workers, Duration timeout, int top) {
    }
}
