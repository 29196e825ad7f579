package automihomo.control.service;

import automihomo.control.model.RunOutcome;
import automihomo.control.model.RunResult;
import automihomo.control.util.TailBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs the refresh pipeline as a child process with a hard deadline.
 *
 * stdout and stderr are drained concurrently into bounded tail buffers.
 * When the deadline passes the process tree is killed and the run is
 * reported as a timeout.
 */
public final class PipelineRunner implements UpdatePipeline {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    /** How long to wait for the output pumps after the process exits */
    private static final long DRAIN_GRACE_MS = 2000;
    private static final long KILL_WAIT_MS = 5000;

    private final List<String> command;
    private final Path workDir;
    private final Duration timeout;
    private final int tailChars;
    private final Clock clock;

    public PipelineRunner(List<String> command, Path workDir, Duration timeout, int tailChars) {
        this(command, workDir, timeout, tailChars, Clock.systemUTC());
    }

    public PipelineRunner(List<String> command, Path workDir, Duration timeout, int tailChars, Clock clock) {
        this.command = List.copyOf(Objects.requireNonNull(command, "command"));
        this.workDir = Objects.requireNonNull(workDir, "workDir");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (this.command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (tailChars < 0) {
            throw new IllegalArgumentException("tailChars must be non-negative");
        }
        this.tailChars = tailChars;
    }

    @Override
    public RunResult run() {
        Instant startedAt = clock.instant();
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .start();
        } catch (IOException | RuntimeException e) {
            log.error("Failed to start pipeline {}: {}", command, e.getMessage());
            return RunResult.failed("failed to start pipeline: " + e.getMessage(), startedAt, clock.instant());
        }
        log.info("Pipeline started: pid={} command={}", process.pid(), command);

        closeQuietly(process);
        TailBuffer stdout = new TailBuffer(tailChars);
        TailBuffer stderr = new TailBuffer(tailChars);
        Thread stdoutPump = pump(process.getInputStream(), stdout, "pipeline-stdout-" + process.pid());
        Thread stderrPump = pump(process.getErrorStream(), stderr, "pipeline-stderr-" + process.pid());

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            kill(process);
            Thread.currentThread().interrupt();
            return RunResult.builder()
                    .outcome(RunOutcome.ERROR)
                    .error("pipeline interrupted")
                    .stdoutTail(stdout.tail())
                    .stderrTail(stderr.tail())
                    .startedAt(startedAt)
                    .finishedAt(clock.instant())
                    .build();
        }

        if (!finished) {
            log.warn("Pipeline pid={} exceeded {}s, killing it", process.pid(), timeout.toSeconds());
            kill(process);
            joinQuietly(stdoutPump);
            joinQuietly(stderrPump);
            return RunResult.timedOut(timeout, stdout.tail(), stderr.tail(), startedAt, clock.instant());
        }

        joinQuietly(stdoutPump);
        joinQuietly(stderrPump);
        int exitCode = process.exitValue();
        log.info("Pipeline pid={} exited with status {}", process.pid(), exitCode);
        return RunResult.exited(exitCode, stdout.tail(), stderr.tail(), startedAt, clock.instant());
    }

    public List<String> command() {
        return command;
    }

    public Duration timeout() {
        return timeout;
    }

    private static Thread pump(InputStream stream, TailBuffer sink, String name) {
        Thread thread = new Thread(() -> {
            char[] chunk = new char[4096];
            try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                int read;
                while ((read = reader.read(chunk)) != -1) {
                    sink.append(chunk, 0, read);
                }
            } catch (IOException e) {
                // stream closed by kill
                log.debug("{} closed: {}", name, e.getMessage());
            }
        }, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /** Kill descendants first, they would be reparented once the parent dies */
    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(KILL_WAIT_MS, TimeUnit.MILLISECONDS)) {
                log.error("Pipeline pid={} did not die after forced kill", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void closeQuietly(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close pipeline stdin: {}", e.getMessage());
        }
    }

    private static void joinQuietly(Thread pump) {
        try {
            pump.join(DRAIN_GRACE_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
