package io.avscheduler.execution;

import io.avscheduler.exception.InvalidEnvFileException;
import io.avscheduler.model.ExecutionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one job command as {@code [interpreter, inlineFlag, command]} and reports how it ended.
 *
 * <p>Never throws for process-level failures: spawn problems and timeouts come back as
 * records carrying {@link ExecutionRecord#SPAWN_FAILED_EXIT_CODE} or
 * {@link ExecutionRecord#TIMEOUT_EXIT_CODE}.
 */
public final class ExecutionEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutionEngine.class);
    private static final long DRAIN_WAIT_MS = 2_000L;
    private static final AtomicInteger DRAIN_SEQ = new AtomicInteger();
    private static final ExecutorService DRAINERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "avscheduler-output-" + DRAIN_SEQ.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final Clock clock;

    public ExecutionEngine() {
        this(Clock.systemUTC());
    }

    public ExecutionEngine(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param envFile optional; a missing file is ignored with a warning
     * @param timeout optional; {@code null} or non-positive waits indefinitely
     */
    public ExecutionOutcome execute(String jobId, String interpreterPath, String command, Path envFile, Duration timeout) {
        long startedMs = clock.millis();
        long startedNanos = System.nanoTime();

        ProcessBuilder pb = new ProcessBuilder(commandLine(interpreterPath, command));
        try {
            applyEnvFile(pb.environment(), envFile, jobId);
        } catch (InvalidEnvFileException e) {
            LOG.error("Job {} not started: {}", jobId, e.getMessage());
            return failed(jobId, startedMs, startedNanos, e.getMessage());
        }

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            LOG.error("Job {} failed to spawn '{}': {}", jobId, interpreterPath, e.getMessage());
            return failed(jobId, startedMs, startedNanos, "spawn failed: " + e.getMessage());
        }
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            LOG.debug("Job {} stdin close failed: {}", jobId, e.getMessage());
        }

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());
        try {
            boolean finished;
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                process.waitFor();
                finished = true;
            } else {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                double seconds = elapsedSeconds(startedNanos);
                LOG.warn("Job {} timed out after {} and was killed", jobId, timeout);
                return new ExecutionOutcome(
                        ExecutionRecord.unsaved(jobId, ExecutionRecord.TIMEOUT_EXIT_CODE, seconds, startedMs),
                        collect(stdout),
                        collect(stderr),
                        "timeout after " + timeout
                );
            }
            double seconds = elapsedSeconds(startedNanos);
            int exitCode = process.exitValue();
            return new ExecutionOutcome(
                    ExecutionRecord.unsaved(jobId, exitCode, seconds, startedMs),
                    collect(stdout),
                    collect(stderr),
                    null
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            double seconds = elapsedSeconds(startedNanos);
            return new ExecutionOutcome(
                    ExecutionRecord.unsaved(jobId, ExecutionRecord.TIMEOUT_EXIT_CODE, seconds, startedMs),
                    "",
                    "",
                    "interrupted while waiting for process"
            );
        }
    }

    static List<String> commandLine(String interpreterPath, String command) {
        return List.of(interpreterPath, inlineFlag(interpreterPath), command == null ? "" : command);
    }

    static String inlineFlag(String interpreterPath) {
        String name = Path.of(interpreterPath).getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".exe")) {
            name = name.substring(0, name.length() - 4);
        }
        if (name.startsWith("node") || name.startsWith("ruby") || name.startsWith("perl")) {
            return "-e";
        }
        if (name.startsWith("pwsh") || name.startsWith("powershell")) {
            return "-Command";
        }
        return "-c";
    }

    private static void applyEnvFile(Map<String, String> env, Path envFile, String jobId) {
        if (envFile == null) {
            return;
        }
        if (!Files.isRegularFile(envFile)) {
            LOG.warn("Environment file {} for job {} not found, running without it", envFile, jobId);
            return;
        }
        env.putAll(EnvFileLoader.load(envFile));
    }

    private static CompletableFuture<String> drain(InputStream in) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream stream = in) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, DRAINERS);
    }

    private static String collect(CompletableFuture<String> future) {
        try {
            return future.get(DRAIN_WAIT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            LOG.debug("Output capture incomplete: {}", e.toString());
            return "";
        }
    }

    private ExecutionOutcome failed(String jobId, long startedMs, long startedNanos, String error) {
        return new ExecutionOutcome(
                ExecutionRecord.unsaved(jobId, ExecutionRecord.SPAWN_FAILED_EXIT_CODE, elapsedSeconds(startedNanos), startedMs),
                "",
                "",
                error
        );
    }

    private static double elapsedSeconds(long startedNanos) {
        return Math.max(0L, System.nanoTime() - startedNanos) / 1_000_000_000.0d;
    }
}
