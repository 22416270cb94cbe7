package io.avscheduler.cli;

import io.avscheduler.config.ConfigLoader;
import io.avscheduler.config.JobDefinition;
import io.avscheduler.config.SchedulerConfig;
import io.avscheduler.model.ExecutionRecord;
import io.avscheduler.model.ScheduleType;
import io.avscheduler.storage.Database;
import io.avscheduler.storage.ExecutionLogStore;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class AvSchedulerCommandTest {

    @Test
    void jobLifecycleThroughCommands() throws Exception {
        Path root = Files.createTempDirectory("avscheduler-cli-");
        try {
            Path config = writeConfig(root);

            assertEquals(0, run(config, "add-job", "hello", "--type", "shell",
                    "--command", "echo hello", "--interval-seconds", "3600", "--name", "Hello"));
            assertEquals(1, run(config, "add-job", "hello", "--type", "shell",
                    "--command", "echo again", "--interval-seconds", "60"));
            assertEquals(1, run(config, "add-job", "noschedule", "--type", "shell", "--command", "true"));
            assertEquals(1, run(config, "add-job", "badcron", "--type", "shell", "--command", "true",
                    "--schedule", "61 * * * *"));

            SchedulerConfig loaded = ConfigLoader.load(config);
            JobDefinition hello = loaded.jobs().get("hello");
            assertEquals(ScheduleType.INTERVAL, hello.scheduleType());
            assertEquals("Hello", hello.displayName());
            assertFalse(loaded.jobs().containsKey("badcron"));

            assertEquals(0, run(config, "list-jobs"));
            assertEquals(0, run(config, "run-job", "hello"));
            assertEquals(1, run(config, "run-job", "missing"));

            assertEquals(0, run(config, "edit-job", "hello", "--command", "exit 3"));
            assertEquals(1, run(config, "run-job", "hello"));
            assertEquals(1, run(config, "edit-job", "missing", "--command", "true"));

            ExecutionLogStore store = new ExecutionLogStore(new Database(loaded.settings().dbPath()));
            List<ExecutionRecord> records = store.list("hello");
            assertEquals(2, records.size());
            assertEquals(3, records.get(0).exitCode());
            assertEquals(0, records.get(1).exitCode());

            assertEquals(0, run(config, "view-logs", "--job-id", "hello", "--since", "2000-01-01"));
            assertEquals(1, run(config, "view-logs", "--since", "whenever"));

            assertEquals(0, run(config, "cleanup-logs", "hello", "--all"));
            assertTrue(store.list("hello").isEmpty());

            assertEquals(0, run(config, "delete-job", "hello"));
            assertFalse(ConfigLoader.load(config).jobs().containsKey("hello"));
            assertEquals(1, run(config, "delete-job", "hello"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void gatedRunWithoutUpstreamHistoryIsSkipped() throws Exception {
        Path root = Files.createTempDirectory("avscheduler-cli-");
        try {
            Path config = writeConfig(root);
            Files.writeString(config, """

                    [jobs.upstream]
                    type = "shell"
                    schedule = "0 3 * * *"
                    command = "true"

                    [jobs.downstream]
                    type = "shell"
                    schedule = "0 4 * * *"
                    command = "true"
                    condition = "upstream.last_run_successful"
                    """, StandardCharsets.UTF_8, StandardOpenOption.APPEND);

            assertEquals(1, run(config, "run-job", "downstream"));
            assertEquals(0, run(config, "run-job", "upstream"));
            assertEquals(0, run(config, "run-job", "downstream"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cleanupRequiresExactlyOneSelector() throws Exception {
        Path root = Files.createTempDirectory("avscheduler-cli-");
        try {
            Path config = writeConfig(root);

            assertEquals(2, run(config, "cleanup-logs", "hello"));
            assertEquals(2, run(config, "cleanup-logs", "hello", "--all", "--before", "2025-01-01"));
            assertEquals(0, run(config, "cleanup-logs", "hello", "--before", "2025-01-01"));
            assertEquals(1, run(config, "cleanup-logs", "hello", "--before", "soon"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reloadConfigTouchesFileOnlyWhenValid() throws Exception {
        Path root = Files.createTempDirectory("avscheduler-cli-");
        try {
            Path config = writeConfig(root);
            FileTime old = FileTime.from(Instant.parse("2020-01-01T00:00:00Z"));
            Files.setLastModifiedTime(config, old);

            assertEquals(0, run(config, "reload-config"));
            assertNotEquals(old, Files.getLastModifiedTime(config));

            Files.writeString(config, "[settings\nbroken", StandardCharsets.UTF_8);
            Files.setLastModifiedTime(config, old);
            assertEquals(1, run(config, "reload-config"));
            assertEquals(old, Files.getLastModifiedTime(config));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void statusAndStopWithoutDaemon() throws Exception {
        Path root = Files.createTempDirectory("avscheduler-cli-");
        try {
            Path config = writeConfig(root);

            assertEquals(0, run(config, "status"));
            assertEquals(1, run(config, "stop", "--wait-seconds", "1"));
            assertEquals(2, run(config, "no-such-command"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void restartStopsPreviousDaemonAndTakesOver() throws Exception {
        Path root = Files.createTempDirectory("avscheduler-cli-");
        Process previous = new ProcessBuilder("sleep", "30").start();
        AtomicInteger exit = new AtomicInteger(-1);
        Thread daemon = null;
        try {
            Path config = writeConfig(root);
            Path pidFile = root.resolve("avscheduler.pid");
            Files.writeString(pidFile, Long.toString(previous.pid()), StandardCharsets.UTF_8);

            daemon = new Thread(() -> exit.set(run(config, "restart", "--wait-seconds", "5",
                    "--reload-interval-ms", "100")), "avscheduler-restart-test");
            daemon.start();

            assertTrue(previous.waitFor(10, TimeUnit.SECONDS));
            String self = Long.toString(ProcessHandle.current().pid());
            assertTrue(waitUntil(() -> self.equals(readPid(pidFile)), 10_000L));

            daemon.interrupt();
            daemon.join(10_000L);
            assertFalse(daemon.isAlive());
            assertEquals(0, exit.get());
            assertFalse(Files.exists(pidFile));
        } finally {
            previous.destroyForcibly();
            if (daemon != null && daemon.isAlive()) {
                daemon.interrupt();
                daemon.join(5_000L);
            }
            deleteRecursively(root);
        }
    }

    @Test
    void restartRejectsInvalidConfigBeforeStopping() throws Exception {
        Path root = Files.createTempDirectory("avscheduler-cli-");
        try {
            Path config = writeConfig(root);
            Files.writeString(config, "[settings\nbroken", StandardCharsets.UTF_8);

            assertEquals(1, run(config, "restart", "--wait-seconds", "1"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static String readPid(Path pidFile) {
        try {
            return Files.exists(pidFile) ? Files.readString(pidFile, StandardCharsets.UTF_8).trim() : "";
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static boolean waitUntil(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(50L);
        }
        return condition.getAsBoolean();
    }

    private static int run(Path config, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "-c";
        full[1] = config.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return new CommandLine(new AvSchedulerCommand()).execute(full);
    }

    private static Path writeConfig(Path root) throws IOException {
        Path config = root.resolve("config.toml");
        Files.writeString(config, """
                [settings]
                db_path = "jobs.db"
                pid_file = "avscheduler.pid"
                log_file = "logs/executions.log"
                timezone = "UTC"

                [interpreters]
                shell = "/bin/sh"
                """, StandardCharsets.UTF_8);
        return config;
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
