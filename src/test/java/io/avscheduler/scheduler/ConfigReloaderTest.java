package io.avscheduler.scheduler;

import io.avscheduler.config.ConfigLoader;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class ConfigReloaderTest {
    private static final String HEADER = """
            [settings]
            db_path = "jobs.db"
            pid_file = "avscheduler.pid"
            log_file = "logs/executions.log"
            timezone = "UTC"

            [interpreters]
            shell = "/bin/sh"
            """;

    @Test
    void reloadsOnlyWhenModificationTimeChanges() throws Exception {
        Path root = Files.createTempDirectory("avscheduler-reload-");
        Path config = root.resolve("config.toml");
        write(config, HEADER + job("first"), Instant.parse("2025-01-01T00:00:00Z"));
        SchedulerCore core = SchedulerCore.create(ConfigLoader.load(config));
        try {
            ConfigReloader reloader = new ConfigReloader(config, core);
            assertTrue(reloader.maybeReload().isEmpty());

            write(config, HEADER + job("first") + job("second"), Instant.parse("2025-01-01T00:01:00Z"));
            Optional<ReloadOutcome> outcome = reloader.maybeReload();

            assertTrue(outcome.isPresent());
            assertEquals(List.of("second"), outcome.get().added());
            assertEquals(List.of("first"), outcome.get().unchanged());
            assertEquals(2, core.listJobs().size());
            assertTrue(reloader.maybeReload().isEmpty());
        } finally {
            core.shutdown();
            deleteRecursively(root);
        }
    }

    @Test
    void invalidFileKeepsCurrentJobs() throws Exception {
        Path root = Files.createTempDirectory("avscheduler-reload-");
        Path config = root.resolve("config.toml");
        write(config, HEADER + job("first"), Instant.parse("2025-01-01T00:00:00Z"));
        SchedulerCore core = SchedulerCore.create(ConfigLoader.load(config));
        try {
            ConfigReloader reloader = new ConfigReloader(config, core);

            write(config, HEADER + "[jobs.broken\n", Instant.parse("2025-01-01T00:02:00Z"));
            assertTrue(reloader.maybeReload().isEmpty());
            assertEquals("first", core.listJobs().get(0).jobId());

            write(config, HEADER + job("replacement"), Instant.parse("2025-01-01T00:03:00Z"));
            ReloadOutcome outcome = reloader.maybeReload().orElseThrow();
            assertEquals(List.of("replacement"), outcome.added());
            assertEquals(List.of("first"), outcome.removed());
        } finally {
            core.shutdown();
            deleteRecursively(root);
        }
    }

    private static String job(String id) {
        return """

                [jobs.%s]
                type = "shell"
                schedule = "0 * * * *"
                command = "true"
                """.formatted(id);
    }

    private static void write(Path file, String content, Instant mtime) throws IOException {
        Files.writeString(file, content, StandardCharsets.UTF_8);
        Files.setLastModifiedTime(file, FileTime.from(mtime));
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
