package io.avscheduler.config;

import io.avscheduler.exception.ConfigException;
import io.avscheduler.exception.InvalidScheduleException;
import io.avscheduler.exception.JobNotFoundException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class JobConfigEditorTest {

    @Test
    void addEditDeleteRoundTripThroughFile() throws Exception {
        Path dir = Files.createTempDirectory("avscheduler-editor-");
        Path file = dir.resolve("config.toml");
        Files.writeString(file, """
                [interpreters]
                shell = "/bin/sh"

                [jobs.backup]
                type = "shell"
                schedule = "0 2 * * *"
                command = "echo backup"
                env_file = "backup.env"
                """, StandardCharsets.UTF_8);

        JobConfigEditor.JobMutation added = JobConfigEditor.addJob(file, "report",
                new ConfigDocument.JobSection("shell", "30 2 * * *", null, null, "echo report",
                        "backup.last_run_successful", null, "Report", null));
        assertEquals("added", added.action());
        assertEquals(2, added.jobCount());

        JobConfigEditor.editJob(file, "report",
                new ConfigDocument.JobSection(null, "45 2 * * *", null, null, null, null, null, null, null));
        JobDefinition report = ConfigLoader.load(file).job("report").orElseThrow();
        assertEquals("45 2 * * *", report.schedule());
        assertEquals("echo report", report.command());
        assertEquals("backup.last_run_successful", report.condition());

        ConfigDocument raw = ConfigLoader.readDocument(file);
        assertEquals("backup.env", raw.jobs().get("backup").envFile());

        JobConfigEditor.deleteJob(file, "report");
        SchedulerConfig after = ConfigLoader.load(file);
        assertFalse(after.jobs().containsKey("report"));
        assertTrue(after.jobs().containsKey("backup"));
    }

    @Test
    void rejectsDuplicatesMissingJobsAndBadSchedules() throws Exception {
        Path dir = Files.createTempDirectory("avscheduler-editor-errors-");
        Path file = dir.resolve("config.json");
        Files.writeString(file, """
                {"interpreters": {"shell": "/bin/sh"},
                 "jobs": {"backup": {"type": "shell", "schedule": "0 2 * * *", "command": "true"}}}
                """, StandardCharsets.UTF_8);
        String before = Files.readString(file, StandardCharsets.UTF_8);

        ConfigDocument.JobSection dup = new ConfigDocument.JobSection("shell", "* * * * *", null, null, "true",
                null, null, null, null);
        assertThrows(ConfigException.class, () -> JobConfigEditor.addJob(file, "backup", dup));

        ConfigDocument.JobSection badCron = new ConfigDocument.JobSection("shell", "99 * * * *", null, null, "true",
                null, null, null, null);
        assertThrows(InvalidScheduleException.class, () -> JobConfigEditor.addJob(file, "broken", badCron));

        assertThrows(JobNotFoundException.class, () -> JobConfigEditor.deleteJob(file, "ghost"));
        assertThrows(JobNotFoundException.class, () -> JobConfigEditor.editJob(file, "ghost", dup));

        assertEquals(before, Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void addJobCreatesMissingFile() throws Exception {
        Path dir = Files.createTempDirectory("avscheduler-editor-new-");
        Path file = dir.resolve("conf").resolve("config.toml");

        JobConfigEditor.addJob(file, "tick", new ConfigDocument.JobSection("shell", null, "interval", 60L, "true",
                null, null, null, null));

        assertTrue(Files.exists(file));
        assertEquals(60L, ConfigLoader.load(file).job("tick").orElseThrow().intervalSeconds());
    }
}
