package io.avscheduler.observability;

import io.avscheduler.execution.ExecutionOutcome;
import io.avscheduler.model.ExecutionRecord;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class ExecutionJournalTest {

    @Test
    void appendsReadableEntriesWithOutput() throws Exception {
        Path root = Files.createTempDirectory("avscheduler-journal-");
        Path file = root.resolve("logs").resolve("executions.log");
        ExecutionJournal journal = new ExecutionJournal(file, ZoneOffset.UTC);
        long ts = Instant.parse("2025-06-01T08:30:00Z").toEpochMilli();

        journal.record(new ExecutionOutcome(ExecutionRecord.unsaved("backup", 0, 1.234d, ts), "done\n", "", null));
        journal.record(new ExecutionOutcome(ExecutionRecord.unsaved("report", 2, 0.5d, ts), "", "boom\n", null));

        String text = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(text.contains("[2025-06-01 08:30:00] Job backup: Exit Code=0, Execution Time=1.23s"));
        assertTrue(text.contains("STDOUT:" + System.lineSeparator() + "done"));
        assertTrue(text.contains("Job report: Exit Code=2, Execution Time=0.50s"));
        assertTrue(text.contains("STDERR:" + System.lineSeparator() + "boom"));
        assertTrue(text.indexOf("Job backup") < text.indexOf("Job report"));
    }

    @Test
    void omitsEmptyOutputBlocksAndShowsErrors() throws Exception {
        Path root = Files.createTempDirectory("avscheduler-journal-error-");
        ExecutionJournal journal = new ExecutionJournal(root.resolve("executions.log"), ZoneOffset.UTC);

        String entry = journal.format(new ExecutionOutcome(
                ExecutionRecord.unsaved("ghost", ExecutionRecord.SPAWN_FAILED_EXIT_CODE, 0.0d, 0L),
                "",
                "",
                "spawn failed: No such file"
        ));

        assertTrue(entry.contains("Exit Code=-1"));
        assertTrue(entry.contains("ERROR: spawn failed: No such file"));
        assertFalse(entry.contains("STDOUT:"));
        assertFalse(entry.contains("STDERR:"));
    }
}
