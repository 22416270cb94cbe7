package io.avscheduler.observability;

import io.avscheduler.execution.ExecutionOutcome;
import io.avscheduler.model.ExecutionRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Append-only text journal of executions, mirroring each stored record together
 * with the output the database does not keep.
 */
public final class ExecutionJournal {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path journalFile;
    private final ZoneId zone;

    public ExecutionJournal(Path journalFile, ZoneId zone) {
        this.journalFile = journalFile;
        this.zone = zone == null ? ZoneId.systemDefault() : zone;
        try {
            Path parent = journalFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(journalFile, "", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize execution journal: " + journalFile, e);
        }
    }

    public synchronized void record(ExecutionOutcome outcome) {
        String entry = format(outcome);
        try {
            Files.writeString(journalFile, entry, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write execution journal", e);
        }
    }

    String format(ExecutionOutcome outcome) {
        ExecutionRecord record = outcome.record();
        String nl = System.lineSeparator();
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(TIMESTAMP.format(Instant.ofEpochMilli(record.timestampMs()).atZone(zone))).append("] ")
                .append("Job ").append(record.jobId()).append(": ")
                .append("Exit Code=").append(record.exitCode()).append(", ")
                .append("Execution Time=").append(String.format(Locale.ROOT, "%.2f", record.durationSeconds())).append('s')
                .append(nl);
        if (outcome.error() != null) {
            sb.append("ERROR: ").append(outcome.error()).append(nl);
        }
        appendBlock(sb, "STDOUT", outcome.stdout(), nl);
        appendBlock(sb, "STDERR", outcome.stderr(), nl);
        return sb.toString();
    }

    private static void appendBlock(StringBuilder sb, String label, String text, String nl) {
        if (text == null || text.isBlank()) {
            return;
        }
        sb.append(label).append(':').append(nl).append(text.stripTrailing()).append(nl);
    }
}
