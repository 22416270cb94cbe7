package io.avscheduler.execution;

import io.avscheduler.model.ExecutionRecord;

/**
 * Result of one subprocess run: the unsaved record plus captured output.
 * {@code error} is non-null only when the process could not be started or was killed.
 */
public record ExecutionOutcome(ExecutionRecord record, String stdout, String stderr, String error) {
    public ExecutionOutcome {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public boolean timedOut() {
        return record.exitCode() == ExecutionRecord.TIMEOUT_EXIT_CODE;
    }

    public boolean spawnFailed() {
        return record.exitCode() == ExecutionRecord.SPAWN_FAILED_EXIT_CODE;
    }
}
