package io.avscheduler.model;

import java.time.Instant;

/**
 * One completed attempt to run a job. Immutable once appended to the log store.
 *
 * <p>{@code id} is {@code 0} until the store assigns one. {@code timestampMs} is the
 * execution start time in epoch milliseconds (UTC).
 */
public record ExecutionRecord(
        long id,
        String jobId,
        int exitCode,
        double durationSeconds,
        long timestampMs
) {
    /** The interpreter could not be started, or its environment could not be prepared. */
    public static final int SPAWN_FAILED_EXIT_CODE = -1;
    /** The process exceeded its configured timeout and was killed. */
    public static final int TIMEOUT_EXIT_CODE = -2;

    public ExecutionRecord {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId must not be blank");
        }
        if (durationSeconds < 0.0d || Double.isNaN(durationSeconds)) {
            throw new IllegalArgumentException("durationSeconds must be >= 0: " + durationSeconds);
        }
    }

    public static ExecutionRecord unsaved(String jobId, int exitCode, double durationSeconds, long timestampMs) {
        return new ExecutionRecord(0L, jobId, exitCode, durationSeconds, timestampMs);
    }

    public ExecutionRecord withId(long assignedId) {
        return new ExecutionRecord(assignedId, jobId, exitCode, durationSeconds, timestampMs);
    }

    public boolean successful() {
        return exitCode == 0;
    }

    public Instant startedAt() {
        return Instant.ofEpochMilli(timestampMs);
    }
}
