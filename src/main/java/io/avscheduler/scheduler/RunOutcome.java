package io.avscheduler.scheduler;

import io.avscheduler.model.ExecutionRecord;
import io.avscheduler.model.RunStatus;

/**
 * Result of a manual run. {@code record} is present only for {@link RunStatus#EXECUTED}.
 */
public record RunOutcome(String jobId, RunStatus status, ExecutionRecord record) {
    static RunOutcome executed(ExecutionRecord record) {
        return new RunOutcome(record.jobId(), RunStatus.EXECUTED, record);
    }

    static RunOutcome skipped(String jobId, RunStatus status) {
        return new RunOutcome(jobId, status, null);
    }
}
