package io.avscheduler.config;

import io.avscheduler.exception.InvalidScheduleException;
import io.avscheduler.model.ScheduleType;
import io.avscheduler.trigger.ScheduleSpec;

import java.util.Objects;

/**
 * A configured job. Schedule text is kept as written; {@link #scheduleSpec()} validates it
 * when the job is scheduled, not when the configuration is loaded.
 */
public record JobDefinition(
        String jobId,
        String type,
        ScheduleType scheduleType,
        String schedule,
        Long intervalSeconds,
        String command,
        String condition,
        String envFile,
        String name,
        long timeoutSeconds
) {
    public JobDefinition {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("job id must not be blank");
        }
        scheduleType = scheduleType == null ? ScheduleType.CRON : scheduleType;
        condition = condition == null || condition.isBlank() ? null : condition.trim();
        envFile = envFile == null || envFile.isBlank() ? null : envFile;
        timeoutSeconds = Math.max(0L, timeoutSeconds);
    }

    public static JobDefinition cron(String jobId, String type, String schedule, String command) {
        return new JobDefinition(jobId, type, ScheduleType.CRON, schedule, null, command, null, null, null, 0L);
    }

    public static JobDefinition interval(String jobId, String type, long intervalSeconds, String command) {
        return new JobDefinition(jobId, type, ScheduleType.INTERVAL, null, intervalSeconds, command, null, null, null, 0L);
    }

    public JobDefinition withCondition(String newCondition) {
        return new JobDefinition(jobId, type, scheduleType, schedule, intervalSeconds, command, newCondition, envFile, name, timeoutSeconds);
    }

    public ScheduleSpec scheduleSpec() {
        return switch (scheduleType) {
            case CRON -> {
                if (schedule == null || schedule.isBlank()) {
                    throw new InvalidScheduleException("job '" + jobId + "' has schedule_type=cron but no schedule");
                }
                yield ScheduleSpec.cron(schedule);
            }
            case INTERVAL -> {
                if (intervalSeconds == null) {
                    throw new InvalidScheduleException("job '" + jobId + "' has schedule_type=interval but no interval_seconds");
                }
                yield ScheduleSpec.interval(intervalSeconds);
            }
        };
    }

    public boolean sameSchedule(JobDefinition other) {
        return other != null
                && scheduleType == other.scheduleType
                && Objects.equals(schedule == null ? null : schedule.trim(), other.schedule == null ? null : other.schedule.trim())
                && Objects.equals(intervalSeconds, other.intervalSeconds);
    }

    public boolean hasCondition() {
        return condition != null;
    }

    public String displayName() {
        return name == null || name.isBlank() ? "Job " + jobId : name;
    }
}
