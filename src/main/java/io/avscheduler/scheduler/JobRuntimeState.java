package io.avscheduler.scheduler;

import io.avscheduler.config.JobDefinition;
import io.avscheduler.trigger.ScheduleSpec;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registry entry for one job. The definition, schedule and interpreter are fixed for
 * the lifetime of the entry; a reload replaces the entry but hands the same
 * {@code running} flag, last fire time and active run to its successor.
 */
final class JobRuntimeState {
    private final JobDefinition job;
    private final ScheduleSpec spec;
    private final String interpreterPath;
    private final String rejectionReason;
    private final AtomicBoolean running;
    private volatile Instant nextFireTime;
    private volatile Instant lastFireTime;
    private volatile Future<?> activeRun;

    JobRuntimeState(
            JobDefinition job,
            ScheduleSpec spec,
            String interpreterPath,
            String rejectionReason,
            AtomicBoolean running,
            Instant nextFireTime,
            Instant lastFireTime,
            Future<?> activeRun
    ) {
        this.job = job;
        this.spec = spec;
        this.interpreterPath = interpreterPath;
        this.rejectionReason = rejectionReason;
        this.running = running;
        this.nextFireTime = nextFireTime;
        this.lastFireTime = lastFireTime;
        this.activeRun = activeRun;
    }

    JobDefinition job() {
        return job;
    }

    String jobId() {
        return job.jobId();
    }

    ScheduleSpec spec() {
        return spec;
    }

    String interpreterPath() {
        return interpreterPath;
    }

    String rejectionReason() {
        return rejectionReason;
    }

    AtomicBoolean running() {
        return running;
    }

    boolean scheduled() {
        return rejectionReason == null && spec != null;
    }

    Instant nextFireTime() {
        return nextFireTime;
    }

    void nextFireTime(Instant next) {
        this.nextFireTime = next;
    }

    /** When the trigger last fired and the run was handed to a worker; manual runs excluded. */
    Instant lastFireTime() {
        return lastFireTime;
    }

    void lastFireTime(Instant fired) {
        this.lastFireTime = fired;
    }

    /** The scheduled run still in progress, if any. */
    Optional<Future<?>> activeRun() {
        Future<?> run = activeRun;
        return run == null || run.isDone() ? Optional.empty() : Optional.of(run);
    }

    Future<?> activeRunHandle() {
        return activeRun;
    }

    void activeRun(Future<?> run) {
        this.activeRun = run;
    }
}
