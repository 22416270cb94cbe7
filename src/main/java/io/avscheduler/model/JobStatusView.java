package io.avscheduler.model;

/**
 * Row returned by job listings: what the job is, when it last ran and when it fires next.
 * {@code lastRun}, {@code nextFireTimeMs} and {@code lastFireTimeMs} are null when unknown;
 * {@code lastFireTimeMs} only counts trigger firings of the current daemon.
 */
public record JobStatusView(
        String jobId,
        String name,
        ExecutionRecord lastRun,
        Long nextFireTimeMs,
        Long lastFireTimeMs,
        String condition,
        boolean running,
        boolean scheduled,
        String rejectionReason
) {
}
