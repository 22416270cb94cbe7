package io.avscheduler.exception;

public final class JobNotFoundException extends SchedulerException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job '" + jobId + "' not found");
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
