package io.avscheduler.exception;

public final class InterpreterNotConfiguredException extends ConfigException {
    private final String jobId;
    private final String type;

    public InterpreterNotConfiguredException(String jobId, String type) {
        super("Interpreter '" + type + "' for job '" + jobId + "' is not configured");
        this.jobId = jobId;
        this.type = type;
    }

    public String jobId() {
        return jobId;
    }

    public String type() {
        return type;
    }
}
