package io.avscheduler.exception;

/**
 * Base type for every failure the scheduler surfaces to its callers.
 */
public class SchedulerException extends RuntimeException {
    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
