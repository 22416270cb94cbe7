package io.avscheduler.exception;

public final class InvalidConditionException extends SchedulerException {
    public InvalidConditionException(String message) {
        super(message);
    }

    public InvalidConditionException(String message, Throwable cause) {
        super(message, cause);
    }
}
