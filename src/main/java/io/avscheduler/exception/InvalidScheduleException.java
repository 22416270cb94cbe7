package io.avscheduler.exception;

public final class InvalidScheduleException extends ConfigException {
    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
