package io.avscheduler.exception;

public class ConfigException extends SchedulerException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
