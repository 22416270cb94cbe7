package io.avscheduler.exception;

public final class InvalidEnvFileException extends ConfigException {
    public InvalidEnvFileException(String message) {
        super(message);
    }

    public InvalidEnvFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
