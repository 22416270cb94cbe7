package io.avscheduler.exception;

/**
 * Raised when the execution log store cannot be read or written. Fatal to the
 * operation that hit it, never to the scheduler process.
 */
public final class LogStoreException extends SchedulerException {
    public LogStoreException(String message) {
        super(message);
    }

    public LogStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
