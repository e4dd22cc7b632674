package com.umitunal.tempo.core;

/**
 * Base class of all errors raised by the scheduler.
 */
public class SchedulerException extends RuntimeException {

    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether repeating the same call later can succeed.
     */
    public boolean isRetryable() {
        return false;
    }
}
