package com.umitunal.tempo.core;

/**
 * The job store could not complete a read or write. The operation had no
 * effect and may be retried.
 */
public class StoreUnavailableException extends SchedulerException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
