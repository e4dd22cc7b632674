package com.umitunal.tempo.core;

/**
 * A job body failed, timed out or could not be dispatched. Recorded on the
 * job; it drives the retry logic and never escapes a worker.
 */
public class PayloadExecutionException extends SchedulerException {
    private final String jobId;

    public PayloadExecutionException(String jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public PayloadExecutionException(String jobId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
