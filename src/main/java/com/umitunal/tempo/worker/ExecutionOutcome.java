package com.umitunal.tempo.worker;

import com.umitunal.tempo.core.PayloadExecutionException;

/**
 * Result of running one job attempt.
 */
public final class ExecutionOutcome {

    public enum Status {
        SUCCEEDED,
        FAILED,
        /** Deleted, lease lost or interrupted by shutdown. The stored state is left alone. */
        ABANDONED
    }

    private static final ExecutionOutcome SUCCESS = new ExecutionOutcome(Status.SUCCEEDED, null, null);

    private final Status status;
    private final PayloadExecutionException failure;
    private final String reason;

    private ExecutionOutcome(Status status, PayloadExecutionException failure, String reason) {
        this.status = status;
        this.failure = failure;
        this.reason = reason;
    }

    public static ExecutionOutcome succeeded() {
        return SUCCESS;
    }

    public static ExecutionOutcome failed(PayloadExecutionException failure) {
        return new ExecutionOutcome(Status.FAILED, failure, failure.getMessage());
    }

    public static ExecutionOutcome abandoned(String reason) {
        return new ExecutionOutcome(Status.ABANDONED, null, reason);
    }

    public Status getStatus() { return status; }
    public PayloadExecutionException getFailure() { return failure; }
    public String getReason() { return reason; }

    @Override
    public String toString() {
        return reason == null ? status.name() : status + "(" + reason + ")";
    }
}
