package com.umitunal.tempo.worker;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-attempt execution context handed to a {@link JobHandler}.
 *
 * The cancellation flag is set by the lease heartbeat when the job was
 * deleted or its lease was lost, and by shutdown. Handlers check it
 * cooperatively.
 */
public class JobContext {
    private final String jobId;
    private final String handler;
    private final int attempt;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public JobContext(String jobId, String handler, int attempt) {
        this.jobId = jobId;
        this.handler = handler;
        this.attempt = attempt;
    }

    public String getJobId() {
        return jobId;
    }

    public String getHandler() {
        return handler;
    }

    /**
     * 1-based attempt number of this execution.
     */
    public int getAttempt() {
        return attempt;
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    void cancel() {
        cancelled.set(true);
    }

    /**
     * @throws InterruptedException if the job should stop
     */
    public void throwIfCancellationRequested() throws InterruptedException {
        if (cancelled.get()) {
            throw new InterruptedException("Job " + jobId + " was cancelled");
        }
    }

    @Override
    public String toString() {
        return "JobContext{jobId='" + jobId + "', handler='" + handler + "', attempt=" + attempt
                + ", cancelled=" + cancelled.get() + '}';
    }
}
