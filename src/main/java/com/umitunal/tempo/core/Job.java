package com.umitunal.tempo.core;

/**
 * Read-only view of a persisted job.
 */
public interface Job {

    /**
     * Gets the unique identifier for this job.
     */
    String getId();

    /**
     * Gets the invocation descriptor.
     */
    JobPayload getPayload();

    /**
     * Gets the current state.
     */
    JobState getState();

    /**
     * Gets the creation time in milliseconds since epoch.
     */
    long getCreatedAt();

    /**
     * Gets the time the job becomes due in milliseconds since epoch. Jobs
     * enqueued for immediate execution carry their creation time.
     */
    long getScheduledFor();

    /**
     * Gets the number of times processing has started.
     */
    int getAttempts();

    /**
     * Gets the maximum number of processing attempts allowed.
     */
    int getMaxAttempts();

    /**
     * Gets the last recorded error, or null.
     */
    String getLastError();

    /**
     * Gets the antecedent of a continuation, or null.
     */
    String getParentId();

    /**
     * Gets the recurring definition that spawned this job, or null.
     */
    String getRecurringId();

    /**
     * Checks whether the job will never change state again.
     */
    default boolean isTerminal() {
        return JobStateMachine.isTerminal(getState(), getAttempts(), getMaxAttempts());
    }

    /**
     * Checks whether another attempt is allowed after a failure.
     */
    default boolean canRetry() {
        return getAttempts() < getMaxAttempts();
    }
}
