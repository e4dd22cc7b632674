package com.umitunal.tempo.core;

/**
 * Lifecycle states of a job.
 *
 * The ordinal is persisted (record values and the state index key prefix),
 * so new states must only ever be appended.
 */
public enum JobState {
    CREATED,                // Built in memory, never committed in this state
    SCHEDULED,              // Waiting for scheduledFor to pass
    ENQUEUED,               // Ready for a worker
    PROCESSING,             // Leased and running
    SUCCEEDED,              // Finished normally
    FAILED,                 // Failed; terminal once attempts are exhausted
    DELETED,                // Cancelled or discarded
    AWAITING_CONTINUATION;  // Waiting for its antecedent to finish

    /**
     * States from which no transition leaves regardless of attempts.
     * {@link #FAILED} is terminal only when the job cannot retry, see
     * {@link JobStateMachine#isTerminal(JobState, int, int)}.
     */
    public boolean isFinal() {
        return this == SUCCEEDED || this == DELETED;
    }

    public static JobState fromOrdinal(int ordinal) {
        JobState[] values = values();
        if (ordinal < 0 || ordinal >= values.length) {
            throw new IllegalArgumentException("Unknown job state ordinal: " + ordinal);
        }
        return values[ordinal];
    }
}
