package com.umitunal.tempo.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Job counts by state, plus the number of recurring definitions and
 * pending continuation links.
 */
public class StoreMetrics {
    private final Map<JobState, Long> countsByState;
    private final long recurringDefinitions;
    private final long pendingContinuations;

    public StoreMetrics(Map<JobState, Long> countsByState, long recurringDefinitions, long pendingContinuations) {
        EnumMap<JobState, Long> copy = new EnumMap<>(JobState.class);
        for (JobState state : JobState.values()) {
            copy.put(state, countsByState.getOrDefault(state, 0L));
        }
        this.countsByState = Collections.unmodifiableMap(copy);
        this.recurringDefinitions = recurringDefinitions;
        this.pendingContinuations = pendingContinuations;
    }

    public long getTotalJobs() {
        return countsByState.values().stream().mapToLong(Long::longValue).sum();
    }

    public long count(JobState state) {
        return countsByState.get(state);
    }

    public long getScheduledJobs() { return count(JobState.SCHEDULED); }
    public long getEnqueuedJobs() { return count(JobState.ENQUEUED); }
    public long getProcessingJobs() { return count(JobState.PROCESSING); }
    public long getSucceededJobs() { return count(JobState.SUCCEEDED); }
    public long getFailedJobs() { return count(JobState.FAILED); }
    public long getDeletedJobs() { return count(JobState.DELETED); }
    public long getAwaitingJobs() { return count(JobState.AWAITING_CONTINUATION); }
    public long getRecurringDefinitions() { return recurringDefinitions; }
    public long getPendingContinuations() { return pendingContinuations; }

    public Map<JobState, Long> getCountsByState() {
        return countsByState;
    }

    @Override
    public String toString() {
        return String.format(
            "StoreMetrics{total=%d, scheduled=%d, enqueued=%d, processing=%d, succeeded=%d, failed=%d, deleted=%d, awaiting=%d, recurring=%d}",
            getTotalJobs(), getScheduledJobs(), getEnqueuedJobs(), getProcessingJobs(),
            getSucceededJobs(), getFailedJobs(), getDeletedJobs(), getAwaitingJobs(), recurringDefinitions
        );
    }
}
