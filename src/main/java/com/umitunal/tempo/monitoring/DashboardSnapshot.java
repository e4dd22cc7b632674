package com.umitunal.tempo.monitoring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.tempo.core.JobState;
import com.umitunal.tempo.model.JobRecord;
import com.umitunal.tempo.model.RecurringJobDefinition;
import com.umitunal.tempo.serialization.JsonCodec;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the scheduler for a dashboard.
 */
public class DashboardSnapshot {
    private static final ObjectMapper MAPPER = JsonCodec.createDefaultMapper();

    private final Instant generatedAt;
    private final Map<JobState, Long> countsByState;
    private final long pendingContinuations;
    private final List<RecurringJobView> recurringJobs;
    private final List<FailedJobView> recentFailures;

    DashboardSnapshot(Instant generatedAt, Map<JobState, Long> countsByState, long pendingContinuations,
                      List<RecurringJobView> recurringJobs, List<FailedJobView> recentFailures) {
        Map<JobState, Long> counts = new LinkedHashMap<>();
        for (JobState state : JobState.values()) {
            counts.put(state, countsByState.getOrDefault(state, 0L));
        }
        this.generatedAt = generatedAt;
        this.countsByState = Collections.unmodifiableMap(counts);
        this.pendingContinuations = pendingContinuations;
        this.recurringJobs = List.copyOf(recurringJobs);
        this.recentFailures = List.copyOf(recentFailures);
    }

    public Instant getGeneratedAt() { return generatedAt; }
    public Map<JobState, Long> getCountsByState() { return countsByState; }
    public long getPendingContinuations() { return pendingContinuations; }
    public List<RecurringJobView> getRecurringJobs() { return recurringJobs; }
    public List<FailedJobView> getRecentFailures() { return recentFailures; }

    public long count(JobState state) {
        return countsByState.get(state);
    }

    /**
     * Renders the snapshot as JSON for an HTTP endpoint.
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render dashboard snapshot", e);
        }
    }

    public static class RecurringJobView {
        private final String id;
        private final String cronExpression;
        private final String handler;
        private final Instant nextFireAt;
        private final Instant lastFireAt;

        RecurringJobView(RecurringJobDefinition definition) {
            this.id = definition.getId();
            this.cronExpression = definition.getCronExpression();
            this.handler = definition.getPayload().getHandler();
            this.nextFireAt = Instant.ofEpochMilli(definition.getNextFireAt());
            Long last = definition.getLastFireAt();
            this.lastFireAt = last == null ? null : Instant.ofEpochMilli(last);
        }

        public String getId() { return id; }
        public String getCronExpression() { return cronExpression; }
        public String getHandler() { return handler; }
        public Instant getNextFireAt() { return nextFireAt; }
        public Instant getLastFireAt() { return lastFireAt; }
    }

    public static class FailedJobView {
        private final String jobId;
        private final String handler;
        private final String error;
        private final int attempts;
        private final Instant failedAt;

        FailedJobView(JobRecord job) {
            this.jobId = job.getId();
            this.handler = job.getPayload().getHandler();
            this.error = job.getLastError();
            this.attempts = job.getAttempts();
            this.failedAt = Instant.ofEpochMilli(job.getLastModified());
        }

        public String getJobId() { return jobId; }
        public String getHandler() { return handler; }
        public String getError() { return error; }
        public int getAttempts() { return attempts; }
        public Instant getFailedAt() { return failedAt; }
    }
}
