package com.umitunal.tempo.storage;

import com.umitunal.tempo.core.ContinuationTrigger;
import com.umitunal.tempo.core.JobPayload;

import java.time.Duration;
import java.time.Instant;

/**
 * Everything needed to create a job. The initial state follows from the
 * fields: a parent makes a continuation, a future {@code scheduledFor} makes a
 * scheduled job, anything else is enqueued directly.
 */
public class NewJob {
    private final JobPayload payload;
    private final Instant scheduledFor;
    private final String parentId;
    private final ContinuationTrigger trigger;
    private final int maxAttempts;
    private final Duration timeout;

    private NewJob(Builder builder) {
        this.payload = builder.payload;
        this.scheduledFor = builder.scheduledFor;
        this.parentId = builder.parentId;
        this.trigger = builder.trigger;
        this.maxAttempts = builder.maxAttempts;
        this.timeout = builder.timeout;
    }

    public JobPayload getPayload() { return payload; }
    public Instant getScheduledFor() { return scheduledFor; }
    public String getParentId() { return parentId; }
    public ContinuationTrigger getTrigger() { return trigger; }
    public int getMaxAttempts() { return maxAttempts; }
    public Duration getTimeout() { return timeout; }

    public static Builder builder(JobPayload payload) {
        return new Builder(payload);
    }

    public static class Builder {
        private final JobPayload payload;
        private Instant scheduledFor;
        private String parentId;
        private ContinuationTrigger trigger = ContinuationTrigger.ON_SUCCESS;
        private int maxAttempts = 3;
        private Duration timeout = Duration.ofHours(24);

        private Builder(JobPayload payload) {
            if (payload == null) {
                throw new IllegalArgumentException("payload must not be null");
            }
            this.payload = payload;
        }

        /**
         * Null means ready now.
         */
        public Builder scheduledFor(Instant scheduledFor) {
            this.scheduledFor = scheduledFor;
            return this;
        }

        public Builder continuationOf(String parentId, ContinuationTrigger trigger) {
            this.parentId = parentId;
            this.trigger = trigger == null ? ContinuationTrigger.ON_SUCCESS : trigger;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        public NewJob build() {
            return new NewJob(this);
        }
    }
}
