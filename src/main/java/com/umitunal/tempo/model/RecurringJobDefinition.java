package com.umitunal.tempo.model;

import com.umitunal.tempo.core.JobPayload;

/**
 * Named template that spawns a job each time its cron schedule fires.
 */
public class RecurringJobDefinition {
    static final long NEVER = -1L;

    private final String id;
    private final long createdAt;

    private String cronExpression;
    private JobPayload payload;
    private int maxAttempts;
    private long timeoutMillis;
    private long lastFireAt = NEVER;
    private long nextFireAt;
    private long updatedAt;
    private long version;

    public RecurringJobDefinition(String id, String cronExpression, JobPayload payload,
                                  int maxAttempts, long timeoutMillis, long nextFireAt, long createdAt) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("recurring job id must not be empty");
        }
        this.id = id;
        this.cronExpression = cronExpression;
        this.payload = payload;
        this.maxAttempts = maxAttempts;
        this.timeoutMillis = timeoutMillis;
        this.nextFireAt = nextFireAt;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public String getId() { return id; }
    public String getCronExpression() { return cronExpression; }
    public JobPayload getPayload() { return payload; }
    public int getMaxAttempts() { return maxAttempts; }
    public long getTimeoutMillis() { return timeoutMillis; }
    public long getNextFireAt() { return nextFireAt; }
    public long getCreatedAt() { return createdAt; }
    public long getUpdatedAt() { return updatedAt; }
    public long getVersion() { return version; }

    /**
     * Last time a job was spawned from this definition, or null if never.
     */
    public Long getLastFireAt() {
        return lastFireAt == NEVER ? null : lastFireAt;
    }

    public boolean isDue(long now) {
        return nextFireAt <= now;
    }

    /**
     * Replaces the schedule and template, keeping identity, creation time and
     * fire history.
     */
    public void redefine(RecurringJobDefinition replacement, long now) {
        this.cronExpression = replacement.cronExpression;
        this.payload = replacement.payload;
        this.maxAttempts = replacement.maxAttempts;
        this.timeoutMillis = replacement.timeoutMillis;
        this.nextFireAt = Math.max(replacement.nextFireAt, lastFireAt);
        this.updatedAt = now;
        this.version++;
    }

    /**
     * Rolls the schedule forward after a fire.
     */
    public void recordFire(long firedAt, long newNextFireAt) {
        if (newNextFireAt <= firedAt) {
            throw new IllegalArgumentException("next fire " + newNextFireAt + " must be after fire time " + firedAt);
        }
        this.lastFireAt = firedAt;
        this.nextFireAt = newNextFireAt;
        this.updatedAt = firedAt;
        this.version++;
    }

    /**
     * Records a manual trigger, which leaves the schedule untouched.
     */
    public void recordTrigger(long firedAt) {
        this.lastFireAt = Math.max(lastFireAt, firedAt);
        this.nextFireAt = Math.max(nextFireAt, lastFireAt);
        this.updatedAt = firedAt;
        this.version++;
    }

    // Package-private setters for deserialization
    void setLastFireAt(long lastFireAt) { this.lastFireAt = lastFireAt; }
    void setUpdatedAt(long updatedAt) { this.updatedAt = updatedAt; }
    void setVersion(long version) { this.version = version; }

    long rawLastFireAt() { return lastFireAt; }

    @Override
    public String toString() {
        return String.format("RecurringJobDefinition{id='%s', cron='%s', handler='%s', next=%d, last=%s}",
                id, cronExpression, payload.getHandler(), nextFireAt, getLastFireAt());
    }
}
