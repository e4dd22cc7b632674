package com.umitunal.tempo.model;

import com.umitunal.tempo.core.Job;
import com.umitunal.tempo.core.JobPayload;
import com.umitunal.tempo.core.JobState;
import com.umitunal.tempo.core.JobStateMachine;

/**
 * Persistent job with full state and lease management.
 *
 * Instances are mutated only inside a store transaction; every mutation bumps
 * {@link #getVersion()} so a stale copy can be detected.
 */
public class JobRecord implements Job {
    static final int MAX_ERROR_LENGTH = 2000;

    private final String id;
    private final JobPayload payload;
    private final long createdAt;
    private final int maxAttempts;
    private final long timeoutMillis;

    private JobState state;
    private long scheduledFor;
    private int attempts;
    private String lastError;
    private String parentId;
    private String recurringId;
    private String leaseOwner;
    private long leaseExpiry;
    private long lastModified;
    private long version;

    public JobRecord(String id, JobPayload payload, long createdAt, long scheduledFor,
                     int maxAttempts, long timeoutMillis) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.id = id;
        this.payload = payload;
        this.createdAt = createdAt;
        this.scheduledFor = scheduledFor;
        this.maxAttempts = maxAttempts;
        this.timeoutMillis = timeoutMillis;
        this.state = JobState.CREATED;
        this.lastModified = createdAt;
        this.version = 0;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public JobPayload getPayload() {
        return payload;
    }

    @Override
    public JobState getState() {
        return state;
    }

    @Override
    public long getCreatedAt() {
        return createdAt;
    }

    @Override
    public long getScheduledFor() {
        return scheduledFor;
    }

    @Override
    public int getAttempts() {
        return attempts;
    }

    @Override
    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Override
    public String getLastError() {
        return lastError;
    }

    @Override
    public String getParentId() {
        return parentId;
    }

    @Override
    public String getRecurringId() {
        return recurringId;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public String getLeaseOwner() {
        return leaseOwner;
    }

    public long getLeaseExpiry() {
        return leaseExpiry;
    }

    public long getLastModified() {
        return lastModified;
    }

    public long getVersion() {
        return version;
    }

    // Package-private setters for deserialization
    void setState(JobState state) {
        this.state = state;
    }

    void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    void setLastError(String lastError) {
        this.lastError = lastError;
    }

    void setParentId(String parentId) {
        this.parentId = parentId;
    }

    void setRecurringId(String recurringId) {
        this.recurringId = recurringId;
    }

    void setLeaseOwner(String leaseOwner) {
        this.leaseOwner = leaseOwner;
    }

    void setLeaseExpiry(long leaseExpiry) {
        this.leaseExpiry = leaseExpiry;
    }

    void setLastModified(long lastModified) {
        this.lastModified = lastModified;
    }

    void setVersion(long version) {
        this.version = version;
    }

    /**
     * Applies a state change after checking it against the state machine.
     *
     * @throws com.umitunal.tempo.core.InvalidTransitionException if the edge is illegal
     */
    public void moveTo(JobState target, long now) {
        JobStateMachine.requireLegal(id, state, target, attempts, maxAttempts);
        this.state = target;
        touch(now);
    }

    public boolean hasLiveLease(long now) {
        return leaseOwner != null && leaseExpiry > now;
    }

    public boolean isLeaseExpired(long now) {
        return leaseOwner != null && leaseExpiry <= now;
    }

    public boolean isLeasedBy(String workerId) {
        return workerId != null && workerId.equals(leaseOwner);
    }

    /**
     * Claims the job for a worker and counts a new attempt.
     */
    public void lease(String workerId, long expiry, long now) {
        this.leaseOwner = workerId;
        this.leaseExpiry = expiry;
        this.attempts++;
        touch(now);
    }

    public void extendLease(long expiry, long now) {
        this.leaseExpiry = Math.max(this.leaseExpiry, expiry);
        touch(now);
    }

    public void releaseLease(long now) {
        this.leaseOwner = null;
        this.leaseExpiry = 0;
        touch(now);
    }

    public void recordError(String error, long now) {
        this.lastError = trimError(error);
        touch(now);
    }

    public void reschedule(long scheduledFor, long now) {
        this.scheduledFor = scheduledFor;
        touch(now);
    }

    public void linkParent(String parentId) {
        this.parentId = parentId;
    }

    public void linkRecurring(String recurringId) {
        this.recurringId = recurringId;
    }

    public boolean isReady(long now) {
        return now >= scheduledFor;
    }

    private void touch(long now) {
        this.lastModified = now;
        this.version++;
    }

    /**
     * Collapses whitespace and bounds the length of an error before it is
     * stored.
     */
    public static String trimError(String message) {
        if (message == null) {
            return null;
        }
        String collapsed = message.replaceAll("\\s+", " ").trim();
        return collapsed.length() > MAX_ERROR_LENGTH ? collapsed.substring(0, MAX_ERROR_LENGTH) : collapsed;
    }

    @Override
    public String toString() {
        return String.format("JobRecord{id='%s', handler='%s', state=%s, attempt=%d/%d, scheduledFor=%d, lease='%s'}",
                id, payload.getHandler(), state, attempts, maxAttempts, scheduledFor, leaseOwner);
    }
}
