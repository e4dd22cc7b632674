package com.umitunal.tempo.storage;

import com.umitunal.tempo.core.JobPayload;
import com.umitunal.tempo.core.JobState;
import com.umitunal.tempo.core.StoreMetrics;
import com.umitunal.tempo.model.ContinuationLink;
import com.umitunal.tempo.model.JobRecord;
import com.umitunal.tempo.model.RecurringJobDefinition;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable source of truth for jobs, recurring definitions and continuation
 * links.
 *
 * Every mutation is atomic with respect to concurrent callers. Operations that
 * guard against races (lease acquisition, transitions, recurring fires) return
 * false or empty when another caller won; they never apply half a change.
 * Storage failures surface as
 * {@link com.umitunal.tempo.core.StoreUnavailableException} and mean the write
 * did not happen.
 */
public interface JobStore extends AutoCloseable {

    // ========== Jobs ==========

    /**
     * Create a job that is ready now, scheduled, or a continuation of
     * {@code parentId}.
     *
     * @param scheduledFor when the job becomes due, or null for now
     * @param parentId antecedent job id, or null
     * @return the new job id
     */
    default String create(JobPayload payload, Instant scheduledFor, String parentId) {
        NewJob.Builder builder = NewJob.builder(payload).scheduledFor(scheduledFor);
        if (parentId != null) {
            builder.continuationOf(parentId, null);
        }
        return create(builder.build());
    }

    /**
     * Create a job. A continuation whose parent already finished is resolved
     * in the same transaction.
     *
     * @return the new job id
     * @throws com.umitunal.tempo.core.JobNotFoundException if the parent does not exist
     */
    String create(NewJob job);

    Optional<JobRecord> find(String jobId);

    /**
     * Claim an enqueued job for a worker. Fails if the job is not enqueued or
     * another worker holds a live lease. A successful claim counts an attempt.
     */
    boolean tryAcquireLease(String jobId, String workerId, Duration duration);

    /**
     * Push the lease expiry to now + duration.
     *
     * @return false if the job is gone, no longer active, or the lease was
     *         reclaimed
     * @throws com.umitunal.tempo.core.LeaseConflictException if another worker holds the lease
     */
    boolean renewLease(String jobId, String workerId, Duration duration);

    /**
     * Drop the lease if {@code workerId} still holds it.
     */
    void releaseLease(String jobId, String workerId);

    /**
     * Compare-and-swap on the job state.
     *
     * @return false if the stored state is not {@code from} or a concurrent
     *         writer won
     * @throws com.umitunal.tempo.core.InvalidTransitionException if {@code from -> to} is illegal
     */
    default boolean transition(String jobId, JobState from, JobState to) {
        return transition(jobId, from, to, StateChange.none());
    }

    boolean transition(String jobId, JobState from, JobState to, StateChange change);

    /**
     * Record a failed attempt and schedule the next one in one commit,
     * {@code PROCESSING -> FAILED -> SCHEDULED}, so a crash never leaves the
     * job in FAILED with attempts left.
     *
     * @return false if the job is no longer processing or a concurrent writer won
     * @throws com.umitunal.tempo.core.InvalidTransitionException if the retry budget is spent
     */
    boolean failAndReschedule(String jobId, String error, Instant retryAt);

    /**
     * Scheduled jobs due at or before {@code before}, earliest first.
     */
    List<String> queryDue(Instant before, int limit);

    /**
     * Enqueued jobs, earliest due first.
     */
    List<String> queryEnqueued(int limit);

    /**
     * Processing jobs whose lease has expired.
     */
    List<String> queryExpiredLeases(int limit);

    // ========== Continuations ==========

    List<ContinuationLink> continuationsOf(String antecedentId);

    /**
     * Distinct antecedent ids that still have unconsumed links.
     */
    List<String> continuationAntecedents(int limit);

    /**
     * Move the dependent of {@code link} out of
     * {@code AWAITING_CONTINUATION} into {@code target} and consume the link.
     *
     * @param note stored as the dependent's last error when not null
     * @return false if the link was already consumed
     */
    boolean resolveContinuation(ContinuationLink link, JobState target, String note);

    // ========== Recurring definitions ==========

    /**
     * Insert or replace a definition by id, keeping the fire history of an
     * existing one.
     */
    RecurringJobDefinition upsertRecurring(RecurringJobDefinition definition);

    Optional<RecurringJobDefinition> findRecurring(String recurringId);

    boolean removeRecurring(String recurringId);

    List<RecurringJobDefinition> listRecurring();

    /**
     * Ids of definitions whose next fire time is at or before {@code now}.
     */
    List<String> queryDueRecurring(Instant now);

    /**
     * Spawn an enqueued job from a definition and roll its schedule, but only
     * if its next fire time is still {@code expectedNextFireAt}.
     *
     * @return the spawned job id, or empty if the definition is gone or
     *         another caller fired it first
     */
    Optional<String> fireRecurring(String recurringId, Instant expectedNextFireAt, Instant newNextFireAt);

    /**
     * Spawn an enqueued job from a definition now, leaving its schedule alone.
     */
    Optional<String> triggerRecurring(String recurringId);

    // ========== Monitoring & maintenance ==========

    StoreMetrics getMetrics();

    /**
     * Permanently failed jobs, most recent first.
     */
    List<JobRecord> recentFailures(int limit);

    /**
     * Jobs in {@code state}, earliest due first.
     */
    List<JobRecord> listByState(JobState state, int limit);

    /**
     * Delete succeeded and deleted jobs last modified before
     * {@code olderThan}. Jobs that still have unresolved continuation links
     * are kept.
     *
     * @return number of jobs removed
     */
    long purgeFinished(Instant olderThan);

    @Override
    void close();
}
