package com.umitunal.tempo.engine;

import com.umitunal.tempo.config.SchedulerConfig;
import com.umitunal.tempo.core.InvalidScheduleException;
import com.umitunal.tempo.core.JobState;
import com.umitunal.tempo.core.StoreUnavailableException;
import com.umitunal.tempo.model.JobRecord;
import com.umitunal.tempo.model.RecurringJobDefinition;
import com.umitunal.tempo.scheduling.CronEvaluator;
import com.umitunal.tempo.storage.JobStore;
import com.umitunal.tempo.storage.StateChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Background loop that moves time-driven work forward.
 *
 * Each tick:
 * 1. promotes due SCHEDULED jobs to ENQUEUED
 * 2. fires due recurring definitions, collapsing missed fires into one
 * 3. reclaims jobs whose lease expired
 * 4. every purge interval, resolves continuations whose antecedent finished
 *    without resolving them, reschedules FAILED jobs that still have
 *    attempts left, then purges old finished jobs
 *
 * Every step goes through a store compare-and-swap, so a tick that races a
 * worker, another poller or a client update changes nothing twice.
 */
public class SchedulerPoller implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SchedulerPoller.class);

    static final String LEASE_EXPIRED = "Lease expired";
    private static final int MAX_BACKOFF_TICKS = 32;
    private static final int MAX_PAGES_PER_TICK = 10;

    private final JobStore store;
    private final CronEvaluator cron;
    private final ContinuationEngine continuations;
    private final SchedulerConfig config;
    private final Clock clock;
    private final Object tickLock = new Object();

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> task;
    private long lastMaintenance = Long.MIN_VALUE;
    private int consecutiveFailures;
    private int ticksToSkip;

    public SchedulerPoller(JobStore store, CronEvaluator cron, ContinuationEngine continuations,
                           SchedulerConfig config, Clock clock) {
        this.store = store;
        this.cron = cron;
        this.continuations = continuations;
        this.config = config;
        this.clock = clock;
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "tempo-poller");
            thread.setDaemon(true);
            return thread;
        });
        long interval = config.getPollInterval().toMillis();
        task = executor.scheduleWithFixedDelay(this::scheduledTick, 0, interval, TimeUnit.MILLISECONDS);
        log.info("Scheduler poller started (interval {})", config.getPollInterval());
    }

    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        task.cancel(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        task = null;
        log.info("Scheduler poller stopped");
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Runs one tick, backing off while the store is unavailable. Exceptions
     * never escape, since they would cancel the scheduled task.
     */
    private void scheduledTick() {
        if (ticksToSkip > 0) {
            ticksToSkip--;
            return;
        }
        try {
            TickReport report = tick();
            consecutiveFailures = 0;
            if (!report.isIdle()) {
                log.debug("Poller tick: {}", report);
            }
        } catch (StoreUnavailableException e) {
            consecutiveFailures++;
            ticksToSkip = Math.min(1 << Math.min(consecutiveFailures - 1, 5), MAX_BACKOFF_TICKS) - 1;
            log.warn("Poller tick failed ({} in a row), skipping {} ticks: {}",
                    consecutiveFailures, ticksToSkip, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Poller tick failed", e);
        }
    }

    /**
     * Runs all poller steps once against the current clock.
     *
     * @throws StoreUnavailableException if the store cannot be reached
     */
    public TickReport tick() {
        synchronized (tickLock) {
            Instant now = clock.instant();
            int promoted = promoteDueJobs(now);
            int fired = fireRecurring(now);
            int[] leases = reclaimExpiredLeases(now);

            int resolved = 0;
            int rescheduled = 0;
            long purged = 0;
            if (lastMaintenance == Long.MIN_VALUE
                    || now.toEpochMilli() - lastMaintenance >= config.getPurgeInterval().toMillis()) {
                // a purged antecedent reads as deleted, so resolve first
                resolved = resolveStrandedContinuations();
                rescheduled = rescheduleStrandedFailures();
                purged = store.purgeFinished(now.minus(config.getSucceededRetention()));
                lastMaintenance = now.toEpochMilli();
            }
            return new TickReport(promoted, fired, leases[0], leases[1], resolved, rescheduled, purged);
        }
    }

    private int promoteDueJobs(Instant now) {
        int promoted = 0;
        for (int page = 0; page < MAX_PAGES_PER_TICK; page++) {
            List<String> due = store.queryDue(now, config.getBatchSize());
            int promotedInPage = 0;
            for (String jobId : due) {
                if (store.transition(jobId, JobState.SCHEDULED, JobState.ENQUEUED)) {
                    promotedInPage++;
                }
            }
            promoted += promotedInPage;
            if (due.size() < config.getBatchSize() || promotedInPage == 0) {
                break;
            }
        }
        return promoted;
    }

    private int fireRecurring(Instant now) {
        int fired = 0;
        for (String recurringId : store.queryDueRecurring(now)) {
            Optional<RecurringJobDefinition> found = store.findRecurring(recurringId);
            if (found.isEmpty() || !found.get().isDue(now.toEpochMilli())) {
                continue;
            }
            RecurringJobDefinition definition = found.get();
            Instant next;
            try {
                next = cron.nextFireAfter(definition.getCronExpression(), now);
            } catch (InvalidScheduleException e) {
                log.warn("Recurring job '{}' has an unusable schedule, skipping: {}", recurringId, e.getMessage());
                continue;
            }
            Optional<String> jobId = store.fireRecurring(recurringId,
                    Instant.ofEpochMilli(definition.getNextFireAt()), next);
            if (jobId.isPresent()) {
                fired++;
                log.debug("Recurring job '{}' spawned {}, next fire {}", recurringId, jobId.get(), next);
            }
        }
        return fired;
    }

    /**
     * @return {reclaimed, failed}
     */
    private int[] reclaimExpiredLeases(Instant now) {
        int reclaimed = 0;
        int failed = 0;
        for (String jobId : store.queryExpiredLeases(config.getBatchSize())) {
            Optional<JobRecord> found = store.find(jobId);
            if (found.isEmpty()) {
                continue;
            }
            JobRecord job = found.get();
            if (job.getState() != JobState.PROCESSING || !job.isLeaseExpired(now.toEpochMilli())) {
                continue;
            }
            String error = LEASE_EXPIRED + " (worker " + job.getLeaseOwner() + ")";
            if (job.canRetry()) {
                if (store.transition(jobId, JobState.PROCESSING, JobState.SCHEDULED,
                        StateChange.rescheduleAt(now).andError(error))) {
                    reclaimed++;
                    log.info("Reclaimed job {} after lease expiry of {}", jobId, job.getLeaseOwner());
                }
            } else if (store.transition(jobId, JobState.PROCESSING, JobState.FAILED, StateChange.withError(error))) {
                failed++;
                log.info("Job {} failed permanently after {} attempts: {}", jobId, job.getAttempts(), error);
                continuations.onTerminal(jobId);
            }
        }
        return new int[]{reclaimed, failed};
    }

    /**
     * Schedules the retry of FAILED jobs that still have attempts left.
     */
    private int rescheduleStrandedFailures() {
        int rescheduled = 0;
        for (JobRecord job : store.listByState(JobState.FAILED, Integer.MAX_VALUE)) {
            if (job.isTerminal()) {
                continue;
            }
            Instant retryAt = Instant.ofEpochMilli(job.getLastModified()).plus(config.retryDelay(job.getAttempts()));
            if (store.transition(job.getId(), JobState.FAILED, JobState.SCHEDULED, StateChange.rescheduleAt(retryAt))) {
                rescheduled++;
                log.info("Rescheduled job {} left in FAILED with attempts {}/{}", job.getId(),
                        job.getAttempts(), job.getMaxAttempts());
            }
        }
        return rescheduled;
    }

    private int resolveStrandedContinuations() {
        int resolved = 0;
        for (String antecedentId : store.continuationAntecedents(Integer.MAX_VALUE)) {
            resolved += continuations.resolve(antecedentId);
        }
        return resolved;
    }
}
