package com.umitunal.tempo.engine;

import com.umitunal.tempo.config.SchedulerConfig;
import com.umitunal.tempo.config.StorageConfig;
import com.umitunal.tempo.core.ContinuationTrigger;
import com.umitunal.tempo.core.JobNotFoundException;
import com.umitunal.tempo.core.JobPayload;
import com.umitunal.tempo.core.JobState;
import com.umitunal.tempo.core.JobStateMachine;
import com.umitunal.tempo.core.JobStatus;
import com.umitunal.tempo.model.JobRecord;
import com.umitunal.tempo.model.RecurringJobDefinition;
import com.umitunal.tempo.monitoring.ControlAuthorizer;
import com.umitunal.tempo.monitoring.DashboardService;
import com.umitunal.tempo.scheduling.CronEvaluator;
import com.umitunal.tempo.serialization.ArgumentCodec;
import com.umitunal.tempo.storage.JobStore;
import com.umitunal.tempo.storage.NewJob;
import com.umitunal.tempo.storage.RocksJobStore;
import com.umitunal.tempo.worker.JobHandler;
import com.umitunal.tempo.worker.JobHandlerRegistry;
import com.umitunal.tempo.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Entry point of the scheduler: creates jobs, manages recurring definitions
 * and owns the poller and worker pool.
 *
 * <pre>{@code
 * try (JobScheduler scheduler = JobScheduler.open(StorageConfig.newBuilder("./jobs").build(),
 *                                                 SchedulerConfig.defaults())) {
 *     scheduler.registerHandler("email", new StringCodec(), (to, ctx) -> send(to));
 *     scheduler.start();
 *     scheduler.enqueue("email", "someone@example.com");
 * }
 * }</pre>
 *
 * Producers that never run jobs can skip {@link #start()}; everything is
 * persisted and picked up by whichever process runs the workers.
 */
public class JobScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);
    private static final int MAX_DELETE_ATTEMPTS = 5;

    private final JobStore store;
    private final boolean ownsStore;
    private final SchedulerConfig config;
    private final JobHandlerRegistry registry;
    private final Clock clock;
    private final CronEvaluator cron;
    private final ContinuationEngine continuations;
    private final SchedulerPoller poller;
    private final WorkerPool workers;
    private final DashboardService dashboard;

    private JobScheduler(Builder builder) {
        this.store = builder.store;
        this.ownsStore = builder.ownsStore;
        this.config = builder.config;
        this.registry = builder.registry;
        this.clock = builder.clock;
        this.cron = new CronEvaluator();
        this.continuations = new ContinuationEngine(store);
        this.poller = new SchedulerPoller(store, cron, continuations, config, clock);
        this.workers = new WorkerPool(store, registry, continuations, config, clock);
        this.dashboard = new DashboardService(this, store, builder.authorizer, clock);
    }

    /**
     * Opens a RocksDB store and a scheduler that closes it on {@link #close()}.
     */
    public static JobScheduler open(StorageConfig storage, SchedulerConfig config) {
        Builder builder = builder(new RocksJobStore(storage)).withConfig(config);
        builder.ownsStore = true;
        return builder.build();
    }

    public static Builder builder(JobStore store) {
        return new Builder(store);
    }

    // ========== Handlers ==========

    public <A> JobScheduler registerHandler(String tag, ArgumentCodec<A> codec, JobHandler<A> handler) {
        registry.register(tag, codec, handler);
        return this;
    }

    public JobHandlerRegistry getRegistry() {
        return registry;
    }

    // ========== Jobs ==========

    /**
     * Creates a job that runs as soon as a worker is free.
     *
     * @throws com.umitunal.tempo.core.HandlerNotFoundException if no codec is registered for the handler
     */
    public String enqueue(String handler, Object arguments) {
        return enqueue(registry.payloadFor(handler, arguments));
    }

    public String enqueue(JobPayload payload) {
        return store.create(newJob(payload).build());
    }

    /**
     * Creates a job that becomes due at {@code fireAt}. A time in the past
     * enqueues it directly.
     */
    public String schedule(String handler, Object arguments, Instant fireAt) {
        return schedule(registry.payloadFor(handler, arguments), fireAt);
    }

    public String schedule(String handler, Object arguments, Duration delay) {
        return schedule(handler, arguments, clock.instant().plus(delay));
    }

    public String schedule(JobPayload payload, Instant fireAt) {
        return store.create(newJob(payload).scheduledFor(fireAt).build());
    }

    /**
     * Creates a job that runs after {@code antecedentId} succeeds.
     *
     * @throws JobNotFoundException if the antecedent does not exist
     */
    public String continueWith(String antecedentId, String handler, Object arguments) {
        return continueWith(antecedentId, handler, arguments, ContinuationTrigger.ON_SUCCESS);
    }

    public String continueWith(String antecedentId, String handler, Object arguments, ContinuationTrigger trigger) {
        JobPayload payload = registry.payloadFor(handler, arguments);
        return store.create(newJob(payload).continuationOf(antecedentId, trigger).build());
    }

    /**
     * Moves a job that has not finished to DELETED. A running job is
     * cancelled at its next heartbeat.
     *
     * @return false if the job already reached a terminal state, or is FAILED
     *         with its retry not yet scheduled (poller maintenance reschedules it)
     * @throws JobNotFoundException if the job does not exist
     */
    public boolean delete(String jobId) {
        for (int attempt = 0; attempt < MAX_DELETE_ATTEMPTS; attempt++) {
            JobRecord job = store.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            if (!JobStateMachine.isLegal(job.getState(), JobState.DELETED)) {
                return false;
            }
            if (store.transition(jobId, job.getState(), JobState.DELETED)) {
                log.info("Deleted job {} (was {})", jobId, job.getState());
                continuations.onTerminal(jobId);
                return true;
            }
        }
        log.warn("Could not delete job {}: its state kept changing", jobId);
        return false;
    }

    /**
     * @throws JobNotFoundException if the job does not exist
     */
    public JobStatus getJobStatus(String jobId) {
        return store.find(jobId)
                .map(JobStatus::of)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private NewJob.Builder newJob(JobPayload payload) {
        return NewJob.builder(payload)
                .maxAttempts(config.getDefaultMaxAttempts())
                .timeout(config.getDefaultTimeout());
    }

    // ========== Recurring jobs ==========

    /**
     * Creates or replaces the recurring job {@code name}. Replacing keeps its
     * fire history.
     *
     * @throws com.umitunal.tempo.core.InvalidScheduleException if the cron expression is invalid
     */
    public void addOrUpdateRecurring(String name, String handler, Object arguments, String cronExpression) {
        cron.validate(cronExpression);
        JobPayload payload = registry.payloadFor(handler, arguments);
        Instant now = clock.instant();
        Instant next = cron.nextFireAfter(cronExpression, now);
        RecurringJobDefinition definition = new RecurringJobDefinition(name, cronExpression.trim(), payload,
                config.getDefaultMaxAttempts(), config.getDefaultTimeout().toMillis(),
                next.toEpochMilli(), now.toEpochMilli());
        RecurringJobDefinition stored = store.upsertRecurring(definition);
        log.info("Registered recurring job '{}' ({}) with cron '{}', next fire {}",
                name, handler, cronExpression, Instant.ofEpochMilli(stored.getNextFireAt()));
    }

    public boolean removeRecurring(String name) {
        boolean removed = store.removeRecurring(name);
        if (removed) {
            log.info("Removed recurring job '{}'", name);
        }
        return removed;
    }

    /**
     * Spawns a job from a recurring definition now, outside its schedule.
     */
    public Optional<String> triggerRecurring(String name) {
        Optional<String> jobId = store.triggerRecurring(name);
        jobId.ifPresent(id -> log.info("Triggered recurring job '{}' as {}", name, id));
        return jobId;
    }

    // ========== Lifecycle ==========

    /**
     * Starts the poller and the workers of this process.
     */
    public synchronized void start() {
        poller.start();
        workers.start();
        log.info("Scheduler started: {}", config);
    }

    /**
     * Stops the poller, then the workers. Running jobs get the shutdown
     * timeout to finish.
     */
    public synchronized void stop() {
        poller.stop();
        workers.stop();
    }

    public boolean isRunning() {
        return poller.isRunning() || workers.isRunning();
    }

    public DashboardService monitoring() {
        return dashboard;
    }

    SchedulerPoller getPoller() {
        return poller;
    }

    WorkerPool getWorkers() {
        return workers;
    }

    @Override
    public void close() {
        stop();
        if (ownsStore) {
            store.close();
        }
        log.info("Scheduler closed");
    }

    public static class Builder {
        private final JobStore store;
        private boolean ownsStore;
        private SchedulerConfig config = SchedulerConfig.defaults();
        private JobHandlerRegistry registry = new JobHandlerRegistry();
        private Clock clock = Clock.systemUTC();
        private ControlAuthorizer authorizer = ControlAuthorizer.denyAll();

        private Builder(JobStore store) {
            if (store == null) {
                throw new IllegalArgumentException("store must not be null");
            }
            this.store = store;
        }

        public Builder withConfig(SchedulerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withRegistry(JobHandlerRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Clock for due times and retry delays. Use the same clock as the store.
         */
        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Authorizer for dashboard control actions. Default: deny all.
         */
        public Builder withControlAuthorizer(ControlAuthorizer authorizer) {
            this.authorizer = authorizer;
            return this;
        }

        public JobScheduler build() {
            return new JobScheduler(this);
        }
    }
}
