package com.umitunal.tempo.worker;

import com.umitunal.tempo.config.SchedulerConfig;
import com.umitunal.tempo.core.JobState;
import com.umitunal.tempo.core.SchedulerException;
import com.umitunal.tempo.model.JobRecord;
import com.umitunal.tempo.storage.JobStore;
import com.umitunal.tempo.storage.StateChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A worker loop that leases enqueued jobs, runs them and records the outcome.
 *
 * Any number of workers can share a store; the lease decides which one runs
 * a job.
 */
public class JobWorker {
    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    private final String workerId;
    private final JobStore store;
    private final JobDispatcher dispatcher;
    private final JobCompletionListener completionListener;
    private final SchedulerConfig config;
    private final Clock clock;
    private final AtomicBoolean running;
    private final AtomicLong succeededCount;
    private final AtomicLong failedCount;

    private volatile Thread workerThread;

    private JobWorker(Builder builder) {
        this.workerId = builder.workerId;
        this.store = builder.store;
        this.dispatcher = builder.dispatcher;
        this.completionListener = builder.completionListener;
        this.config = builder.config;
        this.clock = builder.clock;
        this.running = new AtomicBoolean(false);
        this.succeededCount = new AtomicLong(0);
        this.failedCount = new AtomicLong(0);
    }

    /**
     * Leases and runs at most one job.
     *
     * @return true if a job was run, false if none could be leased
     */
    public boolean processOne() {
        List<String> candidates = store.queryEnqueued(config.getBatchSize());
        for (String jobId : candidates) {
            if (!store.tryAcquireLease(jobId, workerId, config.getLeaseDuration())) {
                continue;
            }
            if (!store.transition(jobId, JobState.ENQUEUED, JobState.PROCESSING)) {
                store.releaseLease(jobId, workerId);
                continue;
            }
            Optional<JobRecord> job = store.find(jobId);
            if (job.isEmpty()) {
                continue;
            }
            execute(job.get());
            return true;
        }
        return false;
    }

    private void execute(JobRecord job) {
        log.debug("Worker {} running job {} ({}), attempt {}/{}", workerId, job.getId(),
                job.getPayload().getHandler(), job.getAttempts(), job.getMaxAttempts());

        ExecutionOutcome outcome = dispatcher.dispatch(job, workerId);
        switch (outcome.getStatus()) {
            case SUCCEEDED -> complete(job);
            case FAILED -> fail(job, outcome.getReason());
            case ABANDONED -> log.info("Job {} abandoned by worker {}: {}", job.getId(), workerId, outcome.getReason());
        }
    }

    private void complete(JobRecord job) {
        if (store.transition(job.getId(), JobState.PROCESSING, JobState.SUCCEEDED)) {
            succeededCount.incrementAndGet();
            log.debug("Job {} succeeded", job.getId());
            completionListener.onTerminal(job.getId());
        } else {
            log.warn("Job {} finished but was no longer processing under worker {}", job.getId(), workerId);
        }
    }

    private void fail(JobRecord job, String error) {
        failedCount.incrementAndGet();
        if (job.canRetry()) {
            Duration delay = config.retryDelay(job.getAttempts());
            Instant retryAt = clock.instant().plus(delay);
            if (store.failAndReschedule(job.getId(), error, retryAt)) {
                log.info("Job {} failed (attempt {}/{}), retrying in {}: {}", job.getId(),
                        job.getAttempts(), job.getMaxAttempts(), delay, error);
            } else {
                log.warn("Job {} failed but was no longer processing under worker {}", job.getId(), workerId);
            }
            return;
        }
        if (!store.transition(job.getId(), JobState.PROCESSING, JobState.FAILED, StateChange.withError(error))) {
            log.warn("Job {} failed but was no longer processing under worker {}", job.getId(), workerId);
            return;
        }
        log.info("Job {} failed permanently after {} attempts: {}", job.getId(), job.getAttempts(), error);
        completionListener.onTerminal(job.getId());
    }

    /**
     * Start the loop on its own thread.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            workerThread = new Thread(this::run, "tempo-worker-" + workerId);
            workerThread.setDaemon(true);
            workerThread.start();
        }
    }

    private void run() {
        while (running.get()) {
            try {
                boolean processed = processOne();

                if (!processed) {
                    Thread.sleep(config.getWorkerPollInterval().toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (SchedulerException e) {
                if (!e.isRetryable()) {
                    log.warn("Worker {} skipped a job: {}", workerId, e.getMessage());
                    continue;
                }
                log.warn("Worker {} backing off: {}", workerId, e.getMessage());
                if (!pause()) {
                    break;
                }
            } catch (RuntimeException e) {
                log.error("Worker {} loop error", workerId, e);
                if (!pause()) {
                    break;
                }
            }
        }
    }

    private boolean pause() {
        try {
            Thread.sleep(config.getWorkerPollInterval().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Asks the loop to exit after the current job.
     */
    public void stop() {
        running.set(false);
    }

    /**
     * Waits for the loop to exit. A job still running after {@code timeout} is
     * interrupted; its lease then expires and the poller reclaims it.
     *
     * @return true if the loop exited within the timeout
     */
    public boolean awaitStop(Duration timeout) {
        Thread thread = workerThread;
        if (thread == null) {
            return true;
        }
        try {
            thread.join(Math.max(1, timeout.toMillis()));
            if (thread.isAlive()) {
                thread.interrupt();
                thread.join(1000);
                return false;
            }
            return true;
        } catch (InterruptedException e) {
            thread.interrupt();
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public String getWorkerId() { return workerId; }
    public long getSucceededCount() { return succeededCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public boolean isRunning() { return running.get() && workerThread != null && workerThread.isAlive(); }

    public static Builder builder(String workerId, JobStore store, JobDispatcher dispatcher) {
        return new Builder(workerId, store, dispatcher);
    }

    public static class Builder {
        private final String workerId;
        private final JobStore store;
        private final JobDispatcher dispatcher;
        private JobCompletionListener completionListener = JobCompletionListener.NONE;
        private SchedulerConfig config = SchedulerConfig.defaults();
        private Clock clock = Clock.systemUTC();

        private Builder(String workerId, JobStore store, JobDispatcher dispatcher) {
            this.workerId = workerId;
            this.store = store;
            this.dispatcher = dispatcher;
        }

        public Builder withConfig(SchedulerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withCompletionListener(JobCompletionListener listener) {
            this.completionListener = listener;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public JobWorker build() {
            return new JobWorker(this);
        }
    }
}
