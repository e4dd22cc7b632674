package com.umitunal.tempo.worker;

import com.umitunal.tempo.core.LeaseConflictException;
import com.umitunal.tempo.core.PayloadExecutionException;
import com.umitunal.tempo.core.StoreUnavailableException;
import com.umitunal.tempo.model.JobRecord;
import com.umitunal.tempo.storage.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs job bodies on an execution pool with a timeout while a shared
 * scheduler keeps their leases alive.
 *
 * The worker loop that called {@link #dispatch} blocks until the body
 * finishes, times out, or is cancelled. Concurrency is bounded by the number
 * of worker loops, not by the pool: every dispatch starts on a free thread,
 * even while a timed-out body that ignores interruption still holds another.
 */
public class JobDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final JobStore store;
    private final JobHandlerRegistry registry;
    private final Duration leaseDuration;
    private final Duration heartbeatInterval;
    private final ExecutorService executionPool;
    private final ScheduledExecutorService heartbeats;

    public JobDispatcher(JobStore store, JobHandlerRegistry registry, Duration leaseDuration,
                         Duration heartbeatInterval) {
        this.store = store;
        this.registry = registry;
        this.leaseDuration = leaseDuration;
        this.heartbeatInterval = heartbeatInterval;
        this.executionPool = Executors.newCachedThreadPool(namedThreads("tempo-job-"));
        this.heartbeats = Executors.newSingleThreadScheduledExecutor(namedThreads("tempo-heartbeat-"));
    }

    /**
     * Runs one attempt of a job the caller has leased and moved to PROCESSING.
     */
    public ExecutionOutcome dispatch(JobRecord job, String workerId) {
        JobContext context = new JobContext(job.getId(), job.getPayload().getHandler(), job.getAttempts());
        Future<?> future;
        try {
            future = executionPool.submit(() -> {
                registry.execute(job.getPayload(), context);
                return null;
            });
        } catch (RuntimeException e) {
            return ExecutionOutcome.abandoned("execution pool rejected the job: " + e.getMessage());
        }

        long heartbeatMillis = heartbeatInterval.toMillis();
        ScheduledFuture<?> heartbeat = heartbeats.scheduleWithFixedDelay(
                () -> heartbeat(job.getId(), workerId, context, future),
                heartbeatMillis, heartbeatMillis, TimeUnit.MILLISECONDS);
        try {
            future.get(job.getTimeoutMillis(), TimeUnit.MILLISECONDS);
            return context.isCancellationRequested()
                    ? ExecutionOutcome.abandoned("cancelled")
                    : ExecutionOutcome.succeeded();
        } catch (TimeoutException e) {
            future.cancel(true);
            return ExecutionOutcome.failed(new PayloadExecutionException(job.getId(),
                    "Timed out after " + Duration.ofMillis(job.getTimeoutMillis())));
        } catch (CancellationException e) {
            return ExecutionOutcome.abandoned("cancelled");
        } catch (ExecutionException e) {
            if (context.isCancellationRequested()) {
                return ExecutionOutcome.abandoned("cancelled");
            }
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return ExecutionOutcome.failed(new PayloadExecutionException(job.getId(), describe(cause), cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.cancel();
            future.cancel(true);
            return ExecutionOutcome.abandoned("worker interrupted");
        } finally {
            heartbeat.cancel(false);
        }
    }

    private void heartbeat(String jobId, String workerId, JobContext context, Future<?> future) {
        try {
            if (!store.renewLease(jobId, workerId, leaseDuration)) {
                log.info("Job {} was deleted or reclaimed, cancelling", jobId);
                cancel(context, future);
            }
        } catch (LeaseConflictException e) {
            log.warn("Lost lease on job {} to {}, cancelling", jobId, e.getOwner());
            cancel(context, future);
        } catch (StoreUnavailableException e) {
            log.warn("Lease renewal for job {} failed, will retry: {}", jobId, e.getMessage());
        }
    }

    private static void cancel(JobContext context, Future<?> future) {
        context.cancel();
        future.cancel(true);
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        String type = error.getClass().getName();
        return message == null ? type : type + ": " + message;
    }

    /**
     * Waits up to {@code timeout} for running bodies, then interrupts them.
     */
    public void shutdown(Duration timeout) {
        executionPool.shutdown();
        try {
            if (!executionPool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executionPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            executionPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        heartbeats.shutdownNow();
    }

    @Override
    public void close() {
        executionPool.shutdownNow();
        heartbeats.shutdownNow();
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
