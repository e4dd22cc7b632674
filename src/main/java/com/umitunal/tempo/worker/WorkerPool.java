package com.umitunal.tempo.worker;

import com.umitunal.tempo.config.SchedulerConfig;
import com.umitunal.tempo.storage.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A fixed set of {@link JobWorker} loops sharing one {@link JobDispatcher}.
 */
public class WorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final JobStore store;
    private final JobHandlerRegistry registry;
    private final JobCompletionListener completionListener;
    private final SchedulerConfig config;
    private final Clock clock;
    private final List<JobWorker> workers = new ArrayList<>();

    private JobDispatcher dispatcher;

    public WorkerPool(JobStore store, JobHandlerRegistry registry, JobCompletionListener completionListener,
                      SchedulerConfig config, Clock clock) {
        this.store = store;
        this.registry = registry;
        this.completionListener = completionListener;
        this.config = config;
        this.clock = clock;
    }

    public synchronized void start() {
        if (dispatcher != null) {
            return;
        }
        dispatcher = new JobDispatcher(store, registry, config.getLeaseDuration(), config.getHeartbeatInterval());
        for (int i = 1; i <= config.getWorkerCount(); i++) {
            JobWorker worker = JobWorker.builder(config.getServerName() + ":" + i, store, dispatcher)
                    .withConfig(config)
                    .withCompletionListener(completionListener)
                    .withClock(clock)
                    .build();
            workers.add(worker);
            worker.start();
        }
        log.info("Started {} workers as {}", workers.size(), config.getServerName());
    }

    /**
     * Stops taking new jobs and gives running ones the shutdown timeout to
     * finish.
     */
    public synchronized void stop() {
        if (dispatcher == null) {
            return;
        }
        workers.forEach(JobWorker::stop);

        long deadline = System.currentTimeMillis() + config.getShutdownTimeout().toMillis();
        int interrupted = 0;
        for (JobWorker worker : workers) {
            Duration remaining = Duration.ofMillis(Math.max(1, deadline - System.currentTimeMillis()));
            if (!worker.awaitStop(remaining)) {
                interrupted++;
            }
        }
        dispatcher.shutdown(Duration.ofSeconds(1));
        dispatcher = null;
        workers.clear();

        if (interrupted > 0) {
            log.warn("{} workers were interrupted at shutdown; their jobs return after lease expiry", interrupted);
        }
        log.info("Worker pool stopped");
    }

    public synchronized boolean isRunning() {
        return dispatcher != null;
    }

    public synchronized List<JobWorker> getWorkers() {
        return Collections.unmodifiableList(new ArrayList<>(workers));
    }

    public synchronized long getSucceededCount() {
        return workers.stream().mapToLong(JobWorker::getSucceededCount).sum();
    }

    public synchronized long getFailedCount() {
        return workers.stream().mapToLong(JobWorker::getFailedCount).sum();
    }

    @Override
    public void close() {
        stop();
    }
}
