package com.umitunal.examples;

import com.umitunal.tempo.config.SchedulerConfig;
import com.umitunal.tempo.config.StorageConfig;
import com.umitunal.tempo.core.JobPayload;
import com.umitunal.tempo.core.JobState;
import com.umitunal.tempo.engine.JobScheduler;
import com.umitunal.tempo.serialization.StringCodec;
import com.umitunal.tempo.storage.JobStore;
import com.umitunal.tempo.storage.RocksJobStore;
import com.umitunal.tempo.worker.JobHandlerRegistry;

import java.time.Duration;

/**
 * Job recovery example - demonstrates a crashed worker's job being reclaimed
 * after its lease expires.
 */
public class RecoveryExample {

    public static void main(String[] args) {
        System.out.println("=== Job Recovery Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/tempo-recovery")
                .build();
        JobHandlerRegistry registry = new JobHandlerRegistry()
                .register("console", new StringCodec(), (message, context) ->
                        System.out.println("  Recovered and ran: " + message + " (attempt " + context.getAttempt() + ")"));

        try (JobStore store = new RocksJobStore(storage)) {
            // A worker takes two jobs and dies without finishing them
            String workerId = "worker-crash";
            for (String message : new String[]{"Job that will be abandoned", "Another abandoned job"}) {
                String jobId = store.create(registry.payloadFor("console", message), null, null);
                store.tryAcquireLease(jobId, workerId, Duration.ofSeconds(1));
                store.transition(jobId, JobState.ENQUEUED, JobState.PROCESSING);
            }
            System.out.println("Worker acquired jobs but crashed:");
            System.out.println("  " + store.getMetrics());

            System.out.println("\nWaiting for leases to expire (1.5s)...");
            Thread.sleep(1500);

            SchedulerConfig config = SchedulerConfig.newBuilder()
                    .withWorkerCount(1)
                    .withPollInterval(Duration.ofMillis(250))
                    .withWorkerPollInterval(Duration.ofMillis(100))
                    .build();
            try (JobScheduler scheduler = JobScheduler.builder(store)
                    .withConfig(config)
                    .withRegistry(registry)
                    .build()) {
                scheduler.start();
                Thread.sleep(1500);
            }

            System.out.println("\n" + store.getMetrics());

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
