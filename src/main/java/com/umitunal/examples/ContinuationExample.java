package com.umitunal.examples;

import com.umitunal.tempo.config.SchedulerConfig;
import com.umitunal.tempo.config.StorageConfig;
import com.umitunal.tempo.engine.JobScheduler;
import com.umitunal.tempo.serialization.StringCodec;

import java.time.Duration;

/**
 * Continuation example - a chain that fans out after its second link.
 *
 * <pre>
 * scheduled job -> continuation 1 -> continuation 2
 *                                 -> continuation 3
 * </pre>
 */
public class ContinuationExample {

    public static void main(String[] args) {
        System.out.println("=== Continuation Job Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/tempo-continuations")
                .withDurableWrites(false)
                .build();
        SchedulerConfig config = SchedulerConfig.newBuilder()
                .withWorkerCount(2)
                .withPollInterval(Duration.ofMillis(500))
                .withWorkerPollInterval(Duration.ofMillis(100))
                .build();

        try (JobScheduler scheduler = JobScheduler.open(storage, config)) {
            scheduler.registerHandler("console", new StringCodec(),
                    (message, context) -> System.out.println("  " + message));
            scheduler.start();

            String jobId = scheduler.schedule("console", "Scheduled Job Triggered", Duration.ofSeconds(2));
            String job2Id = scheduler.continueWith(jobId, "console", "Continuation Job 1 Triggered");
            String job3Id = scheduler.continueWith(job2Id, "console", "Continuation Job 2 Triggered");
            String job4Id = scheduler.continueWith(job2Id, "console", "Continuation Job 3 Triggered");

            System.out.println("Created chain:");
            for (String id : new String[]{jobId, job2Id, job3Id, job4Id}) {
                System.out.println("  " + scheduler.getJobStatus(id));
            }

            Thread.sleep(5000);

            System.out.println("\nAfter the chain ran:");
            for (String id : new String[]{jobId, job2Id, job3Id, job4Id}) {
                System.out.println("  " + scheduler.getJobStatus(id));
            }

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
