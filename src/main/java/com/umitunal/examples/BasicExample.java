package com.umitunal.examples;

import com.umitunal.tempo.config.SchedulerConfig;
import com.umitunal.tempo.config.StorageConfig;
import com.umitunal.tempo.engine.JobScheduler;
import com.umitunal.tempo.serialization.StringCodec;

import java.time.Duration;

/**
 * Fire-and-forget example - a job that runs as soon as a worker is free.
 */
public class BasicExample {

    public static void main(String[] args) {
        System.out.println("=== Background Job Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/tempo-basic")
                .build();
        SchedulerConfig config = SchedulerConfig.newBuilder()
                .withWorkerCount(2)
                .withPollInterval(Duration.ofSeconds(1))
                .withWorkerPollInterval(Duration.ofMillis(200))
                .build();

        try (JobScheduler scheduler = JobScheduler.open(storage, config)) {
            scheduler.registerHandler("console", new StringCodec(),
                    (message, context) -> System.out.println("  [" + context.getJobId() + "] " + message));
            scheduler.start();

            String jobId = scheduler.enqueue("console", "Background Job Triggered");
            System.out.println("Enqueued job " + jobId);

            Thread.sleep(1000);
            System.out.println("\nStatus: " + scheduler.getJobStatus(jobId));

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
