package com.umitunal.examples;

import com.umitunal.tempo.config.SchedulerConfig;
import com.umitunal.tempo.config.StorageConfig;
import com.umitunal.tempo.core.JobStatus;
import com.umitunal.tempo.engine.JobScheduler;
import com.umitunal.tempo.serialization.StringCodec;

import java.time.Duration;

/**
 * Retry mechanism example - demonstrates automatic retry with backoff.
 */
public class RetryExample {

    public static void main(String[] args) {
        System.out.println("=== Retry Mechanism Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/tempo-retry")
                .build();
        SchedulerConfig config = SchedulerConfig.newBuilder()
                .withWorkerCount(1)
                .withPollInterval(Duration.ofMillis(250))
                .withWorkerPollInterval(Duration.ofMillis(100))
                .withDefaultMaxAttempts(3)
                .withRetryBaseDelay(Duration.ofMillis(500))
                .build();

        try (JobScheduler scheduler = JobScheduler.open(storage, config)) {
            // Fails twice, then succeeds
            scheduler.registerHandler("flaky-api", new StringCodec(), (call, context) -> {
                System.out.println("  Attempt " + context.getAttempt() + ": " + call);
                if (context.getAttempt() < 3) {
                    throw new IllegalStateException("Connection timeout");
                }
                System.out.println("  Success!");
            });
            scheduler.start();

            String jobId = scheduler.enqueue("flaky-api", "Unreliable API call");
            System.out.println("Submitted job with max 3 attempts\n");

            Thread.sleep(4000);

            JobStatus status = scheduler.getJobStatus(jobId);
            System.out.println("\n" + status);
            System.out.println("Last error: " + status.getError());

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
