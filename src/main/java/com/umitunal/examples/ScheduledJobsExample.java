package com.umitunal.examples;

import com.umitunal.tempo.config.SchedulerConfig;
import com.umitunal.tempo.config.StorageConfig;
import com.umitunal.tempo.core.JobState;
import com.umitunal.tempo.engine.JobScheduler;
import com.umitunal.tempo.serialization.StringCodec;

import java.time.Duration;

/**
 * Delayed job example - a job that becomes due five seconds after it was created.
 */
public class ScheduledJobsExample {

    public static void main(String[] args) {
        System.out.println("=== Scheduled Job Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/tempo-scheduled")
                .withDurableWrites(false)
                .build();
        SchedulerConfig config = SchedulerConfig.newBuilder()
                .withWorkerCount(1)
                .withPollInterval(Duration.ofSeconds(1))
                .withWorkerPollInterval(Duration.ofMillis(200))
                .build();

        try (JobScheduler scheduler = JobScheduler.open(storage, config)) {
            scheduler.registerHandler("console", new StringCodec(),
                    (message, context) -> System.out.println("  " + message));
            scheduler.start();

            String jobId = scheduler.schedule("console", "Scheduled Job Triggered", Duration.ofSeconds(5));
            System.out.println("Scheduled job " + jobId + " to run in 5 seconds");

            // Watch the job move through SCHEDULED -> ENQUEUED -> PROCESSING -> SUCCEEDED
            JobState last = null;
            for (int i = 0; i < 80; i++) {
                JobState state = scheduler.getJobStatus(jobId).getState();
                if (state != last) {
                    System.out.println("  t+" + (i * 100) + "ms: " + state);
                    last = state;
                }
                if (state == JobState.SUCCEEDED) {
                    break;
                }
                Thread.sleep(100);
            }

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
