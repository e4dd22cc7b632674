package com.umitunal.examples;

import com.umitunal.tempo.config.SchedulerConfig;
import com.umitunal.tempo.config.StorageConfig;
import com.umitunal.tempo.engine.JobScheduler;
import com.umitunal.tempo.monitoring.DashboardSnapshot;
import com.umitunal.tempo.serialization.StringCodec;

import java.time.Duration;

/**
 * Recurring job example - a job spawned every minute from a cron expression.
 */
public class RecurringJobExample {

    public static void main(String[] args) {
        System.out.println("=== Recurring Job Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/tempo-recurring")
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

            // Registering the same id again replaces the definition
            scheduler.addOrUpdateRecurring("RecurringJob1", "console", "Recurring Job Triggered", "* * * * *");

            for (DashboardSnapshot.RecurringJobView view : scheduler.monitoring().recurringJobs()) {
                System.out.println("Registered '" + view.getId() + "' (" + view.getCronExpression()
                        + "), next fire " + view.getNextFireAt());
            }

            // Run it once now instead of waiting for the next minute
            scheduler.triggerRecurring("RecurringJob1")
                    .ifPresent(id -> System.out.println("Triggered manually as " + id));

            Thread.sleep(1500);

            scheduler.removeRecurring("RecurringJob1");
            System.out.println("\nRemoved recurring job");

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
