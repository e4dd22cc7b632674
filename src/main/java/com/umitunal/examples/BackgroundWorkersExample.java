package com.umitunal.examples;

import com.umitunal.tempo.config.SchedulerConfig;
import com.umitunal.tempo.config.StorageConfig;
import com.umitunal.tempo.core.JobState;
import com.umitunal.tempo.engine.JobScheduler;
import com.umitunal.tempo.monitoring.DashboardSnapshot;
import com.umitunal.tempo.serialization.StringCodec;
import com.umitunal.tempo.storage.RocksJobStore;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Background workers example - several workers draining a batch of jobs,
 * watched through the dashboard service.
 */
public class BackgroundWorkersExample {

    public static void main(String[] args) {
        System.out.println("=== Background Workers Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/tempo-workers")
                .withDurableWrites(false)
                .build();
        SchedulerConfig config = SchedulerConfig.newBuilder()
                .withServerName("example-node")
                .withWorkerCount(4)
                .withPollInterval(Duration.ofSeconds(1))
                .withWorkerPollInterval(Duration.ofMillis(100))
                .withDefaultMaxAttempts(1)
                .build();

        try (RocksJobStore store = new RocksJobStore(storage);
             JobScheduler scheduler = JobScheduler.builder(store)
                     .withConfig(config)
                     .withControlAuthorizer((caller, action, target) -> "admin".equals(caller))
                     .build()) {

            scheduler.registerHandler("work", new StringCodec(), (task, context) -> {
                Thread.sleep(ThreadLocalRandom.current().nextInt(50, 150));
                if (task.endsWith("7")) {
                    throw new IllegalArgumentException("Cannot process " + task);
                }
            });

            for (int i = 1; i <= 20; i++) {
                scheduler.enqueue("work", "task-" + i);
            }
            String cancelled = scheduler.schedule("work", "task-never", Duration.ofHours(1));
            System.out.println("Submitted 21 jobs");

            scheduler.start();
            Thread.sleep(2000);

            scheduler.monitoring().deleteJob("admin", cancelled);
            DashboardSnapshot snapshot = scheduler.monitoring().snapshot();
            System.out.println("\nSucceeded: " + snapshot.count(JobState.SUCCEEDED));
            System.out.println("Failed:    " + snapshot.count(JobState.FAILED));
            System.out.println("Deleted:   " + snapshot.count(JobState.DELETED));
            for (DashboardSnapshot.FailedJobView failure : snapshot.getRecentFailures()) {
                System.out.println("  " + failure.getJobId() + ": " + failure.getError());
            }
            System.out.println("Store conflicts resolved: " + store.getTransactionConflictCount());

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
