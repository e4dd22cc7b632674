package com.umitunal.examples;

import com.umitunal.tempo.config.SchedulerConfig;
import com.umitunal.tempo.config.StorageConfig;
import com.umitunal.tempo.engine.JobScheduler;
import com.umitunal.tempo.serialization.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Handlers backed by an application object instead of a lambda with no state.
 * Every kind of job writes through the same {@link LogWriter}.
 */
public class InjectedDependenciesExample {

    /**
     * Application service used by the handlers.
     */
    public static class LogWriter {
        private static final Logger log = LoggerFactory.getLogger(LogWriter.class);
        private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd hh:mm:ss a");

        public void writeLog(String message) {
            log.info("{} {}", LocalDateTime.now().format(FORMAT), message);
        }
    }

    public static void main(String[] args) {
        System.out.println("=== Injected Dependencies Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/tempo-injected")
                .withDurableWrites(false)
                .build();
        SchedulerConfig config = SchedulerConfig.newBuilder()
                .withWorkerCount(2)
                .withPollInterval(Duration.ofMillis(500))
                .withWorkerPollInterval(Duration.ofMillis(100))
                .build();

        LogWriter writer = new LogWriter();

        try (JobScheduler scheduler = JobScheduler.open(storage, config)) {
            scheduler.registerHandler("write-log", new StringCodec(), (message, context) -> writer.writeLog(message));
            scheduler.start();

            scheduler.enqueue("write-log", "Background Job Triggered");

            String jobId = scheduler.schedule("write-log", "Scheduled Job Triggered", Duration.ofSeconds(2));
            String job2Id = scheduler.continueWith(jobId, "write-log", "Continuation Job 1 Triggered");
            scheduler.continueWith(job2Id, "write-log", "Continuation Job 2 Triggered");
            scheduler.continueWith(job2Id, "write-log", "Continuation Job 3 Triggered");

            scheduler.addOrUpdateRecurring("RecurringJob1", "write-log", "Recurring Job Triggered", "* * * * *");

            Thread.sleep(5000);

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
