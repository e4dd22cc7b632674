package com.umitunal.examples;

import com.umitunal.tempo.config.SchedulerConfig;
import com.umitunal.tempo.config.StorageConfig;
import com.umitunal.tempo.engine.JobScheduler;
import com.umitunal.tempo.serialization.JsonCodec;

import java.time.Duration;

/**
 * Example demonstrating handler arguments stored as JSON.
 */
public class JsonExample {

    public static void main(String[] args) {
        System.out.println("=== JSON Arguments Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/tempo-json")
                .withDurableWrites(false)
                .build();
        SchedulerConfig config = SchedulerConfig.newBuilder()
                .withWorkerCount(2)
                .withPollInterval(Duration.ofSeconds(1))
                .withWorkerPollInterval(Duration.ofMillis(100))
                .build();

        try (JobScheduler scheduler = JobScheduler.open(storage, config)) {
            scheduler.registerHandler("send-email", new JsonCodec<>(EmailTask.class), (email, context) -> {
                System.out.println("\n  Sending email (attempt " + context.getAttempt() + "):");
                System.out.println("    To: " + email.getRecipient());
                System.out.println("    Subject: " + email.getSubject());
                System.out.println("    Template: " + email.getTemplate());
                Thread.sleep(200);
            });
            scheduler.start();

            scheduler.enqueue("send-email",
                    new EmailTask("user@example.com", "Welcome!", "Welcome to our platform", "welcome-template"));
            scheduler.enqueue("send-email",
                    new EmailTask("user@example.com", "Password Reset", "Click here to reset your password", "reset-template"));
            scheduler.schedule("send-email",
                    new EmailTask("user@example.com", "Special Offer", "Get 50% off today!", "promo-template"),
                    Duration.ofSeconds(2));

            System.out.println("Enqueued 3 email tasks, one of them delayed");

            Thread.sleep(4000);
            System.out.println("\n" + scheduler.monitoring().snapshot().toJson());

        } catch (Exception e) {
            e.printStackTrace();
        }
    }

    /**
     * Example POJO for email tasks.
     */
    public static class EmailTask {
        private String recipient;
        private String subject;
        private String body;
        private String template;

        // Required for Jackson
        public EmailTask() {}

        public EmailTask(String recipient, String subject, String body, String template) {
            this.recipient = recipient;
            this.subject = subject;
            this.body = body;
            this.template = template;
        }

        public String getRecipient() { return recipient; }
        public void setRecipient(String recipient) { this.recipient = recipient; }

        public String getSubject() { return subject; }
        public void setSubject(String subject) { this.subject = subject; }

        public String getBody() { return body; }
        public void setBody(String body) { this.body = body; }

        public String getTemplate() { return template; }
        public void setTemplate(String template) { this.template = template; }
    }
}
