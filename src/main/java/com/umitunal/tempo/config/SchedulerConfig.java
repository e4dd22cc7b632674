package com.umitunal.tempo.config;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Properties;

/**
 * Runtime settings of the scheduler engine: worker pool, poller, leases,
 * retries and retention.
 */
public class SchedulerConfig {
    static final String PREFIX = "tempo.scheduler.";

    private final String serverName;
    private final int workerCount;
    private final Duration workerPollInterval;
    private final Duration pollInterval;
    private final int batchSize;
    private final Duration leaseDuration;
    private final Duration heartbeatInterval;
    private final Duration defaultTimeout;
    private final int defaultMaxAttempts;
    private final Duration retryBaseDelay;
    private final Duration maxRetryDelay;
    private final Duration succeededRetention;
    private final Duration purgeInterval;
    private final Duration shutdownTimeout;

    private SchedulerConfig(Builder builder) {
        this.serverName = builder.serverName;
        this.workerCount = builder.workerCount;
        this.workerPollInterval = builder.workerPollInterval;
        this.pollInterval = builder.pollInterval;
        this.batchSize = builder.batchSize;
        this.leaseDuration = builder.leaseDuration;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.defaultTimeout = builder.defaultTimeout;
        this.defaultMaxAttempts = builder.defaultMaxAttempts;
        this.retryBaseDelay = builder.retryBaseDelay;
        this.maxRetryDelay = builder.maxRetryDelay;
        this.succeededRetention = builder.succeededRetention;
        this.purgeInterval = builder.purgeInterval;
        this.shutdownTimeout = builder.shutdownTimeout;
    }

    public String getServerName() { return serverName; }
    public int getWorkerCount() { return workerCount; }
    public Duration getWorkerPollInterval() { return workerPollInterval; }
    public Duration getPollInterval() { return pollInterval; }
    public int getBatchSize() { return batchSize; }
    public Duration getLeaseDuration() { return leaseDuration; }
    public Duration getHeartbeatInterval() { return heartbeatInterval; }
    public Duration getDefaultTimeout() { return defaultTimeout; }
    public int getDefaultMaxAttempts() { return defaultMaxAttempts; }
    public Duration getRetryBaseDelay() { return retryBaseDelay; }
    public Duration getMaxRetryDelay() { return maxRetryDelay; }
    public Duration getSucceededRetention() { return succeededRetention; }
    public Duration getPurgeInterval() { return purgeInterval; }
    public Duration getShutdownTimeout() { return shutdownTimeout; }

    /**
     * Delay before the next attempt after {@code attempt} failed attempts:
     * exponential from the base delay, capped.
     */
    public Duration retryDelay(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        long millis = retryBaseDelay.toMillis() << exponent;
        if (millis < 0 || millis > maxRetryDelay.toMillis()) {
            return maxRetryDelay;
        }
        return Duration.ofMillis(millis);
    }

    public static SchedulerConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Reads {@code tempo.scheduler.*} keys; absent keys keep their defaults.
     */
    public static SchedulerConfig fromProperties(Properties properties) {
        ConfigProperties props = new ConfigProperties(properties);
        Builder b = new Builder();
        return b.withServerName(props.getString(PREFIX + "server-name", b.serverName))
                .withWorkerCount(props.getInt(PREFIX + "worker-count", b.workerCount))
                .withWorkerPollInterval(props.getDuration(PREFIX + "worker-poll-interval", b.workerPollInterval))
                .withPollInterval(props.getDuration(PREFIX + "poll-interval", b.pollInterval))
                .withBatchSize(props.getInt(PREFIX + "batch-size", b.batchSize))
                .withLeaseDuration(props.getDuration(PREFIX + "lease-duration", b.leaseDuration))
                .withHeartbeatInterval(props.getDuration(PREFIX + "heartbeat-interval", b.heartbeatInterval))
                .withDefaultTimeout(props.getDuration(PREFIX + "default-timeout", b.defaultTimeout))
                .withDefaultMaxAttempts(props.getInt(PREFIX + "max-attempts", b.defaultMaxAttempts))
                .withRetryBaseDelay(props.getDuration(PREFIX + "retry-base-delay", b.retryBaseDelay))
                .withMaxRetryDelay(props.getDuration(PREFIX + "max-retry-delay", b.maxRetryDelay))
                .withSucceededRetention(props.getDuration(PREFIX + "succeeded-retention", b.succeededRetention))
                .withPurgeInterval(props.getDuration(PREFIX + "purge-interval", b.purgeInterval))
                .withShutdownTimeout(props.getDuration(PREFIX + "shutdown-timeout", b.shutdownTimeout))
                .build();
    }

    public static SchedulerConfig fromClasspath(String resource) {
        return fromProperties(ConfigProperties.loadClasspath(resource));
    }

    @Override
    public String toString() {
        return String.format("SchedulerConfig{server='%s', workers=%d, poll=%s, lease=%s, heartbeat=%s, maxAttempts=%d}",
                serverName, workerCount, pollInterval, leaseDuration, heartbeatInterval, defaultMaxAttempts);
    }

    private static String defaultServerName() {
        String jvm = ManagementFactory.getRuntimeMXBean().getName();
        return jvm == null || jvm.isBlank() ? "tempo" : jvm;
    }

    public static class Builder {
        private String serverName = defaultServerName();
        private int workerCount = Math.min(Runtime.getRuntime().availableProcessors() * 5, 20);
        private Duration workerPollInterval = Duration.ofSeconds(1);
        private Duration pollInterval = Duration.ofSeconds(15);
        private int batchSize = 100;
        private Duration leaseDuration = Duration.ofMinutes(5);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration defaultTimeout = Duration.ofHours(24);
        private int defaultMaxAttempts = 3;
        private Duration retryBaseDelay = Duration.ofSeconds(10);
        private Duration maxRetryDelay = Duration.ofHours(1);
        private Duration succeededRetention = Duration.ofHours(24);
        private Duration purgeInterval = Duration.ofHours(1);
        private Duration shutdownTimeout = Duration.ofSeconds(20);

        private Builder() {
        }

        /**
         * Prefix of worker ids, shown as lease owner.
         * Default: JVM name (pid@host)
         */
        public Builder withServerName(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("serverName must not be empty");
            }
            this.serverName = name;
            return this;
        }

        /**
         * Number of concurrent worker loops.
         * Default: min(cores * 5, 20)
         */
        public Builder withWorkerCount(int count) {
            this.workerCount = positive("workerCount", count);
            return this;
        }

        /**
         * Idle sleep of a worker loop that found nothing to run.
         * Default: 1 second
         */
        public Builder withWorkerPollInterval(Duration interval) {
            this.workerPollInterval = positive("workerPollInterval", interval);
            return this;
        }

        /**
         * Delay between scheduler poller ticks.
         * Default: 15 seconds
         */
        public Builder withPollInterval(Duration interval) {
            this.pollInterval = positive("pollInterval", interval);
            return this;
        }

        /**
         * Max jobs handled per query in one tick or worker poll.
         * Default: 100
         */
        public Builder withBatchSize(int size) {
            this.batchSize = positive("batchSize", size);
            return this;
        }

        /**
         * Default: 5 minutes
         */
        public Builder withLeaseDuration(Duration duration) {
            this.leaseDuration = positive("leaseDuration", duration);
            return this;
        }

        /**
         * Lease renewal period of running jobs. Must be shorter than the lease.
         * Default: 30 seconds
         */
        public Builder withHeartbeatInterval(Duration interval) {
            this.heartbeatInterval = positive("heartbeatInterval", interval);
            return this;
        }

        /**
         * Default: 24 hours
         */
        public Builder withDefaultTimeout(Duration timeout) {
            this.defaultTimeout = positive("defaultTimeout", timeout);
            return this;
        }

        /**
         * Default: 3
         */
        public Builder withDefaultMaxAttempts(int attempts) {
            this.defaultMaxAttempts = positive("defaultMaxAttempts", attempts);
            return this;
        }

        /**
         * Default: 10 seconds
         */
        public Builder withRetryBaseDelay(Duration delay) {
            if (delay == null || delay.isNegative()) {
                throw new IllegalArgumentException("retryBaseDelay must be >= 0");
            }
            this.retryBaseDelay = delay;
            return this;
        }

        /**
         * Default: 1 hour
         */
        public Builder withMaxRetryDelay(Duration delay) {
            this.maxRetryDelay = positive("maxRetryDelay", delay);
            return this;
        }

        /**
         * How long succeeded and deleted jobs are kept before purging.
         * Default: 24 hours
         */
        public Builder withSucceededRetention(Duration retention) {
            this.succeededRetention = positive("succeededRetention", retention);
            return this;
        }

        /**
         * Default: 1 hour
         */
        public Builder withPurgeInterval(Duration interval) {
            this.purgeInterval = positive("purgeInterval", interval);
            return this;
        }

        /**
         * Grace period for running jobs on stop.
         * Default: 20 seconds
         */
        public Builder withShutdownTimeout(Duration timeout) {
            this.shutdownTimeout = positive("shutdownTimeout", timeout);
            return this;
        }

        public SchedulerConfig build() {
            if (heartbeatInterval.compareTo(leaseDuration) >= 0) {
                throw new IllegalArgumentException("heartbeatInterval (" + heartbeatInterval
                        + ") must be shorter than leaseDuration (" + leaseDuration + ")");
            }
            return new SchedulerConfig(this);
        }

        private static int positive(String name, int value) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be > 0, got " + value);
            }
            return value;
        }

        private static Duration positive(String name, Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be a positive duration, got " + value);
            }
            return value;
        }
    }
}
