package com.umitunal.tempo.engine;

import com.umitunal.tempo.config.SchedulerConfig;
import com.umitunal.tempo.config.StorageConfig;
import com.umitunal.tempo.core.ContinuationTrigger;
import com.umitunal.tempo.core.HandlerNotFoundException;
import com.umitunal.tempo.core.InvalidScheduleException;
import com.umitunal.tempo.core.JobNotFoundException;
import com.umitunal.tempo.core.JobState;
import com.umitunal.tempo.core.JobStatus;
import com.umitunal.tempo.model.RecurringJobDefinition;
import com.umitunal.tempo.serialization.NoArgumentsCodec;
import com.umitunal.tempo.serialization.StringCodec;
import com.umitunal.tempo.storage.RocksJobStore;
import com.umitunal.tempo.storage.StateChange;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class JobSchedulerTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    @TempDir
    Path tempDir;

    private SchedulerConfig config;
    private RocksJobStore store;
    private JobScheduler scheduler;
    private List<String> log;

    @BeforeEach
    void setUp() {
        config = SchedulerConfig.newBuilder()
                .withServerName("it")
                .withWorkerCount(2)
                .withWorkerPollInterval(Duration.ofMillis(20))
                .withPollInterval(Duration.ofMillis(50))
                .withLeaseDuration(Duration.ofSeconds(5))
                .withHeartbeatInterval(Duration.ofMillis(200))
                .withRetryBaseDelay(Duration.ofMillis(50))
                .withDefaultMaxAttempts(3)
                .withShutdownTimeout(Duration.ofSeconds(2))
                .build();
        store = new RocksJobStore(StorageConfig.newBuilder(tempDir.resolve("db").toString()).build());
        scheduler = JobScheduler.builder(store).withConfig(config).build();
        log = new CopyOnWriteArrayList<>();
        scheduler.registerHandler("record", new StringCodec(), (args, ctx) -> log.add(args));
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
        store.close();
    }

    private void awaitState(String jobId, JobState state) {
        await().atMost(WAIT).untilAsserted(() ->
                assertThat(scheduler.getJobStatus(jobId).getState()).isEqualTo(state));
    }

    @Test
    @DisplayName("Should run an enqueued job")
    void testEnqueue() {
        // Given
        scheduler.start();

        // When
        String jobId = scheduler.enqueue("record", "hello");

        // Then
        awaitState(jobId, JobState.SUCCEEDED);
        JobStatus status = scheduler.getJobStatus(jobId);
        assertThat(status.isTerminal()).isTrue();
        assertThat(status.getAttempts()).isEqualTo(1);
        assertThat(log).containsExactly("hello");
    }

    @Test
    @DisplayName("Should run a scheduled job only after its delay")
    void testSchedule() {
        // Given
        scheduler.start();

        // When
        String jobId = scheduler.schedule("record", "later", Duration.ofMillis(500));

        // Then
        assertThat(scheduler.getJobStatus(jobId).getState()).isEqualTo(JobState.SCHEDULED);
        assertThat(log).isEmpty();
        awaitState(jobId, JobState.SUCCEEDED);
        assertThat(log).containsExactly("later");
    }

    @Test
    @DisplayName("Should run continuations in order")
    void testContinuationChain() {
        // Given
        String first = scheduler.enqueue("record", "extract");
        String second = scheduler.continueWith(first, "record", "transform");
        String third = scheduler.continueWith(second, "record", "load");
        assertThat(scheduler.getJobStatus(third).getState()).isEqualTo(JobState.AWAITING_CONTINUATION);

        // When
        scheduler.start();

        // Then
        awaitState(third, JobState.SUCCEEDED);
        assertThat(log).containsExactly("extract", "transform", "load");
    }

    @Test
    @DisplayName("Should run an any-terminal continuation after a permanent failure")
    void testContinuationAfterFailure() {
        // Given
        scheduler.registerHandler("always-fails", new NoArgumentsCodec(), (args, ctx) -> {
            throw new IllegalStateException("nope");
        });
        String failing = scheduler.enqueue("always-fails", null);
        String onSuccess = scheduler.continueWith(failing, "record", "not run");
        String cleanup = scheduler.continueWith(failing, "record", "cleanup", ContinuationTrigger.ON_ANY_TERMINAL);

        // When
        scheduler.start();

        // Then
        awaitState(cleanup, JobState.SUCCEEDED);
        JobStatus failed = scheduler.getJobStatus(failing);
        assertThat(failed.getState()).isEqualTo(JobState.FAILED);
        assertThat(failed.getAttempts()).isEqualTo(3);
        assertThat(failed.getError()).contains("nope");
        assertThat(scheduler.getJobStatus(onSuccess).getState()).isEqualTo(JobState.DELETED);
        assertThat(log).containsExactly("cleanup");
    }

    @Test
    @DisplayName("Should retry a failing job until it succeeds")
    void testRetry() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        scheduler.registerHandler("flaky", new NoArgumentsCodec(), (args, ctx) -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("attempt " + ctx.getAttempt());
            }
        });
        scheduler.start();

        // When
        String jobId = scheduler.enqueue("flaky", null);

        // Then
        awaitState(jobId, JobState.SUCCEEDED);
        assertThat(scheduler.getJobStatus(jobId).getAttempts()).isEqualTo(3);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should create, update and remove recurring jobs")
    void testRecurringLifecycle() {
        // When
        scheduler.addOrUpdateRecurring("nightly", "record", "v1", "0 2 * * *");
        scheduler.addOrUpdateRecurring("nightly", "record", "v2", "30 3 * * *");

        // Then
        RecurringJobDefinition definition = store.findRecurring("nightly").orElseThrow();
        assertThat(definition.getCronExpression()).isEqualTo("30 3 * * *");
        assertThat(new String(definition.getPayload().getArguments())).isEqualTo("v2");
        assertThat(store.listRecurring()).hasSize(1);

        assertThat(scheduler.removeRecurring("nightly")).isTrue();
        assertThat(scheduler.removeRecurring("nightly")).isFalse();
        assertThat(store.findRecurring("nightly")).isEmpty();
    }

    @Test
    @DisplayName("Should reject invalid cron expressions without storing anything")
    void testInvalidCron() {
        assertThatThrownBy(() -> scheduler.addOrUpdateRecurring("broken", "record", "x", "61 * * * *"))
                .isInstanceOf(InvalidScheduleException.class);
        assertThatThrownBy(() -> scheduler.addOrUpdateRecurring("broken", "record", "x", "  "))
                .isInstanceOf(InvalidScheduleException.class);
        assertThat(store.findRecurring("broken")).isEmpty();
    }

    @Test
    @DisplayName("Should run a recurring job on demand")
    void testTriggerRecurring() {
        // Given
        scheduler.addOrUpdateRecurring("reindex", "record", "manual", "0 0 1 1 *");
        scheduler.start();

        // When
        Optional<String> jobId = scheduler.triggerRecurring("reindex");

        // Then
        assertThat(jobId).isPresent();
        awaitState(jobId.get(), JobState.SUCCEEDED);
        assertThat(log).containsExactly("manual");
        assertThat(scheduler.triggerRecurring("unknown")).isEmpty();
    }

    @Test
    @DisplayName("Should delete pending jobs and their continuations")
    void testDelete() {
        // Given
        String scheduled = scheduler.schedule("record", "never", Duration.ofHours(1));
        String dependent = scheduler.continueWith(scheduled, "record", "never either");

        // When
        boolean deleted = scheduler.delete(scheduled);

        // Then
        assertThat(deleted).isTrue();
        assertThat(scheduler.getJobStatus(scheduled).getState()).isEqualTo(JobState.DELETED);
        assertThat(scheduler.getJobStatus(dependent).getState()).isEqualTo(JobState.DELETED);
        assertThat(scheduler.delete(scheduled)).isFalse();
    }

    @Test
    @DisplayName("Should refuse to delete a failed job until its retry is scheduled")
    void testDeleteFailedWithAttemptsLeft() {
        // Given: a failure recorded without its retry
        String jobId = scheduler.enqueue("record", "flaky");
        assertThat(store.tryAcquireLease(jobId, "w1", Duration.ofSeconds(30))).isTrue();
        assertThat(store.transition(jobId, JobState.ENQUEUED, JobState.PROCESSING)).isTrue();
        assertThat(store.transition(jobId, JobState.PROCESSING, JobState.FAILED, StateChange.withError("boom"))).isTrue();

        // When
        boolean deletedWhileFailed = scheduler.delete(jobId);
        scheduler.getPoller().tick();

        // Then
        assertThat(deletedWhileFailed).isFalse();
        assertThat(scheduler.getJobStatus(jobId).getState()).isEqualTo(JobState.SCHEDULED);
        assertThat(scheduler.delete(jobId)).isTrue();
        assertThat(scheduler.getJobStatus(jobId).getState()).isEqualTo(JobState.DELETED);
    }

    @Test
    @DisplayName("Should report unknown jobs and handlers")
    void testErrors() {
        assertThatThrownBy(() -> scheduler.getJobStatus("missing"))
                .isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> scheduler.delete("missing"))
                .isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> scheduler.continueWith("missing", "record", "x"))
                .isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> scheduler.enqueue("unregistered", "x"))
                .isInstanceOf(HandlerNotFoundException.class);
    }

    @Test
    @DisplayName("Should pick up jobs persisted before a restart")
    void testSurvivesRestart() {
        // Given: a producer that never starts workers
        StorageConfig storage = StorageConfig.newBuilder(tempDir.resolve("restart").toString())
                .withDurableWrites(true)
                .build();
        JobScheduler producer = JobScheduler.open(storage, config);
        producer.registerHandler("record", new StringCodec(), (args, ctx) -> log.add(args));
        String jobId = producer.enqueue("record", "persisted");
        producer.close();

        // When
        try (JobScheduler consumer = JobScheduler.open(storage, config)) {
            consumer.registerHandler("record", new StringCodec(), (args, ctx) -> log.add("ran " + args));
            consumer.start();

            // Then
            await().atMost(WAIT).untilAsserted(() ->
                    assertThat(consumer.getJobStatus(jobId).getState()).isEqualTo(JobState.SUCCEEDED));
        }
        assertThat(log).containsExactly("ran persisted");
    }

    @Test
    @DisplayName("Should start and stop the poller and workers")
    void testLifecycle() {
        scheduler.start();
        assertThat(scheduler.isRunning()).isTrue();
        assertThat(scheduler.getWorkers().getWorkers()).hasSize(2);

        scheduler.stop();

        assertThat(scheduler.isRunning()).isFalse();
        assertThat(scheduler.getPoller().isRunning()).isFalse();
    }
}
