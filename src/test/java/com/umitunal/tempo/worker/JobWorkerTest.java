package com.umitunal.tempo.worker;

import com.umitunal.tempo.MutableClock;
import com.umitunal.tempo.config.SchedulerConfig;
import com.umitunal.tempo.config.StorageConfig;
import com.umitunal.tempo.core.JobState;
import com.umitunal.tempo.model.JobRecord;
import com.umitunal.tempo.serialization.StringCodec;
import com.umitunal.tempo.storage.NewJob;
import com.umitunal.tempo.storage.RocksJobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class JobWorkerTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private RocksJobStore store;
    private JobHandlerRegistry registry;
    private JobDispatcher dispatcher;
    private SchedulerConfig config;
    private List<String> terminal;
    private JobWorker worker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T12:00:00Z");
        store = new RocksJobStore(StorageConfig.newBuilder(tempDir.toString()).build(), clock);
        registry = new JobHandlerRegistry();
        config = SchedulerConfig.newBuilder()
                .withServerName("test")
                .withWorkerCount(1)
                .withWorkerPollInterval(Duration.ofMillis(20))
                .withLeaseDuration(Duration.ofSeconds(5))
                .withHeartbeatInterval(Duration.ofMillis(50))
                .withRetryBaseDelay(Duration.ofSeconds(10))
                .build();
        dispatcher = new JobDispatcher(store, registry, config.getLeaseDuration(), config.getHeartbeatInterval());
        terminal = new CopyOnWriteArrayList<>();
        worker = JobWorker.builder("test:1", store, dispatcher)
                .withConfig(config)
                .withCompletionListener(terminal::add)
                .withClock(clock)
                .build();
    }

    @AfterEach
    void tearDown() {
        worker.stop();
        worker.awaitStop(Duration.ofSeconds(2));
        dispatcher.close();
        store.close();
    }

    private String create(String handler, String args, int maxAttempts) {
        return create(handler, args, maxAttempts, Duration.ofMinutes(1));
    }

    private String create(String handler, String args, int maxAttempts, Duration timeout) {
        return store.create(NewJob.builder(registry.payloadFor(handler, args))
                .maxAttempts(maxAttempts)
                .timeout(timeout)
                .build());
    }

    private JobRecord get(String jobId) {
        return store.find(jobId).orElseThrow();
    }

    @Test
    @DisplayName("Should run an enqueued job to success")
    void testSuccess() {
        // Given
        List<String> seen = new CopyOnWriteArrayList<>();
        registry.register("echo", new StringCodec(), (args, ctx) -> seen.add(args + "@" + ctx.getAttempt()));
        String jobId = create("echo", "hello", 3);

        // When
        boolean processed = worker.processOne();

        // Then
        assertThat(processed).isTrue();
        assertThat(seen).containsExactly("hello@1");
        JobRecord job = get(jobId);
        assertThat(job.getState()).isEqualTo(JobState.SUCCEEDED);
        assertThat(job.getLeaseOwner()).isNull();
        assertThat(worker.getSucceededCount()).isEqualTo(1);
        assertThat(terminal).containsExactly(jobId);
    }

    @Test
    @DisplayName("Should return false when nothing is enqueued")
    void testIdle() {
        assertThat(worker.processOne()).isFalse();
    }

    @Test
    @DisplayName("Should reschedule a failed job with backoff while attempts remain")
    void testRetryWithBackoff() {
        // Given
        registry.register("flaky", new StringCodec(), (args, ctx) -> {
            throw new IllegalStateException("boom");
        });
        String jobId = create("flaky", "x", 3);

        // When
        worker.processOne();

        // Then
        JobRecord job = get(jobId);
        assertThat(job.getState()).isEqualTo(JobState.SCHEDULED);
        assertThat(job.getAttempts()).isEqualTo(1);
        assertThat(job.getLastError()).isEqualTo("java.lang.IllegalStateException: boom");
        assertThat(job.getScheduledFor())
                .isEqualTo(clock.instant().plus(config.retryDelay(1)).toEpochMilli());
        assertThat(worker.getFailedCount()).isEqualTo(1);
        assertThat(terminal).isEmpty();
    }

    @Test
    @DisplayName("Should fail permanently when the retry budget is spent")
    void testPermanentFailure() {
        // Given
        registry.register("broken", new StringCodec(), (args, ctx) -> {
            throw new IllegalArgumentException("bad input");
        });
        String jobId = create("broken", "x", 1);

        // When
        worker.processOne();

        // Then
        JobRecord job = get(jobId);
        assertThat(job.getState()).isEqualTo(JobState.FAILED);
        assertThat(job.getAttempts()).isEqualTo(1);
        assertThat(job.getLastError()).contains("bad input");
        assertThat(terminal).containsExactly(jobId);
    }

    @Test
    @DisplayName("Should fail a job that exceeds its timeout")
    void testTimeout() {
        // Given
        registry.register("slow", new StringCodec(), (args, ctx) -> Thread.sleep(10_000));
        String jobId = create("slow", "x", 1, Duration.ofMillis(200));

        // When
        long started = System.nanoTime();
        worker.processOne();

        // Then
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isLessThan(5_000);
        JobRecord job = get(jobId);
        assertThat(job.getState()).isEqualTo(JobState.FAILED);
        assertThat(job.getLastError()).startsWith("Timed out after");
    }

    @Test
    @DisplayName("Should keep dispatching while a timed-out job ignores interruption")
    void testTimedOutBodyDoesNotBlockDispatch() {
        // Given
        CountDownLatch release = new CountDownLatch(1);
        registry.register("stubborn", new StringCodec(), (args, ctx) -> {
            while (release.getCount() > 0) {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    // deliberately keeps running after cancellation
                }
            }
        });
        List<String> seen = new CopyOnWriteArrayList<>();
        registry.register("quick", new StringCodec(), (args, ctx) -> seen.add(args));

        try {
            String stuck = create("stubborn", "x", 1, Duration.ofMillis(100));
            worker.processOne();
            assertThat(get(stuck).getState()).isEqualTo(JobState.FAILED);
            assertThat(get(stuck).getLastError()).startsWith("Timed out after");

            // When
            String next = create("quick", "after", 1, Duration.ofSeconds(2));
            worker.processOne();

            // Then
            assertThat(get(next).getState()).isEqualTo(JobState.SUCCEEDED);
            assertThat(seen).containsExactly("after");
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("Should fail a job whose handler is not registered")
    void testUnknownHandler() {
        // Given
        registry.register("temporary", new StringCodec(), (args, ctx) -> { });
        String jobId = create("temporary", "x", 1);
        registry = new JobHandlerRegistry();
        dispatcher.close();
        dispatcher = new JobDispatcher(store, registry, config.getLeaseDuration(), config.getHeartbeatInterval());
        worker = JobWorker.builder("test:2", store, dispatcher).withConfig(config).withClock(clock).build();

        // When
        worker.processOne();

        // Then
        JobRecord job = get(jobId);
        assertThat(job.getState()).isEqualTo(JobState.FAILED);
        assertThat(job.getLastError()).contains("No handler registered for 'temporary'");
    }

    @Test
    @DisplayName("Should cancel a running job once it is deleted")
    void testDeletionCancelsRunningJob() throws Exception {
        // Given
        CountDownLatch started = new CountDownLatch(1);
        AtomicInteger iterations = new AtomicInteger();
        registry.register("long", new StringCodec(), (args, ctx) -> {
            started.countDown();
            while (true) {
                ctx.throwIfCancellationRequested();
                iterations.incrementAndGet();
                Thread.sleep(10);
            }
        });
        String jobId = create("long", "x", 3);
        worker.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        // When
        assertThat(store.transition(jobId, JobState.PROCESSING, JobState.DELETED)).isTrue();

        // Then
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            assertThat(worker.getSucceededCount()).isZero();
            int before = iterations.get();
            Thread.sleep(100);
            assertThat(iterations.get()).isEqualTo(before);
        });
        assertThat(get(jobId).getState()).isEqualTo(JobState.DELETED);
        assertThat(worker.getFailedCount()).isZero();
    }

    @Test
    @DisplayName("Should let only one of two workers run a job")
    void testCompetingWorkers() {
        // Given
        AtomicInteger runs = new AtomicInteger();
        registry.register("once", new StringCodec(), (args, ctx) -> runs.incrementAndGet());
        for (int i = 0; i < 20; i++) {
            create("once", "n" + i, 1);
        }
        JobWorker other = JobWorker.builder("test:2", store, dispatcher).withConfig(config).withClock(clock).build();

        // When
        worker.start();
        other.start();

        // Then
        try {
            await().atMost(Duration.ofSeconds(10))
                    .until(() -> store.getMetrics().getSucceededJobs() == 20);
            assertThat(runs.get()).isEqualTo(20);
            assertThat(worker.getSucceededCount() + other.getSucceededCount()).isEqualTo(20);
        } finally {
            other.stop();
            other.awaitStop(Duration.ofSeconds(2));
        }
    }

    @Test
    @DisplayName("Should stop the loop on request")
    void testStartStop() {
        worker.start();
        await().atMost(Duration.ofSeconds(2)).until(worker::isRunning);

        worker.stop();

        assertThat(worker.awaitStop(Duration.ofSeconds(2))).isTrue();
        assertThat(worker.isRunning()).isFalse();
    }
}
