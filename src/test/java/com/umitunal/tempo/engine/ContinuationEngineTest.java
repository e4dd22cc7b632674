package com.umitunal.tempo.engine;

import com.umitunal.tempo.MutableClock;
import com.umitunal.tempo.config.StorageConfig;
import com.umitunal.tempo.core.ContinuationTrigger;
import com.umitunal.tempo.core.JobPayload;
import com.umitunal.tempo.core.JobState;
import com.umitunal.tempo.model.JobRecord;
import com.umitunal.tempo.storage.NewJob;
import com.umitunal.tempo.storage.RocksJobStore;
import com.umitunal.tempo.storage.StateChange;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class ContinuationEngineTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private RocksJobStore store;
    private ContinuationEngine engine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-02-10T09:00:00Z");
        store = new RocksJobStore(StorageConfig.newBuilder(tempDir.toString()).build(), clock);
        engine = new ContinuationEngine(store);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private String enqueue(String handler, int maxAttempts) {
        return store.create(NewJob.builder(JobPayload.of(handler)).maxAttempts(maxAttempts).build());
    }

    private String continuation(String parentId, String handler, ContinuationTrigger trigger) {
        return store.create(NewJob.builder(JobPayload.of(handler)).continuationOf(parentId, trigger).build());
    }

    private void finish(String jobId, JobState outcome) {
        assertThat(store.tryAcquireLease(jobId, "w1", Duration.ofSeconds(30))).isTrue();
        assertThat(store.transition(jobId, JobState.ENQUEUED, JobState.PROCESSING)).isTrue();
        assertThat(store.transition(jobId, JobState.PROCESSING, outcome, StateChange.withError(
                outcome == JobState.FAILED ? "boom" : null))).isTrue();
    }

    private JobRecord get(String jobId) {
        return store.find(jobId).orElseThrow();
    }

    @Test
    @DisplayName("Should schedule a continuation once its antecedent succeeds")
    void testReleaseOnSuccess() {
        // Given
        String parent = enqueue("extract", 3);
        String child = continuation(parent, "transform", ContinuationTrigger.ON_SUCCESS);
        assertThat(get(child).getState()).isEqualTo(JobState.AWAITING_CONTINUATION);

        // When
        clock.advance(Duration.ofMinutes(1));
        finish(parent, JobState.SUCCEEDED);
        int resolved = engine.resolve(parent);

        // Then
        assertThat(resolved).isEqualTo(1);
        JobRecord released = get(child);
        assertThat(released.getState()).isEqualTo(JobState.SCHEDULED);
        assertThat(released.getScheduledFor()).isEqualTo(clock.millis());
        assertThat(store.continuationsOf(parent)).isEmpty();
    }

    @Test
    @DisplayName("Should resolve each link only once")
    void testIdempotent() {
        String parent = enqueue("extract", 3);
        continuation(parent, "transform", ContinuationTrigger.ON_SUCCESS);
        finish(parent, JobState.SUCCEEDED);

        assertThat(engine.resolve(parent)).isEqualTo(1);
        assertThat(engine.resolve(parent)).isZero();
    }

    @Test
    @DisplayName("Should leave continuations alone while the antecedent can still retry")
    void testNotTerminalYet() {
        // Given
        String parent = enqueue("extract", 3);
        String child = continuation(parent, "transform", ContinuationTrigger.ON_ANY_TERMINAL);
        finish(parent, JobState.FAILED);

        // When
        int resolved = engine.resolve(parent);

        // Then
        assertThat(resolved).isZero();
        assertThat(get(child).getState()).isEqualTo(JobState.AWAITING_CONTINUATION);
        assertThat(store.continuationsOf(parent)).hasSize(1);
    }

    @Test
    @DisplayName("Should cascade deletion through continuations that cannot fire")
    void testCascadeOnPermanentFailure() {
        // Given: parent -> child (on success) -> {grandchild (on success), cleanup (any terminal)}
        String parent = enqueue("extract", 1);
        String child = continuation(parent, "transform", ContinuationTrigger.ON_SUCCESS);
        String grandchild = continuation(child, "load", ContinuationTrigger.ON_SUCCESS);
        String cleanup = continuation(child, "cleanup", ContinuationTrigger.ON_ANY_TERMINAL);

        // When
        finish(parent, JobState.FAILED);
        int resolved = engine.resolve(parent);

        // Then
        assertThat(resolved).isEqualTo(3);
        assertThat(get(child).getState()).isEqualTo(JobState.DELETED);
        assertThat(get(child).getLastError())
                .isEqualTo("Antecedent " + parent + " finished as FAILED, continuation requires ON_SUCCESS");
        assertThat(get(grandchild).getState()).isEqualTo(JobState.DELETED);
        assertThat(get(grandchild).getLastError()).contains("finished as DELETED");
        assertThat(get(cleanup).getState()).isEqualTo(JobState.SCHEDULED);
    }

    @Test
    @DisplayName("Should release any-terminal continuations of a deleted job")
    void testOnAnyTerminalAfterDelete() {
        // Given
        String parent = enqueue("extract", 3);
        String audit = continuation(parent, "audit", ContinuationTrigger.ON_ANY_TERMINAL);
        String next = continuation(parent, "next", ContinuationTrigger.ON_SUCCESS);

        // When
        assertThat(store.transition(parent, JobState.ENQUEUED, JobState.DELETED)).isTrue();
        engine.onTerminal(parent);

        // Then
        assertThat(get(audit).getState()).isEqualTo(JobState.SCHEDULED);
        assertThat(get(next).getState()).isEqualTo(JobState.DELETED);
    }
}
