package com.umitunal.tempo.monitoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.tempo.MutableClock;
import com.umitunal.tempo.config.StorageConfig;
import com.umitunal.tempo.core.JobState;
import com.umitunal.tempo.engine.JobScheduler;
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

import static org.assertj.core.api.Assertions.*;

class DashboardServiceTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private RocksJobStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-09-01T08:00:00Z");
        store = new RocksJobStore(StorageConfig.newBuilder(tempDir.toString()).build(), clock);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private JobScheduler scheduler(ControlAuthorizer authorizer) {
        JobScheduler scheduler = JobScheduler.builder(store)
                .withClock(clock)
                .withControlAuthorizer(authorizer)
                .build();
        scheduler.registerHandler("mail", new StringCodec(), (args, ctx) -> { });
        return scheduler;
    }

    private String failPermanently(JobScheduler scheduler, String args, String error) {
        String jobId = scheduler.enqueue("mail", args);
        for (int attempt = 1; attempt <= 3; attempt++) {
            assertThat(store.tryAcquireLease(jobId, "w1", Duration.ofSeconds(30))).isTrue();
            store.transition(jobId, JobState.ENQUEUED, JobState.PROCESSING);
            store.transition(jobId, JobState.PROCESSING, JobState.FAILED, StateChange.withError(error));
            clock.advance(Duration.ofSeconds(1));
            if (attempt < 3) {
                store.transition(jobId, JobState.FAILED, JobState.SCHEDULED, StateChange.rescheduleAt(clock.instant()));
                store.transition(jobId, JobState.SCHEDULED, JobState.ENQUEUED);
            }
        }
        return jobId;
    }

    @Test
    @DisplayName("Should count jobs in every state")
    void testSnapshotCounts() {
        // Given
        JobScheduler scheduler = scheduler(ControlAuthorizer.denyAll());
        String first = scheduler.enqueue("mail", "a");
        scheduler.enqueue("mail", "b");
        scheduler.schedule("mail", "c", Duration.ofHours(1));
        scheduler.continueWith(first, "mail", "d");

        // When
        DashboardSnapshot snapshot = scheduler.monitoring().snapshot();

        // Then
        assertThat(snapshot.getGeneratedAt()).isEqualTo(clock.instant());
        assertThat(snapshot.count(JobState.ENQUEUED)).isEqualTo(2);
        assertThat(snapshot.count(JobState.SCHEDULED)).isEqualTo(1);
        assertThat(snapshot.count(JobState.AWAITING_CONTINUATION)).isEqualTo(1);
        assertThat(snapshot.count(JobState.SUCCEEDED)).isZero();
        assertThat(snapshot.getCountsByState()).containsOnlyKeys(JobState.values());
        assertThat(snapshot.getPendingContinuations()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should list permanent failures most recent first")
    void testRecentFailures() {
        // Given
        JobScheduler scheduler = scheduler(ControlAuthorizer.denyAll());
        String older = failPermanently(scheduler, "x", "smtp down");
        String newer = failPermanently(scheduler, "y", "mailbox full");

        // When
        List<DashboardSnapshot.FailedJobView> failures = scheduler.monitoring().recentFailures(10);

        // Then
        assertThat(failures).extracting(DashboardSnapshot.FailedJobView::getJobId).containsExactly(newer, older);
        DashboardSnapshot.FailedJobView latest = failures.get(0);
        assertThat(latest.getHandler()).isEqualTo("mail");
        assertThat(latest.getError()).isEqualTo("mailbox full");
        assertThat(latest.getAttempts()).isEqualTo(3);
        assertThat(scheduler.monitoring().recentFailures(1)).hasSize(1);
    }

    @Test
    @DisplayName("Should describe recurring jobs")
    void testRecurringJobs() {
        JobScheduler scheduler = scheduler(ControlAuthorizer.denyAll());
        scheduler.addOrUpdateRecurring("digest", "mail", "team", "0 9 * * 1");

        List<DashboardSnapshot.RecurringJobView> views = scheduler.monitoring().recurringJobs();

        assertThat(views).hasSize(1);
        DashboardSnapshot.RecurringJobView view = views.get(0);
        assertThat(view.getId()).isEqualTo("digest");
        assertThat(view.getCronExpression()).isEqualTo("0 9 * * 1");
        assertThat(view.getHandler()).isEqualTo("mail");
        assertThat(view.getNextFireAt()).isEqualTo("2024-09-02T09:00:00Z");
        assertThat(view.getLastFireAt()).isNull();
    }

    @Test
    @DisplayName("Should deny control actions by default")
    void testDeniedControl() {
        // Given
        JobScheduler scheduler = scheduler(ControlAuthorizer.denyAll());
        scheduler.addOrUpdateRecurring("digest", "mail", "team", "0 9 * * 1");
        String jobId = scheduler.enqueue("mail", "z");

        // When / Then
        assertThatThrownBy(() -> scheduler.monitoring().triggerRecurring("mallory", "digest"))
                .isInstanceOf(UnauthorizedControlException.class)
                .hasMessageContaining("mallory");
        assertThatThrownBy(() -> scheduler.monitoring().deleteJob("mallory", jobId))
                .isInstanceOf(UnauthorizedControlException.class);
        assertThat(scheduler.getJobStatus(jobId).getState()).isEqualTo(JobState.ENQUEUED);
        assertThat(store.getMetrics().getEnqueuedJobs()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should run control actions the authorizer allows")
    void testAllowedControl() {
        // Given
        ControlAuthorizer onlyAdmin = (caller, action, target) -> "admin".equals(caller);
        JobScheduler scheduler = scheduler(onlyAdmin);
        scheduler.addOrUpdateRecurring("digest", "mail", "team", "0 9 * * 1");
        String jobId = scheduler.enqueue("mail", "z");

        // When
        Optional<String> triggered = scheduler.monitoring().triggerRecurring("admin", "digest");
        boolean deleted = scheduler.monitoring().deleteJob("admin", jobId);

        // Then
        assertThat(triggered).isPresent();
        assertThat(scheduler.getJobStatus(triggered.get()).getState()).isEqualTo(JobState.ENQUEUED);
        assertThat(deleted).isTrue();
        assertThat(scheduler.getJobStatus(jobId).getState()).isEqualTo(JobState.DELETED);
        assertThatThrownBy(() -> scheduler.monitoring().deleteJob("guest", triggered.get()))
                .isInstanceOf(UnauthorizedControlException.class);
    }

    @Test
    @DisplayName("Should render the snapshot as JSON")
    void testJson() throws Exception {
        // Given
        JobScheduler scheduler = scheduler(ControlAuthorizer.denyAll());
        scheduler.enqueue("mail", "a");
        scheduler.addOrUpdateRecurring("digest", "mail", "team", "0 9 * * 1");

        // When
        JsonNode json = new ObjectMapper().readTree(scheduler.monitoring().snapshot().toJson());

        // Then
        assertThat(json.get("generatedAt").asText()).isEqualTo("2024-09-01T08:00:00Z");
        assertThat(json.get("countsByState").get("ENQUEUED").asLong()).isEqualTo(1);
        assertThat(json.get("countsByState").get("FAILED").asLong()).isZero();
        assertThat(json.get("recurringJobs").get(0).get("id").asText()).isEqualTo("digest");
        assertThat(json.get("recentFailures").isArray()).isTrue();
    }
}
