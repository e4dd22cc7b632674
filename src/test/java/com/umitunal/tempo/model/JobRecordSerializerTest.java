package com.umitunal.tempo.model;

import com.umitunal.tempo.core.JobPayload;
import com.umitunal.tempo.core.JobState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class JobRecordSerializerTest {

    @Test
    @DisplayName("Should preserve every field of a leased continuation job")
    void testFullRecord() {
        // Given
        JobRecord job = new JobRecord("job-1", new JobPayload("email", "to@example.com".getBytes(UTF_8)),
                1_000L, 2_000L, 5, 60_000L);
        job.linkParent("parent-1");
        job.linkRecurring("nightly");
        job.moveTo(JobState.ENQUEUED, 2_000L);
        job.lease("worker-1", 9_000L, 3_000L);
        job.moveTo(JobState.PROCESSING, 3_000L);
        job.recordError("boom", 3_500L);

        // When
        JobRecord decoded = JobRecordSerializer.deserialize(JobRecordSerializer.serialize(job));

        // Then
        assertThat(decoded.getId()).isEqualTo("job-1");
        assertThat(decoded.getPayload()).isEqualTo(job.getPayload());
        assertThat(decoded.getState()).isEqualTo(JobState.PROCESSING);
        assertThat(decoded.getCreatedAt()).isEqualTo(1_000L);
        assertThat(decoded.getScheduledFor()).isEqualTo(2_000L);
        assertThat(decoded.getAttempts()).isEqualTo(1);
        assertThat(decoded.getMaxAttempts()).isEqualTo(5);
        assertThat(decoded.getTimeoutMillis()).isEqualTo(60_000L);
        assertThat(decoded.getLastError()).isEqualTo("boom");
        assertThat(decoded.getParentId()).isEqualTo("parent-1");
        assertThat(decoded.getRecurringId()).isEqualTo("nightly");
        assertThat(decoded.getLeaseOwner()).isEqualTo("worker-1");
        assertThat(decoded.getLeaseExpiry()).isEqualTo(9_000L);
        assertThat(decoded.getLastModified()).isEqualTo(3_500L);
        assertThat(decoded.getVersion()).isEqualTo(job.getVersion());
    }

    @Test
    @DisplayName("Should keep absent optional fields null")
    void testNullFields() {
        // Given
        JobRecord job = new JobRecord("job-2", JobPayload.of("noop"), 1L, 1L, 1, 1_000L);

        // When
        JobRecord decoded = JobRecordSerializer.deserialize(JobRecordSerializer.serialize(job));

        // Then
        assertThat(decoded.getState()).isEqualTo(JobState.CREATED);
        assertThat(decoded.getLastError()).isNull();
        assertThat(decoded.getParentId()).isNull();
        assertThat(decoded.getRecurringId()).isNull();
        assertThat(decoded.getLeaseOwner()).isNull();
        assertThat(decoded.getPayload().getArguments()).isEmpty();
    }

    @Test
    @DisplayName("Should reject unknown format versions")
    void testUnknownFormat() {
        // Given
        byte[] bytes = JobRecordSerializer.serialize(new JobRecord("job-3", JobPayload.of("noop"), 1L, 1L, 1, 1L));
        bytes[0] = 99;

        // When / Then
        assertThatThrownBy(() -> JobRecordSerializer.deserialize(bytes))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("99");
    }
}
