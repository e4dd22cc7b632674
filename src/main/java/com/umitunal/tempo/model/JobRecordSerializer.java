package com.umitunal.tempo.model;

import com.umitunal.tempo.core.JobPayload;
import com.umitunal.tempo.core.JobState;

import java.nio.ByteBuffer;

import static com.umitunal.tempo.model.BinaryRecords.*;

/**
 * Binary codec for {@link JobRecord} values stored in the jobs column family.
 *
 * Binary format (version 1):
 * - format version (1 byte)
 * - id, handler, arguments (length-prefixed)
 * - createdAt, scheduledFor (8 bytes each)
 * - maxAttempts, attempts (4 bytes each)
 * - timeoutMillis (8 bytes)
 * - state ordinal (4 bytes)
 * - lastError, parentId, recurringId, leaseOwner (length-prefixed, -1 = null)
 * - leaseExpiry, lastModified, version (8 bytes each)
 */
public final class JobRecordSerializer {
    static final byte FORMAT_VERSION = 1;

    private JobRecordSerializer() {
    }

    public static byte[] serialize(JobRecord job) {
        byte[] id = utf8(job.getId());
        byte[] handler = utf8(job.getPayload().getHandler());
        byte[] arguments = job.getPayload().getArguments();
        byte[] lastError = utf8(job.getLastError());
        byte[] parentId = utf8(job.getParentId());
        byte[] recurringId = utf8(job.getRecurringId());
        byte[] leaseOwner = utf8(job.getLeaseOwner());

        int totalSize = 1 +
                sizeOf(id) + sizeOf(handler) + sizeOf(arguments) +
                8 + 8 +          // createdAt, scheduledFor
                4 + 4 +          // maxAttempts, attempts
                8 +              // timeoutMillis
                4 +              // state ordinal
                sizeOf(lastError) + sizeOf(parentId) + sizeOf(recurringId) + sizeOf(leaseOwner) +
                8 + 8 + 8;       // leaseExpiry, lastModified, version

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        buffer.put(FORMAT_VERSION);
        put(buffer, id);
        put(buffer, handler);
        put(buffer, arguments);
        buffer.putLong(job.getCreatedAt());
        buffer.putLong(job.getScheduledFor());
        buffer.putInt(job.getMaxAttempts());
        buffer.putInt(job.getAttempts());
        buffer.putLong(job.getTimeoutMillis());
        buffer.putInt(job.getState().ordinal());
        put(buffer, lastError);
        put(buffer, parentId);
        put(buffer, recurringId);
        put(buffer, leaseOwner);
        buffer.putLong(job.getLeaseExpiry());
        buffer.putLong(job.getLastModified());
        buffer.putLong(job.getVersion());
        return buffer.array();
    }

    public static JobRecord deserialize(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        byte format = buffer.get();
        if (format != FORMAT_VERSION) {
            throw new IllegalStateException("Unsupported job record format: " + format);
        }

        String id = getString(buffer);
        String handler = getString(buffer);
        byte[] arguments = getBytes(buffer);
        long createdAt = buffer.getLong();
        long scheduledFor = buffer.getLong();
        int maxAttempts = buffer.getInt();
        int attempts = buffer.getInt();
        long timeoutMillis = buffer.getLong();

        JobRecord job = new JobRecord(id, new JobPayload(handler, arguments),
                createdAt, scheduledFor, maxAttempts, timeoutMillis);
        job.setAttempts(attempts);
        job.setState(JobState.fromOrdinal(buffer.getInt()));
        job.setLastError(getString(buffer));
        job.setParentId(getString(buffer));
        job.setRecurringId(getString(buffer));
        job.setLeaseOwner(getString(buffer));
        job.setLeaseExpiry(buffer.getLong());
        job.setLastModified(buffer.getLong());
        job.setVersion(buffer.getLong());
        return job;
    }
}
