package com.umitunal.tempo.model;

import com.umitunal.tempo.core.JobPayload;

import java.nio.ByteBuffer;

import static com.umitunal.tempo.model.BinaryRecords.*;

/**
 * Binary codec for {@link RecurringJobDefinition} values.
 *
 * Binary format (version 1):
 * - format version (1 byte)
 * - id, cron, handler, arguments (length-prefixed)
 * - maxAttempts (4 bytes), timeoutMillis (8 bytes)
 * - lastFireAt (-1 = never), nextFireAt, createdAt, updatedAt, version (8 bytes each)
 */
public final class RecurringJobSerializer {
    static final byte FORMAT_VERSION = 1;

    private RecurringJobSerializer() {
    }

    public static byte[] serialize(RecurringJobDefinition definition) {
        byte[] id = utf8(definition.getId());
        byte[] cron = utf8(definition.getCronExpression());
        byte[] handler = utf8(definition.getPayload().getHandler());
        byte[] arguments = definition.getPayload().getArguments();

        ByteBuffer buffer = ByteBuffer.allocate(1 +
                sizeOf(id) + sizeOf(cron) + sizeOf(handler) + sizeOf(arguments) +
                4 + 8 + 8 * 5);
        buffer.put(FORMAT_VERSION);
        put(buffer, id);
        put(buffer, cron);
        put(buffer, handler);
        put(buffer, arguments);
        buffer.putInt(definition.getMaxAttempts());
        buffer.putLong(definition.getTimeoutMillis());
        buffer.putLong(definition.rawLastFireAt());
        buffer.putLong(definition.getNextFireAt());
        buffer.putLong(definition.getCreatedAt());
        buffer.putLong(definition.getUpdatedAt());
        buffer.putLong(definition.getVersion());
        return buffer.array();
    }

    public static RecurringJobDefinition deserialize(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        byte format = buffer.get();
        if (format != FORMAT_VERSION) {
            throw new IllegalStateException("Unsupported recurring definition format: " + format);
        }
        String id = getString(buffer);
        String cron = getString(buffer);
        String handler = getString(buffer);
        byte[] arguments = getBytes(buffer);
        int maxAttempts = buffer.getInt();
        long timeoutMillis = buffer.getLong();
        long lastFireAt = buffer.getLong();
        long nextFireAt = buffer.getLong();
        long createdAt = buffer.getLong();

        RecurringJobDefinition definition = new RecurringJobDefinition(id, cron,
                new JobPayload(handler, arguments), maxAttempts, timeoutMillis, nextFireAt, createdAt);
        definition.setLastFireAt(lastFireAt);
        definition.setUpdatedAt(buffer.getLong());
        definition.setVersion(buffer.getLong());
        return definition;
    }
}
