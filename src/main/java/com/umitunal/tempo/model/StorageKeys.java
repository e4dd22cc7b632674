package com.umitunal.tempo.model;

import com.umitunal.tempo.core.JobState;

import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Key layouts of the store's column families.
 *
 * Index keys sort by state, then time, then job id, so a prefix scan over one
 * state yields jobs in due order.
 */
public final class StorageKeys {
    private static final byte SEPARATOR = 0x00;

    private StorageKeys() {
    }

    public static byte[] jobKey(String jobId) {
        return jobId.getBytes(UTF_8);
    }

    public static byte[] recurringKey(String recurringId) {
        return recurringId.getBytes(UTF_8);
    }

    /**
     * Format: [state ordinal(1 byte)][time(8 bytes)][jobId bytes]
     */
    public static byte[] indexKey(JobState state, long time, String jobId) {
        byte[] idBytes = jobId.getBytes(UTF_8);
        ByteBuffer buffer = ByteBuffer.allocate(1 + 8 + idBytes.length);
        buffer.put((byte) state.ordinal());
        buffer.putLong(Math.max(0L, time));
        buffer.put(idBytes);
        return buffer.array();
    }

    public static byte[] indexPrefix(JobState state) {
        return new byte[]{(byte) state.ordinal()};
    }

    public static long indexTime(byte[] indexKey) {
        return ByteBuffer.wrap(indexKey, 1, 8).getLong();
    }

    public static String indexJobId(byte[] indexKey) {
        return new String(indexKey, 9, indexKey.length - 9, UTF_8);
    }

    public static boolean hasPrefix(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Format: [antecedentId bytes][0x00][dependentId bytes]
     */
    public static byte[] continuationKey(String antecedentId, String dependentId) {
        byte[] antecedent = antecedentId.getBytes(UTF_8);
        byte[] dependent = dependentId.getBytes(UTF_8);
        ByteBuffer buffer = ByteBuffer.allocate(antecedent.length + 1 + dependent.length);
        buffer.put(antecedent);
        buffer.put(SEPARATOR);
        buffer.put(dependent);
        return buffer.array();
    }

    public static byte[] continuationPrefix(String antecedentId) {
        byte[] antecedent = antecedentId.getBytes(UTF_8);
        ByteBuffer buffer = ByteBuffer.allocate(antecedent.length + 1);
        buffer.put(antecedent);
        buffer.put(SEPARATOR);
        return buffer.array();
    }
}
