package com.umitunal.tempo.model;

import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Length-prefixed field helpers shared by the record serializers.
 * A length of -1 marks a null string.
 */
final class BinaryRecords {

    private BinaryRecords() {
    }

    static byte[] utf8(String value) {
        return value == null ? null : value.getBytes(UTF_8);
    }

    static int sizeOf(byte[] field) {
        return 4 + (field == null ? 0 : field.length);
    }

    static void put(ByteBuffer buffer, byte[] field) {
        if (field == null) {
            buffer.putInt(-1);
            return;
        }
        buffer.putInt(field.length);
        buffer.put(field);
    }

    static byte[] getBytes(ByteBuffer buffer) {
        int length = buffer.getInt();
        if (length < 0) {
            return null;
        }
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return bytes;
    }

    static String getString(ByteBuffer buffer) {
        byte[] bytes = getBytes(buffer);
        return bytes == null ? null : new String(bytes, UTF_8);
    }
}
