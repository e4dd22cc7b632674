package com.umitunal.tempo.serialization;

import java.nio.charset.StandardCharsets;

/**
 * Codec for String arguments using UTF-8. A null argument is stored as an
 * empty payload and decodes to the empty string.
 */
public class StringCodec implements ArgumentCodec<String> {

    @Override
    public byte[] encode(String arguments) {
        return arguments == null ? new byte[0] : arguments.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String decode(byte[] bytes) {
        return bytes == null ? "" : new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public Class<String> type() {
        return String.class;
    }
}
