package com.umitunal.tempo.serialization;

/**
 * Codec for handlers that take no arguments.
 */
public class NoArgumentsCodec implements ArgumentCodec<Void> {
    private static final byte[] EMPTY = new byte[0];

    @Override
    public byte[] encode(Void arguments) {
        return EMPTY;
    }

    @Override
    public Void decode(byte[] bytes) {
        return null;
    }

    @Override
    public Class<Void> type() {
        return Void.class;
    }
}
