package com.umitunal.tempo.serialization;

/**
 * Encodes and decodes the arguments a job handler is invoked with.
 *
 * @param <A> the argument type
 */
public interface ArgumentCodec<A> {

    /**
     * Encode arguments to bytes.
     */
    byte[] encode(A arguments);

    /**
     * Decode bytes to arguments.
     */
    A decode(byte[] bytes);

    /**
     * The argument type accepted by {@link #encode(Object)}.
     */
    Class<A> type();
}
