package com.umitunal.tempo.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

import java.io.ByteArrayOutputStream;

/**
 * Compact binary codec using Kryo, for large or hot argument objects.
 *
 * Kryo instances are not thread-safe; each thread gets its own.
 *
 * @param <A> the argument type
 */
public class KryoCodec<A> implements ArgumentCodec<A> {
    private final ThreadLocal<Kryo> kryoThreadLocal;
    private final Class<A> type;

    public KryoCodec(Class<A> type) {
        this(type, KryoCodec::defaultKryo);
    }

    /**
     * Create a Kryo codec with custom Kryo instance configuration, e.g. with
     * registration required for a closed set of argument classes.
     */
    public KryoCodec(Class<A> type, KryoFactory factory) {
        this.type = type;
        this.kryoThreadLocal = ThreadLocal.withInitial(factory::create);
    }

    @Override
    public byte[] encode(A arguments) {
        Kryo kryo = kryoThreadLocal.get();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();

        try (Output output = new Output(baos)) {
            kryo.writeObjectOrNull(output, arguments, type);
            output.flush();
            return baos.toByteArray();
        } catch (KryoException e) {
            throw new ArgumentCodecException("Failed to serialize " + type.getSimpleName() + " with Kryo", e);
        }
    }

    @Override
    public A decode(byte[] bytes) {
        Kryo kryo = kryoThreadLocal.get();

        try (Input input = new Input(bytes)) {
            return kryo.readObjectOrNull(input, type);
        } catch (KryoException e) {
            throw new ArgumentCodecException("Failed to deserialize " + type.getSimpleName() + " with Kryo", e);
        }
    }

    @Override
    public Class<A> type() {
        return type;
    }

    /**
     * Registration off, references on: accepts any argument graph.
     */
    public static Kryo defaultKryo() {
        Kryo kryo = new Kryo();
        kryo.setRegistrationRequired(false);
        kryo.setReferences(true);
        return kryo;
    }

    @FunctionalInterface
    public interface KryoFactory {
        Kryo create();
    }
}
