package com.umitunal.tempo.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * JSON codec using Jackson. Arguments stay readable in the store, which makes
 * it the default choice for handler arguments that are plain data objects.
 *
 * @param <A> the argument type
 */
public class JsonCodec<A> implements ArgumentCodec<A> {
    private final ObjectMapper mapper;
    private final Class<A> type;

    public JsonCodec(Class<A> type) {
        this(type, createDefaultMapper());
    }

    public JsonCodec(Class<A> type, ObjectMapper mapper) {
        this.type = type;
        this.mapper = mapper;
    }

    @Override
    public byte[] encode(A arguments) {
        try {
            return mapper.writeValueAsBytes(arguments);
        } catch (IOException e) {
            throw new ArgumentCodecException("Failed to serialize " + type.getSimpleName() + " to JSON", e);
        }
    }

    @Override
    public A decode(byte[] bytes) {
        try {
            return mapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new ArgumentCodecException("Failed to deserialize " + type.getSimpleName() + " from JSON", e);
        }
    }

    @Override
    public Class<A> type() {
        return type;
    }

    public static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
