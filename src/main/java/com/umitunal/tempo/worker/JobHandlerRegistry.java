package com.umitunal.tempo.worker;

import com.umitunal.tempo.core.HandlerNotFoundException;
import com.umitunal.tempo.core.JobPayload;
import com.umitunal.tempo.serialization.ArgumentCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps handler tags to handlers and the codecs of their arguments.
 *
 * A {@link JobPayload} only names a tag, so the producer and the worker only
 * need to agree on tags and codecs. Resolution never uses reflection.
 */
public class JobHandlerRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobHandlerRegistry.class);

    private final Map<String, Registration<?>> registrations = new ConcurrentHashMap<>();

    /**
     * Registers or replaces the handler for {@code tag}.
     */
    public <A> JobHandlerRegistry register(String tag, ArgumentCodec<A> codec, JobHandler<A> handler) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("handler tag must not be empty");
        }
        if (codec == null || handler == null) {
            throw new IllegalArgumentException("codec and handler are required for '" + tag + "'");
        }
        Registration<?> previous = registrations.put(tag, new Registration<>(codec, handler));
        if (previous != null) {
            log.info("Replaced handler for '{}'", tag);
        }
        return this;
    }

    public boolean isRegistered(String tag) {
        return registrations.containsKey(tag);
    }

    public Set<String> tags() {
        return new TreeSet<>(registrations.keySet());
    }

    /**
     * Encodes {@code arguments} with the codec registered for {@code tag}.
     *
     * @throws HandlerNotFoundException if nothing is registered under the tag
     * @throws IllegalArgumentException if the arguments do not match the codec type
     */
    public JobPayload payloadFor(String tag, Object arguments) {
        Registration<?> registration = lookup(tag);
        return new JobPayload(tag, registration.encode(tag, arguments));
    }

    /**
     * Decodes the payload arguments and runs the registered handler.
     *
     * @throws HandlerNotFoundException if the payload names an unknown tag
     */
    public void execute(JobPayload payload, JobContext context) throws Exception {
        lookup(payload.getHandler()).invoke(payload.getArguments(), context);
    }

    private Registration<?> lookup(String tag) {
        Registration<?> registration = registrations.get(tag);
        if (registration == null) {
            throw new HandlerNotFoundException(tag);
        }
        return registration;
    }

    private static final class Registration<A> {
        private final ArgumentCodec<A> codec;
        private final JobHandler<A> handler;

        Registration(ArgumentCodec<A> codec, JobHandler<A> handler) {
            this.codec = codec;
            this.handler = handler;
        }

        byte[] encode(String tag, Object arguments) {
            if (arguments != null && !codec.type().isInstance(arguments)) {
                throw new IllegalArgumentException("Handler '" + tag + "' expects "
                        + codec.type().getSimpleName() + ", got " + arguments.getClass().getSimpleName());
            }
            return codec.encode(codec.type().cast(arguments));
        }

        void invoke(byte[] arguments, JobContext context) throws Exception {
            handler.execute(codec.decode(arguments), context);
        }
    }
}
