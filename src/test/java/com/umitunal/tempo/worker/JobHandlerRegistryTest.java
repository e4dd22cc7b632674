package com.umitunal.tempo.worker;

import com.umitunal.tempo.core.HandlerNotFoundException;
import com.umitunal.tempo.core.JobPayload;
import com.umitunal.tempo.serialization.NoArgumentsCodec;
import com.umitunal.tempo.serialization.StringCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class JobHandlerRegistryTest {

    private JobHandlerRegistry registry;
    private List<String> received;

    @BeforeEach
    void setUp() {
        registry = new JobHandlerRegistry();
        received = new ArrayList<>();
    }

    @Test
    @DisplayName("Should encode arguments and run the handler by tag")
    void testRoundTripThroughHandler() throws Exception {
        // Given
        registry.register("greet", new StringCodec(), (name, ctx) -> received.add("hello " + name));

        // When
        JobPayload payload = registry.payloadFor("greet", "ada");
        registry.execute(payload, new JobContext("job-1", "greet", 1));

        // Then
        assertThat(payload.getHandler()).isEqualTo("greet");
        assertThat(new String(payload.getArguments(), UTF_8)).isEqualTo("ada");
        assertThat(received).containsExactly("hello ada");
    }

    @Test
    @DisplayName("Should hand the execution context to the handler")
    void testContextPassed() throws Exception {
        registry.register("noop", new NoArgumentsCodec(),
                (args, ctx) -> received.add(ctx.getJobId() + "#" + ctx.getAttempt()));

        registry.execute(registry.payloadFor("noop", null), new JobContext("job-7", "noop", 2));

        assertThat(received).containsExactly("job-7#2");
    }

    @Test
    @DisplayName("Should reject unknown tags")
    void testUnknownTag() {
        assertThatThrownBy(() -> registry.payloadFor("missing", "x"))
                .isInstanceOf(HandlerNotFoundException.class)
                .hasMessageContaining("missing");

        JobPayload payload = new JobPayload("missing", new byte[0]);
        assertThatThrownBy(() -> registry.execute(payload, new JobContext("j", "missing", 1)))
                .isInstanceOf(HandlerNotFoundException.class);
    }

    @Test
    @DisplayName("Should reject arguments of the wrong type")
    void testWrongArgumentType() {
        registry.register("greet", new StringCodec(), (name, ctx) -> { });

        assertThatThrownBy(() -> registry.payloadFor("greet", 42))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("String")
                .hasMessageContaining("Integer");
    }

    @Test
    @DisplayName("Should replace a handler registered under the same tag")
    void testReplace() throws Exception {
        registry.register("greet", new StringCodec(), (name, ctx) -> received.add("old"));
        registry.register("greet", new StringCodec(), (name, ctx) -> received.add("new"));

        registry.execute(registry.payloadFor("greet", "x"), new JobContext("j", "greet", 1));

        assertThat(received).containsExactly("new");
        assertThat(registry.tags()).containsExactly("greet");
    }

    @Test
    @DisplayName("Should validate registrations")
    void testInvalidRegistration() {
        assertThatThrownBy(() -> registry.register(" ", new StringCodec(), (a, c) -> { }))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register("x", new StringCodec(), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.isRegistered("x")).isFalse();
    }

    @Test
    @DisplayName("Should propagate handler exceptions")
    void testHandlerException() {
        registry.register("explode", new StringCodec(), (args, ctx) -> {
            throw new IllegalStateException("kaboom " + args);
        });

        assertThatThrownBy(() -> registry.execute(registry.payloadFor("explode", "now"),
                new JobContext("j", "explode", 1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("kaboom now");
    }
}
