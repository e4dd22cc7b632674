package com.umitunal.tempo.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Serializable invocation descriptor: the tag of a registered handler and the
 * encoded arguments it is invoked with.
 */
public final class JobPayload {
    private final String handler;
    private final byte[] arguments;

    public JobPayload(String handler, byte[] arguments) {
        if (handler == null || handler.isBlank()) {
            throw new IllegalArgumentException("handler must not be empty");
        }
        this.handler = handler;
        this.arguments = arguments == null ? new byte[0] : arguments.clone();
    }

    public static JobPayload of(String handler) {
        return new JobPayload(handler, null);
    }

    public String getHandler() {
        return handler;
    }

    public byte[] getArguments() {
        return arguments.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobPayload)) return false;
        JobPayload that = (JobPayload) o;
        return handler.equals(that.handler) && Arrays.equals(arguments, that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(handler) * 31 + Arrays.hashCode(arguments);
    }

    @Override
    public String toString() {
        return "JobPayload{handler='" + handler + "', arguments=" + arguments.length + " bytes}";
    }
}
