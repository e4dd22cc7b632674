package com.umitunal.tempo.storage;

import java.time.Instant;

/**
 * Side effects applied together with a state transition, in the same
 * transaction. Leaving {@code PROCESSING} always drops the lease.
 */
public final class StateChange {
    private static final StateChange NONE = new StateChange(null, null);

    private final String error;
    private final Instant scheduledFor;

    private StateChange(String error, Instant scheduledFor) {
        this.error = error;
        this.scheduledFor = scheduledFor;
    }

    public static StateChange none() {
        return NONE;
    }

    public static StateChange withError(String error) {
        return new StateChange(error, null);
    }

    public static StateChange rescheduleAt(Instant scheduledFor) {
        return new StateChange(null, scheduledFor);
    }

    public StateChange andError(String error) {
        return new StateChange(error, scheduledFor);
    }

    public String getError() { return error; }
    public Instant getScheduledFor() { return scheduledFor; }
}
