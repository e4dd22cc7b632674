package com.umitunal.tempo.monitoring;

/**
 * Decides whether a caller may run a control action from the dashboard.
 * Authentication happens outside the engine; {@code caller} is whatever
 * identity the surrounding application established.
 */
@FunctionalInterface
public interface ControlAuthorizer {

    enum Action {
        TRIGGER_RECURRING,
        DELETE_JOB
    }

    boolean isAllowed(String caller, Action action, String target);

    static ControlAuthorizer allowAll() {
        return (caller, action, target) -> true;
    }

    static ControlAuthorizer denyAll() {
        return (caller, action, target) -> false;
    }
}
