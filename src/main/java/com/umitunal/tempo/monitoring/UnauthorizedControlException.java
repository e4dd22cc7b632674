package com.umitunal.tempo.monitoring;

import com.umitunal.tempo.core.SchedulerException;

public class UnauthorizedControlException extends SchedulerException {
    private final String caller;
    private final ControlAuthorizer.Action action;

    public UnauthorizedControlException(String caller, ControlAuthorizer.Action action, String target) {
        super("Caller '" + caller + "' may not " + action + " on " + target);
        this.caller = caller;
        this.action = action;
    }

    public String getCaller() { return caller; }
    public ControlAuthorizer.Action getAction() { return action; }
}
