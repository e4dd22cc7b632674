package com.umitunal.tempo.core;

public class HandlerNotFoundException extends SchedulerException {
    private final String handler;

    public HandlerNotFoundException(String handler) {
        super("No handler registered for '" + handler + "'");
        this.handler = handler;
    }

    public String getHandler() {
        return handler;
    }
}
