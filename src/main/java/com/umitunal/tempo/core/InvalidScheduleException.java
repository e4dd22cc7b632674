package com.umitunal.tempo.core;

/**
 * A cron expression could not be parsed or never fires.
 */
public class InvalidScheduleException extends SchedulerException {
    private final String expression;

    public InvalidScheduleException(String expression, String reason) {
        super("Invalid cron expression '" + expression + "': " + reason);
        this.expression = expression;
    }

    public InvalidScheduleException(String expression, Throwable cause) {
        super("Invalid cron expression '" + expression + "': " + cause.getMessage(), cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
