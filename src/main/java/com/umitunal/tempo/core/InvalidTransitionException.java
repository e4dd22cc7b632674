package com.umitunal.tempo.core;

/**
 * A state change was requested along an edge the state machine does not have.
 */
public class InvalidTransitionException extends SchedulerException {
    private final String jobId;
    private final JobState from;
    private final JobState to;

    public InvalidTransitionException(String jobId, JobState from, JobState to) {
        this(jobId, from, to, "no such edge");
    }

    public InvalidTransitionException(String jobId, JobState from, JobState to, String reason) {
        super("Invalid transition for job " + jobId + ": " + from + " -> " + to + " (" + reason + ")");
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }

    public String getJobId() { return jobId; }
    public JobState getFrom() { return from; }
    public JobState getTo() { return to; }
}
