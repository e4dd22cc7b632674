package com.umitunal.tempo.core;

/**
 * Another worker holds the lease on a job. Expected under contention.
 */
public class LeaseConflictException extends SchedulerException {
    private final String jobId;
    private final String owner;

    public LeaseConflictException(String jobId, String owner) {
        super("Job " + jobId + " is leased by " + owner);
        this.jobId = jobId;
        this.owner = owner;
    }

    public String getJobId() { return jobId; }
    public String getOwner() { return owner; }
}
