package com.umitunal.tempo.core;

public class JobNotFoundException extends SchedulerException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
