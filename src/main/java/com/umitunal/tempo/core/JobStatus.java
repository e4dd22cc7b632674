package com.umitunal.tempo.core;

/**
 * Outcome snapshot of a single job.
 */
public class JobStatus {
    private final String jobId;
    private final JobState state;
    private final String error;
    private final int attempts;
    private final boolean terminal;

    public JobStatus(String jobId, JobState state, String error, int attempts, boolean terminal) {
        this.jobId = jobId;
        this.state = state;
        this.error = error;
        this.attempts = attempts;
        this.terminal = terminal;
    }

    public static JobStatus of(Job job) {
        return new JobStatus(job.getId(), job.getState(), job.getLastError(), job.getAttempts(), job.isTerminal());
    }

    public String getJobId() { return jobId; }
    public JobState getState() { return state; }
    public String getError() { return error; }
    public int getAttempts() { return attempts; }
    public boolean isTerminal() { return terminal; }

    @Override
    public String toString() {
        return String.format("JobStatus{id='%s', state=%s, attempts=%d, error=%s}",
                jobId, state, attempts, error == null ? "none" : "'" + error + "'");
    }
}
