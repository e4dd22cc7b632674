package com.umitunal.tempo.worker;

/**
 * Notified after a worker moved a job into a terminal state.
 */
@FunctionalInterface
public interface JobCompletionListener {

    JobCompletionListener NONE = jobId -> { };

    void onTerminal(String jobId);
}
