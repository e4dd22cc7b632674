package com.umitunal.tempo.worker;

/**
 * Body of a job. Registered under a tag in a {@link JobHandlerRegistry}.
 *
 * Long-running handlers should call
 * {@link JobContext#throwIfCancellationRequested()} between units of work so a
 * deleted job stops promptly.
 *
 * @param <A> the argument type
 */
@FunctionalInterface
public interface JobHandler<A> {

    /**
     * Runs the job. Any exception marks the attempt as failed.
     */
    void execute(A arguments, JobContext context) throws Exception;
}
