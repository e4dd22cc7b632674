package com.umitunal.tempo.engine;

import com.umitunal.tempo.core.JobState;
import com.umitunal.tempo.model.ContinuationLink;
import com.umitunal.tempo.model.JobRecord;
import com.umitunal.tempo.storage.JobStore;
import com.umitunal.tempo.worker.JobCompletionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Releases or discards the continuations of a job once it reaches a terminal
 * state.
 *
 * A dependent whose trigger matches is scheduled for now; the poller enqueues
 * it on its next tick. A dependent whose trigger can no longer match is
 * deleted, which in turn resolves its own dependents.
 */
public class ContinuationEngine implements JobCompletionListener {
    private static final Logger log = LoggerFactory.getLogger(ContinuationEngine.class);

    private final JobStore store;

    public ContinuationEngine(JobStore store) {
        this.store = store;
    }

    /**
     * @return number of dependents moved out of AWAITING_CONTINUATION,
     *         cascaded deletions included
     */
    public int resolve(String antecedentId) {
        int resolved = 0;
        Deque<String> pending = new ArrayDeque<>();
        pending.push(antecedentId);

        while (!pending.isEmpty()) {
            String jobId = pending.pop();
            Optional<JobState> finalState = terminalStateOf(jobId);
            if (finalState.isEmpty()) {
                continue;
            }
            JobState state = finalState.get();

            for (ContinuationLink link : store.continuationsOf(jobId)) {
                if (link.getTrigger().matches(state)) {
                    if (store.resolveContinuation(link, JobState.SCHEDULED, null)) {
                        resolved++;
                        log.debug("Released continuation {} of {}", link.getDependentId(), jobId);
                    }
                } else {
                    String note = "Antecedent " + jobId + " finished as " + state
                            + ", continuation requires " + link.getTrigger();
                    if (store.resolveContinuation(link, JobState.DELETED, note)) {
                        resolved++;
                        log.info("Deleted continuation {}: {}", link.getDependentId(), note);
                        pending.push(link.getDependentId());
                    }
                }
            }
        }
        return resolved;
    }

    @Override
    public void onTerminal(String jobId) {
        resolve(jobId);
    }

    /**
     * The state links of {@code jobId} are resolved against, or empty while
     * the job can still change state. A job that no longer exists counts as
     * deleted.
     */
    private Optional<JobState> terminalStateOf(String jobId) {
        Optional<JobRecord> job = store.find(jobId);
        if (job.isEmpty()) {
            return Optional.of(JobState.DELETED);
        }
        return job.get().isTerminal() ? Optional.of(job.get().getState()) : Optional.empty();
    }
}
