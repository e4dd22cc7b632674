package com.umitunal.tempo.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The legal edges between job states.
 *
 * The store consults this table before every compare-and-swap, so an illegal
 * request fails fast with {@link InvalidTransitionException} and never reaches
 * storage.
 */
public final class JobStateMachine {

    private static final Map<JobState, Set<JobState>> EDGES = new EnumMap<>(JobState.class);

    static {
        EDGES.put(JobState.CREATED, EnumSet.of(
                JobState.SCHEDULED, JobState.ENQUEUED, JobState.AWAITING_CONTINUATION, JobState.DELETED));
        EDGES.put(JobState.AWAITING_CONTINUATION, EnumSet.of(JobState.SCHEDULED, JobState.DELETED));
        EDGES.put(JobState.SCHEDULED, EnumSet.of(JobState.ENQUEUED, JobState.DELETED));
        EDGES.put(JobState.ENQUEUED, EnumSet.of(JobState.PROCESSING, JobState.DELETED));
        // PROCESSING -> SCHEDULED is lease reclaim after a worker crash
        EDGES.put(JobState.PROCESSING, EnumSet.of(
                JobState.SUCCEEDED, JobState.FAILED, JobState.DELETED, JobState.SCHEDULED));
        EDGES.put(JobState.FAILED, EnumSet.of(JobState.SCHEDULED));
        EDGES.put(JobState.SUCCEEDED, EnumSet.noneOf(JobState.class));
        EDGES.put(JobState.DELETED, EnumSet.noneOf(JobState.class));
    }

    private JobStateMachine() {
    }

    /**
     * Whether {@code from -> to} is an edge of the state machine, ignoring
     * retry budgets.
     */
    public static boolean isLegal(JobState from, JobState to) {
        return EDGES.getOrDefault(from, Collections.emptySet()).contains(to);
    }

    /**
     * Rejects an edge that is not in the table.
     *
     * @throws InvalidTransitionException if the edge does not exist
     */
    public static void requireLegal(String jobId, JobState from, JobState to) {
        if (!isLegal(from, to)) {
            throw new InvalidTransitionException(jobId, from, to);
        }
    }

    /**
     * Rejects an edge that does not exist or that the job's retry budget
     * forbids ({@code FAILED -> SCHEDULED} once attempts are exhausted).
     *
     * @throws InvalidTransitionException if the transition is not allowed
     */
    public static void requireLegal(String jobId, JobState from, JobState to, int attempts, int maxAttempts) {
        requireLegal(jobId, from, to);
        if (from == JobState.FAILED && attempts >= maxAttempts) {
            throw new InvalidTransitionException(jobId, from, to,
                    "retry budget exhausted (" + attempts + "/" + maxAttempts + ")");
        }
    }

    /**
     * Whether a job in {@code state} with the given attempt counters will never
     * change state again.
     */
    public static boolean isTerminal(JobState state, int attempts, int maxAttempts) {
        if (state.isFinal()) {
            return true;
        }
        return state == JobState.FAILED && attempts >= maxAttempts;
    }

    public static Set<JobState> successorsOf(JobState state) {
        return Collections.unmodifiableSet(EDGES.getOrDefault(state, Collections.emptySet()));
    }
}
