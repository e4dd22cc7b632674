package com.umitunal.tempo.core;

/**
 * Condition under which a continuation fires once its antecedent finishes.
 */
public enum ContinuationTrigger {
    ON_SUCCESS,
    ON_ANY_TERMINAL;

    /**
     * Whether a dependent should be released for an antecedent that ended in
     * the given terminal state.
     */
    public boolean matches(JobState antecedentState) {
        return switch (this) {
            case ON_SUCCESS -> antecedentState == JobState.SUCCEEDED;
            case ON_ANY_TERMINAL -> antecedentState == JobState.SUCCEEDED
                    || antecedentState == JobState.FAILED
                    || antecedentState == JobState.DELETED;
        };
    }
}
