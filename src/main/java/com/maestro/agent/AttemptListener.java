package com.maestro.agent;

import com.maestro.core.model.Step;

/**
 * Callback for each invocation attempt the dispatcher makes for a step.
 */
public interface AttemptListener {

    enum Outcome { SUCCEEDED, TIMED_OUT, FAILED }

    /**
     * @param step      step being dispatched
     * @param attempt   1-based attempt number
     * @param outcome   how the attempt ended
     * @param error     error message for failed attempts (null on success)
     * @param willRetry true when another attempt follows
     */
    void onAttempt(Step step, int attempt, Outcome outcome, String error, boolean willRetry);

    /** Checked before every retry; returning false stops retrying. */
    default boolean shouldContinue() {
        return true;
    }

    AttemptListener NONE = (step, attempt, outcome, error, willRetry) -> { };
}
