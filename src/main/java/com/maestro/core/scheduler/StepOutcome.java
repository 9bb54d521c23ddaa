package com.maestro.core.scheduler;

import com.maestro.agent.AttemptListener;
import com.maestro.core.model.Step;
import com.maestro.core.model.StepResult;

/**
 * Message handed from a worker back to the control loop: either the final result of a
 * dispatched step or a notice that one invocation attempt ended.
 * <p>
 * Attempt notices do not free the step's slot; only the final result does.
 */
record StepOutcome(String stepId, StepResult result, AttemptNotice attempt) {

    static StepOutcome finished(String stepId, StepResult result) {
        return new StepOutcome(stepId, result, null);
    }

    static StepOutcome attempt(Step step, int attempt, AttemptListener.Outcome outcome, String error,
                               boolean willRetry) {
        return new StepOutcome(step.id(), null, new AttemptNotice(step, attempt, outcome, error, willRetry));
    }

    boolean isAttempt() {
        return attempt != null;
    }

    record AttemptNotice(Step step, int attempt, AttemptListener.Outcome outcome, String error, boolean willRetry) {
    }
}
