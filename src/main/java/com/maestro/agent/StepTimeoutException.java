package com.maestro.agent;

import java.time.Duration;

/**
 * The agent did not answer within the step timeout.
 */
public class StepTimeoutException extends StepDispatchException {

    public StepTimeoutException(String stepId, Duration timeout) {
        super("Step " + stepId + " timed out after " + timeout.toMillis() + "ms", true);
    }
}
