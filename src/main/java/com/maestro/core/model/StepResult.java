package com.maestro.core.model;

import java.io.Serializable;

/**
 * Terminal outcome of dispatching one step, after retries.
 *
 * @param stepId    the step dispatched
 * @param status    COMPLETED or FAILED
 * @param output    raw agent output on success (nullable)
 * @param error     last error message on failure (nullable)
 * @param attempts  number of invocation attempts made
 * @param elapsedMs wall-clock time across all attempts
 */
public record StepResult(
    String stepId,
    StepStatus status,
    String output,
    String error,
    int attempts,
    long elapsedMs
) implements Serializable {

    public static StepResult completed(String stepId, String output, int attempts, long elapsedMs) {
        return new StepResult(stepId, StepStatus.COMPLETED, output, null, attempts, elapsedMs);
    }

    public static StepResult failed(String stepId, String error, int attempts, long elapsedMs) {
        return new StepResult(stepId, StepStatus.FAILED, null, error, attempts, elapsedMs);
    }

    public boolean isSuccess() {
        return status == StepStatus.COMPLETED;
    }

    public int retryCount() {
        return Math.max(0, attempts - 1);
    }
}
