package com.maestro.agent;

import com.maestro.core.model.MaestroException;

/**
 * A single failed attempt at invoking an agent for a step.
 */
public class StepDispatchException extends MaestroException {

    private final boolean retryable;

    public StepDispatchException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public StepDispatchException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
