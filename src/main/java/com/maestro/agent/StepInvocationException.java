package com.maestro.agent;

/**
 * The agent call failed or reported an error.
 */
public class StepInvocationException extends StepDispatchException {

    public StepInvocationException(String message) {
        super(message, true);
    }

    public StepInvocationException(String message, Throwable cause, boolean retryable) {
        super(message, cause, retryable);
    }
}
