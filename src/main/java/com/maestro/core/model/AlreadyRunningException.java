package com.maestro.core.model;

/**
 * Thrown when {@code start} is called for an execution that already has a control loop.
 */
public class AlreadyRunningException extends MaestroException {

    public AlreadyRunningException(String executionId) {
        super("Execution " + executionId + " is already running");
    }
}
