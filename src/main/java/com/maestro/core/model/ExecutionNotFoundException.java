package com.maestro.core.model;

public class ExecutionNotFoundException extends MaestroException {

    public ExecutionNotFoundException(String executionId) {
        super("Execution not found: " + executionId);
    }
}
