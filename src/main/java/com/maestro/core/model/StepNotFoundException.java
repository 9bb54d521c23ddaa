package com.maestro.core.model;

public class StepNotFoundException extends MaestroException {

    public StepNotFoundException(String executionId, String stepId) {
        super("Step " + stepId + " not found in execution " + executionId);
    }
}
