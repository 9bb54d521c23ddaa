package com.maestro.core.model;

/**
 * Status of an individual step within an execution.
 */
public enum StepStatus {
    PENDING,
    BLOCKED,    // waiting on at least one dependency that has not completed yet
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED;    // an upstream dependency failed, or the execution was cancelled

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    /** Legal step transitions; terminal statuses never change again. */
    public boolean canTransitionTo(StepStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == BLOCKED || next == SKIPPED;
            case BLOCKED -> next == PENDING || next == SKIPPED;
            case RUNNING -> next == COMPLETED || next == FAILED || next == SKIPPED;
            case COMPLETED, FAILED, SKIPPED -> false;
        };
    }
}
