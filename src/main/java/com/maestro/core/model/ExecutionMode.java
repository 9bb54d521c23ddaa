package com.maestro.core.model;

/**
 * Concurrency policy applied by the scheduler when dispatching steps of an execution.
 * <p>
 * SEQUENTIAL: one runnable step at a time, in definition order.
 * PARALLEL: every runnable step, bounded by the max-in-flight limit, refilled as steps finish.
 * STAGED: one dependency stage at a time, with a barrier at every stage boundary.
 */
public enum ExecutionMode {
    SEQUENTIAL,
    PARALLEL,
    STAGED;

    /**
     * Lenient parse accepting any case ("staged", "STAGED").
     *
     * @throws IllegalArgumentException if the value names no mode
     */
    public static ExecutionMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Execution mode is required");
        }
        return ExecutionMode.valueOf(value.trim().toUpperCase());
    }
}
