package com.maestro.core.model;

import java.io.Serializable;

/**
 * Derived completion view of an execution.
 *
 * @param percent   round(100 * (completed + skipped) / total); 100 for an empty execution
 * @param status    execution status the figures were computed against
 * @param total     total number of steps
 * @param completed steps that completed successfully
 * @param skipped   steps given up because of an upstream failure or cancellation
 * @param failed    steps that failed after exhausting retries
 * @param running   steps currently running
 * @param waiting   steps still PENDING or BLOCKED
 */
public record Progress(
    int percent,
    ExecutionStatus status,
    int total,
    int completed,
    int skipped,
    int failed,
    int running,
    int waiting
) implements Serializable {}
