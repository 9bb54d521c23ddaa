package com.maestro.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during workflow execution, used for SSE streaming and CLI watch mode.
 *
 * @param eventType   event type (e.g. "execution_started", "step_completed")
 * @param executionId the execution this event belongs to
 * @param stepId      the step this event relates to (null for execution-level events)
 * @param payload     event data; always carries {@code progress} as a percent
 * @param timestamp   when the event occurred
 */
public record ExecutionEvent(
    String eventType,
    String executionId,
    String stepId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String EXECUTION_STARTED = "execution_started";
    public static final String EXECUTION_COMPLETED = "execution_completed";
    public static final String EXECUTION_FAILED = "execution_failed";
    public static final String EXECUTION_CANCELLED = "execution_cancelled";
    public static final String STEP_STARTED = "step_started";
    public static final String STEP_PROGRESS = "step_progress";
    public static final String STEP_COMPLETED = "step_completed";
    public static final String STEP_FAILED = "step_failed";
    public static final String STEP_SKIPPED = "step_skipped";

    /** True for the event that ends an execution; nothing else is published for it afterwards. */
    public boolean isTerminal() {
        return EXECUTION_COMPLETED.equals(eventType)
                || EXECUTION_FAILED.equals(eventType)
                || EXECUTION_CANCELLED.equals(eventType);
    }
}
