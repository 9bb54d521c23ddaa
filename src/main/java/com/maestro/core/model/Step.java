package com.maestro.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runtime state of one step inside an execution.
 *
 * @param id             step id, unique within the execution
 * @param executionId    owning execution (back-reference)
 * @param agentId        agent invoked for this step
 * @param taskText       instruction handed to the agent
 * @param dependsOn      ids of steps that must be COMPLETED before this step may run
 * @param status         current status
 * @param startedAt      when the step first entered RUNNING (nullable)
 * @param completedAt    when the step reached a terminal status (nullable)
 * @param result         raw agent output on success (nullable)
 * @param error          last error message on failure or skip reason (nullable)
 * @param retryCount     number of retries performed (attempts minus one)
 * @param timeoutSeconds per-step timeout override (nullable)
 */
public record Step(
    String id,
    String executionId,
    String agentId,
    String taskText,
    List<String> dependsOn,
    StepStatus status,
    Instant startedAt,
    Instant completedAt,
    String result,
    String error,
    int retryCount,
    Integer timeoutSeconds
) implements Serializable {

    public Step {
        dependsOn = dependsOn == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(dependsOn));
    }

    /** Creates the initial runtime step for a definition. */
    public static Step fromDefinition(String executionId, StepDefinition definition) {
        StepStatus initial = definition.dependsOn().isEmpty() ? StepStatus.PENDING : StepStatus.BLOCKED;
        return new Step(definition.id(), executionId, definition.agentId(), definition.taskText(),
                definition.dependsOn(), initial, null, null, null, null, 0, definition.timeoutSeconds());
    }

    public Step withStatus(StepStatus newStatus) {
        return new Step(id, executionId, agentId, taskText, dependsOn, newStatus,
                startedAt, completedAt, result, error, retryCount, timeoutSeconds);
    }

    public Step withStartedAt(Instant at) {
        return new Step(id, executionId, agentId, taskText, dependsOn, status,
                at, completedAt, result, error, retryCount, timeoutSeconds);
    }

    public Step withCompletion(Instant at, String newResult, String newError) {
        return new Step(id, executionId, agentId, taskText, dependsOn, status,
                startedAt, at, newResult, newError, retryCount, timeoutSeconds);
    }

    public Step withRetryCount(int count) {
        return new Step(id, executionId, agentId, taskText, dependsOn, status,
                startedAt, completedAt, result, error, count, timeoutSeconds);
    }

    public StepDefinition toDefinition() {
        return new StepDefinition(id, agentId, taskText, dependsOn, timeoutSeconds);
    }
}
