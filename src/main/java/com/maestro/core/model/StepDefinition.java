package com.maestro.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Declarative description of one step in a workflow.
 *
 * @param id             step identifier, unique within its template or ad-hoc step set
 * @param agentId        agent that performs the step
 * @param taskText       instruction handed to the agent
 * @param dependsOn      ids of steps that must complete before this one may run
 * @param timeoutSeconds per-step invocation timeout; null falls back to the dispatcher default
 */
public record StepDefinition(
    String id,
    @JsonProperty("agent") String agentId,
    @JsonProperty("task") String taskText,
    @JsonProperty("depends_on") List<String> dependsOn,
    @JsonProperty("timeout_seconds") Integer timeoutSeconds
) implements Serializable {

    public StepDefinition {
        // null entries are kept so that validation can reject them by name
        dependsOn = dependsOn == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(dependsOn));
    }

    public StepDefinition(String id, String agentId, String taskText, List<String> dependsOn) {
        this(id, agentId, taskText, dependsOn, null);
    }
}
