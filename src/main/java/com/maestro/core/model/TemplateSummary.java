package com.maestro.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Catalogue entry for a registered workflow template.
 */
public record TemplateSummary(
    String id,
    String name,
    String description,
    int stepCount,
    List<String> agents
) implements Serializable {

    public static TemplateSummary of(WorkflowTemplate template) {
        var agents = template.steps().stream()
                .map(StepDefinition::agentId)
                .distinct()
                .toList();
        return new TemplateSummary(template.id(), template.name(), template.description(),
                template.steps().size(), agents);
    }
}
