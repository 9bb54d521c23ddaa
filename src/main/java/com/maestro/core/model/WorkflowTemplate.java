package com.maestro.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named, reusable step graph. Immutable once registered.
 */
public record WorkflowTemplate(
    String id,
    String name,
    String description,
    List<StepDefinition> steps
) implements Serializable {

    public WorkflowTemplate {
        steps = steps == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(steps));
    }
}
