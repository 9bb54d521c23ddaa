package com.maestro.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * One running (or finished) instance of a workflow.
 *
 * @param id             opaque execution id generated at submission
 * @param templateId     template the steps came from; null for ad-hoc executions
 * @param mode           dispatch policy
 * @param workingContext key-value bag passed to every step invocation
 * @param status         lifecycle status
 * @param createdAt      submission time
 * @param startedAt      when the execution entered RUNNING (nullable)
 * @param completedAt    when the execution reached a terminal status (nullable)
 * @param steps          steps in definition order
 */
public record Execution(
    String id,
    String templateId,
    ExecutionMode mode,
    Map<String, Object> workingContext,
    ExecutionStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    List<Step> steps
) implements Serializable {

    public Execution {
        // context values may legitimately be null
        workingContext = workingContext == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(workingContext));
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public Optional<Step> step(String stepId) {
        return steps.stream().filter(s -> s.id().equals(stepId)).findFirst();
    }

    public Execution withStatus(ExecutionStatus newStatus, Instant at) {
        Instant started = newStatus == ExecutionStatus.RUNNING && startedAt == null ? at : startedAt;
        Instant completed = newStatus.isTerminal() ? at : completedAt;
        return new Execution(id, templateId, mode, workingContext, newStatus, createdAt, started, completed, steps);
    }

    /** Returns a copy with the named step replaced by {@code change.apply(step)}. */
    public Execution withStep(String stepId, UnaryOperator<Step> change) {
        var updated = new ArrayList<Step>(steps.size());
        for (Step s : steps) {
            updated.add(s.id().equals(stepId) ? change.apply(s) : s);
        }
        return new Execution(id, templateId, mode, workingContext, status, createdAt, startedAt, completedAt, updated);
    }

    public List<StepDefinition> stepDefinitions() {
        return steps.stream().map(Step::toDefinition).toList();
    }
}
