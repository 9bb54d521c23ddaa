package com.maestro.core.scheduler;

import com.maestro.core.model.CyclicDependencyException;
import com.maestro.core.model.StepDefinition;
import com.maestro.core.model.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups a step graph into dependency stages using Kahn's algorithm.
 *
 * <p>Stage 0 holds the steps without dependencies; stage k holds the steps whose dependencies
 * all sit in stages 0..k-1. Within a stage, steps keep their definition order, which is also
 * the order sequential mode dispatches them in.
 */
@Service
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    /**
     * Computes the stages of a step graph.
     *
     * @param steps step definitions in definition order
     * @return stages of step ids, stage 0 first
     * @throws ValidationException        if a step is null, ids are blank or duplicated, or a dependency is unknown
     * @throws CyclicDependencyException  if the graph contains a cycle
     */
    public List<List<String>> resolve(List<StepDefinition> steps) {
        validateStructure(steps);

        Map<String, Integer> remaining = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (var step : steps) {
            remaining.put(step.id(), new HashSet<>(step.dependsOn()).size());
            for (String dep : new LinkedHashSet<>(step.dependsOn())) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(step.id());
            }
        }

        var stages = new ArrayList<List<String>>();
        var placed = new HashSet<String>();
        List<String> current = remaining.entrySet().stream()
                .filter(e -> e.getValue() == 0)
                .map(Map.Entry::getKey)
                .toList();

        while (!current.isEmpty()) {
            stages.add(current);
            placed.addAll(current);
            var next = new HashSet<String>();
            for (String id : current) {
                for (String dependent : dependents.getOrDefault(id, List.of())) {
                    if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                        next.add(dependent);
                    }
                }
            }
            // definition order within the stage
            current = remaining.keySet().stream().filter(next::contains).toList();
        }

        if (placed.size() < steps.size()) {
            List<String> unplaced = remaining.keySet().stream().filter(id -> !placed.contains(id)).toList();
            log.warn("Cyclic dependency detected among steps {}", unplaced);
            throw new CyclicDependencyException(unplaced);
        }

        log.debug("Resolved {} steps into {} stage(s): {}", steps.size(), stages.size(), stages);
        return stages;
    }

    /**
     * Returns every step that depends on {@code stepId} directly or transitively,
     * in definition order.
     */
    public List<String> transitiveDependents(List<StepDefinition> steps, String stepId) {
        Map<String, List<String>> dependents = new HashMap<>();
        for (var step : steps) {
            for (String dep : step.dependsOn()) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(step.id());
            }
        }
        var reached = new HashSet<String>();
        var queue = new ArrayDeque<String>();
        queue.add(stepId);
        while (!queue.isEmpty()) {
            for (String dependent : dependents.getOrDefault(queue.poll(), List.of())) {
                if (reached.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        return steps.stream().map(StepDefinition::id).filter(reached::contains).toList();
    }

    private void validateStructure(List<StepDefinition> steps) {
        Set<String> ids = new HashSet<>();
        for (var step : steps) {
            if (step == null) {
                throw new ValidationException("Step definition must not be null");
            }
            if (step.id() == null || step.id().isBlank()) {
                throw new ValidationException("Step id must not be blank");
            }
            if (!ids.add(step.id())) {
                throw new ValidationException("Duplicate step id: " + step.id());
            }
            if (step.agentId() == null || step.agentId().isBlank()) {
                throw new ValidationException("Step " + step.id() + " has no agent");
            }
        }
        for (var step : steps) {
            for (String dep : step.dependsOn()) {
                if (dep == null || dep.isBlank()) {
                    throw new ValidationException("Step " + step.id() + " has a blank dependency id");
                }
                if (!ids.contains(dep)) {
                    throw new ValidationException("Step " + step.id() + " depends on unknown step " + dep);
                }
            }
        }
    }
}
