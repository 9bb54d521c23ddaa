package com.maestro.core.model;

import java.util.List;

/**
 * Thrown when a step graph contains a dependency cycle.
 */
public class CyclicDependencyException extends ValidationException {

    private final List<String> unplacedStepIds;

    public CyclicDependencyException(List<String> unplacedStepIds) {
        super("Cyclic dependency among steps " + unplacedStepIds);
        this.unplacedStepIds = List.copyOf(unplacedStepIds);
    }

    /** Step ids that could not be placed into any stage. */
    public List<String> getUnplacedStepIds() {
        return unplacedStepIds;
    }
}
