package com.maestro.core.model;

/**
 * Thrown when a template or step graph is rejected before any step runs.
 */
public class ValidationException extends MaestroException {

    public ValidationException(String message) {
        super(message);
    }
}
