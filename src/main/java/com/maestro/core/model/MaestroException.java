package com.maestro.core.model;

/**
 * Base class for all orchestration errors.
 */
public class MaestroException extends RuntimeException {

    public MaestroException(String message) {
        super(message);
    }

    public MaestroException(String message, Throwable cause) {
        super(message, cause);
    }
}
