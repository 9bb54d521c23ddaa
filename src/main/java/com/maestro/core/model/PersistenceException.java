package com.maestro.core.model;

/**
 * Thrown by the execution repository when a read or write against the backing store fails.
 */
public class PersistenceException extends MaestroException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
