package com.maestro.core.model;

public class CommunicationNotFoundException extends MaestroException {

    public CommunicationNotFoundException(String communicationId) {
        super("Communication not found: " + communicationId);
    }
}
