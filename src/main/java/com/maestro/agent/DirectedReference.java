package com.maestro.agent;

/**
 * A message addressed by one agent to another inside step output.
 *
 * @param toAgent resolved id of the addressed agent
 * @param message the message text
 */
public record DirectedReference(String toAgent, String message) {}
