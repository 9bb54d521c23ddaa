package com.maestro.agent;

/**
 * Result of a single call to the Agent Invocation Service.
 *
 * @param success true when the agent produced output
 * @param output  raw agent output (nullable on failure)
 * @param error   failure description (nullable on success)
 */
public record AgentInvocation(
    boolean success,
    String output,
    String error
) {

    public static AgentInvocation success(String output) {
        return new AgentInvocation(true, output, null);
    }

    public static AgentInvocation failure(String error) {
        return new AgentInvocation(false, null, error);
    }
}
