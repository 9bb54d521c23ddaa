package com.maestro.agent;

import java.time.Duration;
import java.util.Map;

/**
 * Fallback used when no agent endpoint is configured: every invocation fails.
 */
public class UnconfiguredAgentInvocationService implements AgentInvocationService {

    @Override
    public AgentInvocation invoke(String agentId, String taskText, Map<String, Object> context, Duration timeout) {
        return AgentInvocation.failure("No agent endpoint configured (set maestro.agents.endpoint)");
    }
}
