package com.maestro.agent;

import java.time.Duration;
import java.util.Map;

/**
 * Contract of the external service that runs an agent (an LLM-backed worker) for one task.
 * <p>
 * Implementations report agent-level failures through {@link AgentInvocation#failure(String)};
 * they may also throw, in which case the dispatcher treats the exception as a failed attempt.
 * The {@code timeout} is advisory: the dispatcher enforces it independently.
 */
public interface AgentInvocationService {

    AgentInvocation invoke(String agentId, String taskText, Map<String, Object> context, Duration timeout);
}
