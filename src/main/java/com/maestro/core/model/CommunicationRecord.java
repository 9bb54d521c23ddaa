package com.maestro.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A directed message from one agent to another, observed in a step's output.
 * The response is attached at most once.
 *
 * @param id          deterministic id derived from execution, step and target agent; see {@link #idFor}
 * @param executionId execution the message was observed in
 * @param stepId      step whose output contained the message
 * @param fromAgent   agent that wrote the message
 * @param toAgent     agent the message is addressed to
 * @param message     message text
 * @param response    response text (nullable until answered)
 * @param timestamp   when the message was observed
 * @param respondedAt when the response was attached (nullable)
 */
public record CommunicationRecord(
    String id,
    String executionId,
    String stepId,
    String fromAgent,
    String toAgent,
    String message,
    String response,
    Instant timestamp,
    Instant respondedAt
) implements Serializable {

    /**
     * Derives the id of the message a step sent to an agent, e.g. {@code COMM-EXEC-2026-0007-3fa2.A.reviewer}.
     * Parts are joined with {@code .}; a {@code .} or {@code ~} inside a part is escaped with {@code ~},
     * so distinct (execution, step, agent) triples never share an id.
     */
    public static String idFor(String executionId, String stepId, String toAgent) {
        return "COMM-" + escape(executionId) + "." + escape(stepId) + "." + escape(toAgent);
    }

    private static String escape(String part) {
        return part.replace("~", "~~").replace(".", "~.");
    }

    public boolean isAnswered() {
        return response != null;
    }

    public CommunicationRecord withResponse(String newResponse, Instant at) {
        return new CommunicationRecord(id, executionId, stepId, fromAgent, toAgent, message, newResponse, timestamp, at);
    }
}
