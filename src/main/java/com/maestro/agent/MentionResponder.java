package com.maestro.agent;

import com.maestro.core.audit.AuditRecorder;
import com.maestro.core.model.CommunicationRecord;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Forwards a directed mention to the addressed agent and attaches its answer.
 * Disabled unless {@code maestro.agents.respond-to-mentions} is set.
 */
@Service
public class MentionResponder {

    private static final Logger log = LoggerFactory.getLogger(MentionResponder.class);

    private final AgentInvocationService invocationService;
    private final AuditRecorder auditRecorder;
    private final DispatchProperties dispatchProperties;
    private final boolean enabled;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "mention-responder");
        t.setDaemon(true);
        return t;
    });

    public MentionResponder(AgentInvocationService invocationService, AuditRecorder auditRecorder,
                            DispatchProperties dispatchProperties, AgentProperties agentProperties) {
        this.invocationService = invocationService;
        this.auditRecorder = auditRecorder;
        this.dispatchProperties = dispatchProperties;
        this.enabled = agentProperties.isRespondToMentions();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void respond(CommunicationRecord communication) {
        if (!enabled) return;
        try {
            executor.submit(() -> answer(communication));
        } catch (RejectedExecutionException e) {
            log.warn("Mention responder is shut down; {} left unanswered", communication.id());
        }
    }

    void answer(CommunicationRecord communication) {
        String request = """
                [AGENT COMMUNICATION]
                From: %s
                Request: %s

                Please respond to this request from your colleague %s. Be helpful and specific in your response."""
                .formatted(communication.fromAgent(), communication.message(), communication.fromAgent());
        try {
            var invocation = invocationService.invoke(communication.toAgent(), request,
                    Map.of("execution_id", communication.executionId()), dispatchProperties.getTimeout());
            if (invocation != null && invocation.success()) {
                auditRecorder.attachResponse(communication.id(), invocation.output());
            } else {
                log.warn("Agent {} could not answer {}: {}", communication.toAgent(), communication.id(),
                        invocation != null ? invocation.error() : "no result");
            }
        } catch (RuntimeException e) {
            log.warn("Failed to obtain response for {} from {}: {}",
                    communication.id(), communication.toAgent(), e.getMessage(), e);
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
