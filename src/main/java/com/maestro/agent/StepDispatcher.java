package com.maestro.agent;

import com.maestro.core.audit.AuditRecorder;
import com.maestro.core.logging.MdcContext;
import com.maestro.core.model.Step;
import com.maestro.core.model.StepResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Invokes the Agent Invocation Service for a single step.
 *
 * <p>Each attempt runs on a separate thread so the step timeout can be enforced even if the
 * service ignores it. Timeouts and failed calls are retried with exponential backoff until
 * {@code maxAttempts} is reached; the last error is carried in the failed {@link StepResult}.
 *
 * <p>On success the output is scanned for directed references to other agents and a
 * communication record is requested for each. This happens once per successful dispatch,
 * never per attempt.
 */
@Service
public class StepDispatcher {

    private static final Logger log = LoggerFactory.getLogger(StepDispatcher.class);

    private final AgentInvocationService invocationService;
    private final DispatchProperties properties;
    private final BackoffPolicy backoff;
    private final DirectedReferenceExtractor extractor;
    private final AuditRecorder auditRecorder;
    private final MentionResponder mentionResponder;
    private final ExecutorService invocationExecutor;

    @Autowired
    public StepDispatcher(AgentInvocationService invocationService, DispatchProperties properties,
                          DirectedReferenceExtractor extractor, AuditRecorder auditRecorder,
                          MentionResponder mentionResponder) {
        this(invocationService, properties, BackoffPolicy.from(properties), extractor, auditRecorder, mentionResponder);
    }

    StepDispatcher(AgentInvocationService invocationService, DispatchProperties properties, BackoffPolicy backoff,
                   DirectedReferenceExtractor extractor, AuditRecorder auditRecorder,
                   MentionResponder mentionResponder) {
        this.invocationService = invocationService;
        this.properties = properties;
        this.backoff = backoff;
        this.extractor = extractor;
        this.auditRecorder = auditRecorder;
        this.mentionResponder = mentionResponder;
        var counter = new AtomicInteger();
        this.invocationExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "agent-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Dispatches a step, retrying per the configured policy.
     *
     * @param step         the step to run; must be RUNNING
     * @param context      working context of the execution
     * @param participants agent ids taking part in the execution, used for mention matching
     * @param listener     notified after every attempt
     * @return terminal COMPLETED or FAILED result
     */
    public StepResult dispatch(Step step, Map<String, Object> context, Collection<String> participants,
                               AttemptListener listener) {
        Duration timeout = timeoutFor(step);
        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        long startMs = System.currentTimeMillis();
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            log.info("Invoking agent {} for step {} (attempt {}/{}, timeout={}ms)",
                    step.agentId(), step.id(), attempt, maxAttempts, timeout.toMillis());
            try {
                String output = invokeOnce(step, context, timeout);
                listener.onAttempt(step, attempt, AttemptListener.Outcome.SUCCEEDED, null, false);
                long elapsedMs = System.currentTimeMillis() - startMs;
                recordDirectedReferences(step, output, participants);
                return StepResult.completed(step.id(), output, attempt, elapsedMs);
            } catch (StepDispatchException e) {
                lastError = e.getMessage();
                boolean willRetry = e.isRetryable() && attempt < maxAttempts && listener.shouldContinue();
                var outcome = e instanceof StepTimeoutException
                        ? AttemptListener.Outcome.TIMED_OUT : AttemptListener.Outcome.FAILED;
                listener.onAttempt(step, attempt, outcome, lastError, willRetry);

                if (!willRetry) {
                    log.warn("Step {} failed after {} attempt(s): {}", step.id(), attempt, lastError);
                    return StepResult.failed(step.id(), lastError, attempt, System.currentTimeMillis() - startMs);
                }

                Duration delay = backoff.delayFor(attempt);
                log.warn("Step {} attempt {} failed ({}), retrying in {}ms",
                        step.id(), attempt, lastError, delay.toMillis());
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return StepResult.failed(step.id(), "Interrupted while waiting to retry: " + lastError,
                            attempt, System.currentTimeMillis() - startMs);
                }
            }
        }
        // unreachable: the loop returns on the last attempt
        return StepResult.failed(step.id(), lastError, maxAttempts, System.currentTimeMillis() - startMs);
    }

    Duration timeoutFor(Step step) {
        if (step.timeoutSeconds() != null && step.timeoutSeconds() > 0) {
            return Duration.ofSeconds(step.timeoutSeconds());
        }
        return properties.getTimeout();
    }

    private String invokeOnce(Step step, Map<String, Object> context, Duration timeout) {
        Map<String, String> mdc = MdcContext.snapshot();
        Future<AgentInvocation> call = invocationExecutor.submit(() -> {
            MdcContext.restore(mdc);
            try {
                return invocationService.invoke(step.agentId(), step.taskText(), context, timeout);
            } finally {
                MdcContext.clear();
            }
        });
        try {
            AgentInvocation invocation = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (invocation == null) {
                throw new StepInvocationException("Agent " + step.agentId() + " returned no result");
            }
            if (!invocation.success()) {
                String error = invocation.error() != null ? invocation.error() : "unknown error";
                throw new StepInvocationException("Agent " + step.agentId() + " failed: " + error);
            }
            return invocation.output() != null ? invocation.output() : "";
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new StepTimeoutException(step.id(), timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof StepDispatchException sde) {
                throw sde;
            }
            throw new StepInvocationException("Agent " + step.agentId() + " call threw "
                    + cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause, true);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new StepInvocationException("Interrupted while invoking agent " + step.agentId(), e, false);
        }
    }

    private void recordDirectedReferences(Step step, String output, Collection<String> participants) {
        List<DirectedReference> references;
        try {
            references = extractor.extract(output, step.agentId(), participants);
        } catch (RuntimeException e) {
            log.warn("Directed reference extraction failed for step {}: {}", step.id(), e.getMessage(), e);
            return;
        }
        for (var reference : references) {
            auditRecorder.recordCommunication(step.executionId(), step.id(), step.agentId(),
                            reference.toAgent(), reference.message())
                    .ifPresent(mentionResponder::respond);
        }
    }

    @PreDestroy
    void shutdown() {
        invocationExecutor.shutdownNow();
    }
}
