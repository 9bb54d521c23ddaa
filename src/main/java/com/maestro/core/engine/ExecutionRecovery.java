package com.maestro.core.engine;

import com.maestro.core.audit.AuditRecorder;
import com.maestro.core.model.AuditAction;
import com.maestro.core.model.Execution;
import com.maestro.core.model.ExecutionStatus;
import com.maestro.core.model.Step;
import com.maestro.core.model.StepStatus;
import com.maestro.core.persistence.ExecutionRepository;
import com.maestro.core.scheduler.ExecutionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Fails executions left unfinished by a previous orchestrator process.
 * <p>
 * In-flight work is not resumed: every non-terminal step is skipped and the execution
 * ends {@code failed}, so its stored state stays consistent with what actually ran.
 */
@Component
public class ExecutionRecovery {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRecovery.class);

    static final String REASON = "Interrupted by orchestrator restart";

    private final ExecutionRepository repository;
    private final ExecutionScheduler scheduler;
    private final AuditRecorder auditRecorder;

    public ExecutionRecovery(ExecutionRepository repository, ExecutionScheduler scheduler,
                             AuditRecorder auditRecorder) {
        this.repository = repository;
        this.scheduler = scheduler;
        this.auditRecorder = auditRecorder;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        int recovered = recoverInterrupted();
        if (recovered > 0) {
            log.warn("Marked {} interrupted execution(s) as failed", recovered);
        }
    }

    /**
     * @return number of executions marked failed
     */
    public int recoverInterrupted() {
        int recovered = 0;
        for (Execution execution : repository.findAll()) {
            if (execution.status().isTerminal() || scheduler.isRunning(execution.id())) {
                continue;
            }
            Instant now = Instant.now();
            for (Step step : execution.steps()) {
                if (!step.status().isTerminal()) {
                    repository.transitionStep(execution.id(), step.id(), StepStatus.SKIPPED,
                            s -> s.withCompletion(now, null, REASON));
                }
            }
            if (execution.status() == ExecutionStatus.PENDING) {
                repository.updateExecutionStatus(execution.id(), ExecutionStatus.RUNNING, now);
            }
            if (repository.updateExecutionStatus(execution.id(), ExecutionStatus.FAILED, now).isPresent()) {
                auditRecorder.record(execution.id(), null, null, AuditAction.EXECUTION_RECOVERED, "failed", REASON);
                log.info("Execution {} was {} at startup; marked failed", execution.id(), execution.status());
                recovered++;
            }
        }
        return recovered;
    }
}
