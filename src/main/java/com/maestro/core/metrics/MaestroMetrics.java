package com.maestro.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for workflow execution.
 */
@Service
public class MaestroMetrics {

    private final MeterRegistry registry;

    public MaestroMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordExecutionResult(String status) {
        Counter.builder("maestro.executions.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordExecutionDuration(String mode, long ms) {
        Timer.builder("maestro.execution.duration")
                .tag("mode", mode)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStepDuration(String agentId, long ms) {
        Timer.builder("maestro.step.duration")
                .tag("agent", agentId)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStepResult(String status) {
        Counter.builder("maestro.steps.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Records a single invocation attempt.
     *
     * @param outcome "succeeded", "timed_out" or "failed"
     */
    public void recordStepAttempt(String outcome) {
        Counter.builder("maestro.step.attempts")
                .description("Agent invocation attempts by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRetryCount(int retries) {
        DistributionSummary.builder("maestro.step.retries")
                .description("Retries needed per finished step")
                .register(registry)
                .record(retries);
    }

    /**
     * Records the number of steps released together, for parallel vs staged analysis.
     */
    public void recordStageSize(int stepCount, String mode) {
        DistributionSummary.builder("maestro.stage.step_count")
                .description("Steps dispatched per stage")
                .tag("mode", mode)
                .register(registry)
                .record(stepCount);
    }

    public void recordCommunication() {
        Counter.builder("maestro.communications.total")
                .register(registry)
                .increment();
    }

    public void recordAuditFailure() {
        Counter.builder("maestro.audit.failures")
                .description("Audit records that could not be persisted")
                .register(registry)
                .increment();
    }
}
