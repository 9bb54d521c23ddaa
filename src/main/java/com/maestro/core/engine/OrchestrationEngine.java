package com.maestro.core.engine;

import com.maestro.core.audit.AuditExport;
import com.maestro.core.audit.AuditRecorder;
import com.maestro.core.audit.AuditStatistics;
import com.maestro.core.logging.MdcContext;
import com.maestro.core.model.AuditRecord;
import com.maestro.core.model.CommunicationRecord;
import com.maestro.core.model.Execution;
import com.maestro.core.model.ExecutionMode;
import com.maestro.core.model.ExecutionNotFoundException;
import com.maestro.core.model.ExecutionReport;
import com.maestro.core.model.ExecutionStatus;
import com.maestro.core.model.ExecutionView;
import com.maestro.core.model.Step;
import com.maestro.core.model.StepDefinition;
import com.maestro.core.model.StepNotFoundException;
import com.maestro.core.model.TemplateSummary;
import com.maestro.core.model.ValidationException;
import com.maestro.core.model.WorkflowTemplate;
import com.maestro.core.persistence.ExecutionRepository;
import com.maestro.core.scheduler.ExecutionScheduler;
import com.maestro.core.scheduler.SchedulerProperties;
import com.maestro.core.template.WorkflowTemplateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.Year;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Management surface of the orchestrator, shared by the REST API and the CLI.
 * <p>
 * Builds executions from a template or an ad-hoc step list, hands them to the
 * {@link ExecutionScheduler} and answers read queries over executions, audit and communications.
 */
@Service
public class OrchestrationEngine {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationEngine.class);
    private static final AtomicInteger EXECUTION_COUNTER = new AtomicInteger(0);

    private final ExecutionScheduler scheduler;
    private final ExecutionRepository repository;
    private final WorkflowTemplateStore templateStore;
    private final AuditRecorder auditRecorder;
    private final SchedulerProperties schedulerProperties;

    public OrchestrationEngine(ExecutionScheduler scheduler, ExecutionRepository repository,
                               WorkflowTemplateStore templateStore, AuditRecorder auditRecorder,
                               SchedulerProperties schedulerProperties) {
        this.scheduler = scheduler;
        this.repository = repository;
        this.templateStore = templateStore;
        this.auditRecorder = auditRecorder;
        this.schedulerProperties = schedulerProperties;
    }

    /**
     * Creates and starts an execution.
     *
     * @param templateId template to instantiate; mutually exclusive with {@code steps}
     * @param steps      ad-hoc step definitions; mutually exclusive with {@code templateId}
     * @param mode       execution mode; null uses the configured default
     * @param context    working context passed to every step (nullable)
     * @return the started execution's id
     * @throws ValidationException if the request or the step graph is invalid
     * @throws com.maestro.core.model.TemplateNotFoundException if the template does not exist
     */
    public String startExecution(String templateId, List<StepDefinition> steps, ExecutionMode mode,
                                 Map<String, Object> context) {
        boolean hasTemplate = templateId != null && !templateId.isBlank();
        boolean hasSteps = steps != null && !steps.isEmpty();
        if (hasTemplate == hasSteps) {
            throw new ValidationException("Provide either a template id or a list of steps");
        }

        List<StepDefinition> definitions;
        if (hasTemplate) {
            WorkflowTemplate template = templateStore.get(templateId);
            definitions = template.steps();
        } else {
            definitions = steps;
        }
        if (definitions.stream().anyMatch(Objects::isNull)) {
            throw new ValidationException("Step definitions must not be null");
        }

        String executionId = generateExecutionId();
        ExecutionMode effectiveMode = mode != null ? mode : schedulerProperties.getDefaultMode();
        List<Step> runtimeSteps = definitions.stream().map(d -> Step.fromDefinition(executionId, d)).toList();
        var execution = new Execution(executionId, hasTemplate ? templateId : null, effectiveMode, context,
                ExecutionStatus.PENDING, Instant.now(), null, null, runtimeSteps);

        MdcContext.setExecution(executionId);
        try {
            log.info("Submitting execution {} ({}, mode={})", executionId,
                    hasTemplate ? "template " + templateId : definitions.size() + " ad-hoc step(s)", effectiveMode);
            scheduler.start(execution);
        } finally {
            MdcContext.clear();
        }
        return executionId;
    }

    public ExecutionView getExecution(String executionId) {
        return scheduler.getStatus(executionId);
    }

    public List<ExecutionView> listExecutions() {
        return repository.findAll().stream()
                .map(e -> scheduler.getStatus(e.id()))
                .toList();
    }

    public Step getStep(String executionId, String stepId) {
        return requireExecution(executionId).step(stepId)
                .orElseThrow(() -> new StepNotFoundException(executionId, stepId));
    }

    /**
     * @return true if the execution was cancelled by this call
     */
    public boolean cancelExecution(String executionId) {
        return scheduler.cancel(executionId);
    }

    public boolean awaitCompletion(String executionId, Duration timeout) throws InterruptedException {
        return scheduler.awaitCompletion(executionId, timeout);
    }

    public List<AuditRecord> listAudit(String executionId) {
        requireExecution(executionId);
        return auditRecorder.query(executionId);
    }

    public AuditExport exportAudit(String executionId, String format) {
        requireExecution(executionId);
        return auditRecorder.export(executionId, format);
    }

    public List<AuditRecord> listAgentAudit(String agentId, int limit) {
        return auditRecorder.agentHistory(agentId, limit);
    }

    public AuditStatistics auditStatistics(Instant from, Instant to) {
        return auditRecorder.statistics(from, to);
    }

    public List<CommunicationRecord> listCommunications(String executionId) {
        requireExecution(executionId);
        return auditRecorder.communications(executionId);
    }

    /**
     * Attaches a response to a communication; a second response is ignored.
     *
     * @return true if this call attached the response
     */
    public boolean respondToCommunication(String communicationId, String response) {
        if (response == null || response.isBlank()) {
            throw new ValidationException("Response must not be blank");
        }
        return auditRecorder.attachResponse(communicationId, response);
    }

    public ExecutionReport report(String executionId) {
        Execution execution = requireExecution(executionId);
        String name = null;
        String description = null;
        if (execution.templateId() != null) {
            var template = templateStore.find(execution.templateId());
            name = template.map(WorkflowTemplate::name).orElse(null);
            description = template.map(WorkflowTemplate::description).orElse(null);
        }
        Double minutes = null;
        if (execution.startedAt() != null && execution.completedAt() != null) {
            long ms = Duration.between(execution.startedAt(), execution.completedAt()).toMillis();
            minutes = Math.round(ms / 600.0) / 100.0;
        }
        return new ExecutionReport(execution.id(), execution.templateId(), name, description, execution.status(),
                execution.startedAt(), execution.completedAt(), minutes, execution.steps());
    }

    public List<TemplateSummary> listTemplates() {
        return templateStore.list();
    }

    public WorkflowTemplate getTemplate(String templateId) {
        return templateStore.get(templateId);
    }

    /**
     * Generates a unique execution ID in the format EXEC-YYYY-NNNN-xxxx: the calendar year, a
     * process-wide counter padded to at least four digits and four random hex digits, for example
     * {@code EXEC-2026-0007-3fa2}. The random suffix keeps ids unique across restarts, when the
     * counter starts over.
     */
    public String generateExecutionId() {
        int year = Year.now().getValue();
        int count = EXECUTION_COUNTER.incrementAndGet();
        int suffix = ThreadLocalRandom.current().nextInt(0x10000);
        return String.format("EXEC-%d-%04d-%04x", year, count, suffix);
    }

    private Execution requireExecution(String executionId) {
        return repository.findById(executionId).orElseThrow(() -> new ExecutionNotFoundException(executionId));
    }
}
