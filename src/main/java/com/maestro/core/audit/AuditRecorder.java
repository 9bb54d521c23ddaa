package com.maestro.core.audit;

import com.maestro.core.metrics.MaestroMetrics;
import com.maestro.core.model.AuditAction;
import com.maestro.core.model.AuditRecord;
import com.maestro.core.model.CommunicationNotFoundException;
import com.maestro.core.model.CommunicationRecord;
import com.maestro.core.model.ExportFormat;
import com.maestro.core.model.UnsupportedExportFormatException;
import com.maestro.core.persistence.ExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Append-only audit log and inter-agent communication log.
 * <p>
 * {@link #record} never throws back into its caller: a record that cannot be persisted is
 * logged and counted, and the execution carries on. Queries and exports surface persistence
 * errors normally.
 */
@Service
public class AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

    private final ExecutionRepository repository;
    private final MaestroMetrics metrics;

    public AuditRecorder(ExecutionRepository repository, MaestroMetrics metrics) {
        this.repository = repository;
        this.metrics = metrics;
    }

    /**
     * Appends an audit record.
     *
     * @return the stored record, or empty if it could not be persisted
     */
    public Optional<AuditRecord> record(String executionId, String stepId, String agentId,
                                        String action, String status, String message) {
        try {
            var draft = new AuditRecord(null, 0, executionId, stepId, agentId, action, status, message, Instant.now());
            return Optional.of(repository.appendAudit(draft));
        } catch (Exception e) {
            log.warn("Failed to persist audit record {} for execution {} step {}: {}",
                    action, executionId, stepId, e.getMessage(), e);
            safeCountFailure();
            return Optional.empty();
        }
    }

    public List<AuditRecord> query(String executionId) {
        return repository.findAuditByExecution(executionId);
    }

    /** Most recent records concerning an agent, newest first. */
    public List<AuditRecord> agentHistory(String agentId, int limit) {
        return repository.findAuditByAgent(agentId, limit);
    }

    public AuditStatistics statistics(Instant from, Instant to) {
        List<AuditRecord> records = repository.findAuditBetween(from, to);
        long executions = records.stream().map(AuditRecord::executionId).distinct().count();
        long completed = records.stream().filter(r -> AuditAction.STEP_COMPLETED.equals(r.action())).count();
        long failed = records.stream().filter(r -> AuditAction.STEP_FAILED.equals(r.action())).count();
        double successRate = completed + failed == 0 ? 0.0
                : Math.round(10000.0 * completed / (completed + failed)) / 100.0;
        return new AuditStatistics(from, to, records.size(), executions,
                countBy(records, AuditRecord::action),
                countBy(records, AuditRecord::status),
                countBy(records, AuditRecord::agentId),
                successRate);
    }

    /**
     * Records a directed message observed in a step's output.
     * Repeated calls for the same step and target agent create one record only.
     *
     * @return the new record, or empty if it already existed or could not be persisted
     */
    public Optional<CommunicationRecord> recordCommunication(String executionId, String stepId,
                                                             String fromAgent, String toAgent, String message) {
        var communication = new CommunicationRecord(CommunicationRecord.idFor(executionId, stepId, toAgent),
                executionId, stepId, fromAgent, toAgent, message, null, Instant.now(), null);
        boolean created;
        try {
            created = repository.saveCommunication(communication);
        } catch (Exception e) {
            log.warn("Failed to persist communication {}: {}", communication.id(), e.getMessage(), e);
            safeCountFailure();
            return Optional.empty();
        }
        if (!created) {
            log.debug("Communication {} already recorded", communication.id());
            return Optional.empty();
        }
        metrics.recordCommunication();
        log.info("Agent {} addressed {} in step {}", fromAgent, toAgent, stepId);
        record(executionId, stepId, fromAgent, AuditAction.COMMUNICATION_SENT, "sent",
                "@" + toAgent + ": " + message);
        return Optional.of(communication);
    }

    /**
     * Attaches a response to a communication. Does nothing if a response is already attached.
     *
     * @return true if this call attached the response
     * @throws CommunicationNotFoundException if no such communication exists
     */
    public boolean attachResponse(String communicationId, String response) {
        Optional<CommunicationRecord> answered = repository.attachResponse(communicationId, response, Instant.now());
        if (answered.isEmpty()) {
            if (repository.findCommunication(communicationId).isEmpty()) {
                throw new CommunicationNotFoundException(communicationId);
            }
            log.debug("Communication {} already answered; ignoring duplicate response", communicationId);
            return false;
        }
        var c = answered.get();
        record(c.executionId(), c.stepId(), c.toAgent(), AuditAction.COMMUNICATION_ANSWERED, "answered",
                "Response to " + c.fromAgent());
        return true;
    }

    public Optional<CommunicationRecord> communication(String communicationId) {
        return repository.findCommunication(communicationId);
    }

    public List<CommunicationRecord> communications(String executionId) {
        return repository.findCommunicationsByExecution(executionId);
    }

    /**
     * Renders the audit log of an execution.
     *
     * @param format "csv" (default when blank) or "pdf"
     * @throws UnsupportedExportFormatException for pdf (declared, not implemented) or unknown formats
     */
    public AuditExport export(String executionId, String format) {
        ExportFormat exportFormat;
        try {
            exportFormat = ExportFormat.parse(format);
        } catch (IllegalArgumentException e) {
            throw new UnsupportedExportFormatException("Unknown export format: " + format, false, supportedFormats());
        }
        if (exportFormat == ExportFormat.PDF) {
            throw new UnsupportedExportFormatException("PDF export is not implemented yet", true, supportedFormats());
        }
        List<AuditRecord> records = query(executionId);
        return new AuditExport(executionId, exportFormat, CsvAuditExporter.export(records), records.size());
    }

    private static List<String> supportedFormats() {
        return Arrays.stream(ExportFormat.values())
                .filter(f -> f != ExportFormat.PDF)
                .map(f -> f.name().toLowerCase())
                .toList();
    }

    private static Map<String, Long> countBy(List<AuditRecord> records, Function<AuditRecord, String> key) {
        return records.stream()
                .map(key)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), TreeMap::new, Collectors.counting()));
    }

    private void safeCountFailure() {
        try {
            metrics.recordAuditFailure();
        } catch (RuntimeException e) {
            log.debug("Could not count audit failure: {}", e.getMessage());
        }
    }
}
