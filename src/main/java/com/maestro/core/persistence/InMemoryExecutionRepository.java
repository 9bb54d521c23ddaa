package com.maestro.core.persistence;

import com.maestro.core.model.AuditRecord;
import com.maestro.core.model.CommunicationRecord;
import com.maestro.core.model.Execution;
import com.maestro.core.model.ExecutionNotFoundException;
import com.maestro.core.model.ExecutionStatus;
import com.maestro.core.model.Step;
import com.maestro.core.model.StepStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Process-local {@link ExecutionRepository}. State is lost on restart.
 */
public class InMemoryExecutionRepository implements ExecutionRepository {

    static final Comparator<AuditRecord> AUDIT_ORDER =
            Comparator.comparing(AuditRecord::timestamp).thenComparingLong(AuditRecord::sequence);

    private final ConcurrentHashMap<String, Execution> executions = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<AuditRecord> audit = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<String, CommunicationRecord> communications = new ConcurrentHashMap<>();
    private final AtomicLong auditSequence = new AtomicLong();
    private final AtomicLong communicationSequence = new AtomicLong();
    private final ConcurrentHashMap<String, Long> communicationOrder = new ConcurrentHashMap<>();

    @Override
    public void save(Execution execution) {
        executions.put(execution.id(), execution);
    }

    @Override
    public Optional<Execution> findById(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public List<Execution> findAll() {
        return executions.values().stream()
                .sorted(Comparator.comparing(Execution::createdAt).reversed())
                .toList();
    }

    @Override
    public Optional<Execution> updateExecutionStatus(String executionId, ExecutionStatus to, Instant at) {
        var applied = new AtomicReference<Execution>();
        Execution result = executions.computeIfPresent(executionId, (id, current) -> {
            if (!current.status().canTransitionTo(to)) {
                return current;
            }
            Execution updated = current.withStatus(to, at);
            applied.set(updated);
            return updated;
        });
        if (result == null) {
            throw new ExecutionNotFoundException(executionId);
        }
        return Optional.ofNullable(applied.get());
    }

    @Override
    public Optional<Step> transitionStep(String executionId, String stepId, StepStatus to,
                                         UnaryOperator<Step> change) {
        var applied = new AtomicReference<Step>();
        Execution result = executions.computeIfPresent(executionId, (id, current) -> {
            Optional<Step> step = current.step(stepId);
            if (step.isEmpty() || !step.get().status().canTransitionTo(to)) {
                return current;
            }
            Step updated = change.apply(step.get().withStatus(to));
            applied.set(updated);
            return current.withStep(stepId, s -> updated);
        });
        if (result == null) {
            throw new ExecutionNotFoundException(executionId);
        }
        return Optional.ofNullable(applied.get());
    }

    @Override
    public AuditRecord appendAudit(AuditRecord record) {
        long seq = auditSequence.incrementAndGet();
        var stored = new AuditRecord("AUD-" + seq, seq, record.executionId(), record.stepId(), record.agentId(),
                record.action(), record.status(), record.message(), record.timestamp());
        audit.add(stored);
        return stored;
    }

    @Override
    public List<AuditRecord> findAuditByExecution(String executionId) {
        return audit.stream()
                .filter(r -> executionId.equals(r.executionId()))
                .sorted(AUDIT_ORDER)
                .toList();
    }

    @Override
    public List<AuditRecord> findAuditByAgent(String agentId, int limit) {
        return audit.stream()
                .filter(r -> agentId.equals(r.agentId()))
                .sorted(AUDIT_ORDER.reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public List<AuditRecord> findAuditBetween(Instant from, Instant to) {
        return audit.stream()
                .filter(r -> from == null || !r.timestamp().isBefore(from))
                .filter(r -> to == null || r.timestamp().isBefore(to))
                .sorted(AUDIT_ORDER)
                .toList();
    }

    @Override
    public boolean saveCommunication(CommunicationRecord record) {
        boolean inserted = communications.putIfAbsent(record.id(), record) == null;
        if (inserted) {
            communicationOrder.put(record.id(), communicationSequence.incrementAndGet());
        }
        return inserted;
    }

    @Override
    public Optional<CommunicationRecord> findCommunication(String communicationId) {
        return Optional.ofNullable(communications.get(communicationId));
    }

    @Override
    public Optional<CommunicationRecord> attachResponse(String communicationId, String response, Instant at) {
        var applied = new AtomicReference<CommunicationRecord>();
        communications.computeIfPresent(communicationId, (id, current) -> {
            if (current.isAnswered()) {
                return current;
            }
            CommunicationRecord answered = current.withResponse(response, at);
            applied.set(answered);
            return answered;
        });
        return Optional.ofNullable(applied.get());
    }

    @Override
    public List<CommunicationRecord> findCommunicationsByExecution(String executionId) {
        return communications.values().stream()
                .filter(c -> executionId.equals(c.executionId()))
                .sorted(Comparator.comparing(c -> communicationOrder.getOrDefault(c.id(), Long.MAX_VALUE)))
                .toList();
    }
}
