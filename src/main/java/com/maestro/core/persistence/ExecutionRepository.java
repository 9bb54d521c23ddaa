package com.maestro.core.persistence;

import com.maestro.core.model.AuditRecord;
import com.maestro.core.model.CommunicationRecord;
import com.maestro.core.model.Execution;
import com.maestro.core.model.ExecutionStatus;
import com.maestro.core.model.Step;
import com.maestro.core.model.StepStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable store for executions, their steps, audit records and communication records.
 * <p>
 * Every status change goes through {@link #updateExecutionStatus} or {@link #transitionStep},
 * which apply the change only when it is legal for the current stored status. Implementations
 * must make each of these calls atomic with respect to concurrent callers.
 * Backing store failures surface as {@link com.maestro.core.model.PersistenceException}.
 */
public interface ExecutionRepository {

    /** Inserts or fully replaces an execution and its steps. */
    void save(Execution execution);

    Optional<Execution> findById(String executionId);

    /** All executions, newest first. */
    List<Execution> findAll();

    /**
     * Moves an execution to {@code to} if the lifecycle permits it.
     *
     * @return the updated execution, or empty if the transition is illegal from the stored status
     * @throws com.maestro.core.model.ExecutionNotFoundException if the execution does not exist
     */
    Optional<Execution> updateExecutionStatus(String executionId, ExecutionStatus to, Instant at);

    /**
     * Moves a step to {@code to} if legal, applying {@code change} to the step in the same update.
     *
     * @param change extra field updates (timestamps, result, error); applied after the status change
     * @return the updated step, or empty if the transition is illegal from the stored status
     * @throws com.maestro.core.model.ExecutionNotFoundException if the execution does not exist
     */
    Optional<Step> transitionStep(String executionId, String stepId, StepStatus to, UnaryOperator<Step> change);

    /**
     * Appends an audit record, assigning its id and sequence number.
     *
     * @return the stored record
     */
    AuditRecord appendAudit(AuditRecord record);

    /** Audit records of one execution ordered by timestamp, ties broken by sequence. */
    List<AuditRecord> findAuditByExecution(String executionId);

    /** Most recent audit records concerning an agent, newest first. */
    List<AuditRecord> findAuditByAgent(String agentId, int limit);

    /** Audit records with {@code from <= timestamp < to}; either bound may be null. */
    List<AuditRecord> findAuditBetween(Instant from, Instant to);

    /**
     * Stores a communication record unless one with the same id exists.
     *
     * @return true if the record was inserted
     */
    boolean saveCommunication(CommunicationRecord record);

    Optional<CommunicationRecord> findCommunication(String communicationId);

    /**
     * Attaches a response to an unanswered communication.
     *
     * @return the answered record, or empty if it does not exist or already has a response
     */
    Optional<CommunicationRecord> attachResponse(String communicationId, String response, Instant at);

    /** Communications observed in an execution, in observation order. */
    List<CommunicationRecord> findCommunicationsByExecution(String executionId);
}
