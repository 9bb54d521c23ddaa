package com.maestro.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Immutable audit entry for one state transition or action.
 * Ordered by timestamp, ties broken by {@code sequence}.
 *
 * @param id          record id
 * @param sequence    monotonically increasing number assigned at append time
 * @param executionId execution the record belongs to
 * @param stepId      step concerned (nullable for execution-level records)
 * @param agentId     agent concerned (nullable)
 * @param action      what happened (see {@link AuditAction})
 * @param status      status after the action
 * @param message     human-readable detail
 * @param timestamp   when the action happened
 */
public record AuditRecord(
    String id,
    long sequence,
    String executionId,
    String stepId,
    String agentId,
    String action,
    String status,
    String message,
    Instant timestamp
) implements Serializable {}
