package com.maestro.core.audit;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Aggregate figures over the audit log for a time window.
 *
 * @param from        inclusive lower bound (null = unbounded)
 * @param to          exclusive upper bound (null = unbounded)
 * @param totalRecords number of records in the window
 * @param executions  distinct executions touched
 * @param byAction    record count per action
 * @param byStatus    record count per status
 * @param byAgent     record count per agent (agent-less records excluded)
 * @param successRate percent of finished steps that completed, 0 when none finished
 */
public record AuditStatistics(
    Instant from,
    Instant to,
    long totalRecords,
    long executions,
    Map<String, Long> byAction,
    Map<String, Long> byStatus,
    Map<String, Long> byAgent,
    double successRate
) implements Serializable {}
