package com.maestro.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Exportable summary of a finished (or running) execution.
 *
 * @param durationMinutes started-to-completed duration rounded to 2 decimals; null while running
 */
public record ExecutionReport(
    String executionId,
    String templateId,
    String templateName,
    String templateDescription,
    ExecutionStatus status,
    Instant startedAt,
    Instant completedAt,
    Double durationMinutes,
    List<Step> steps
) implements Serializable {}
