package com.maestro.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of an execution for observers.
 *
 * @param executionId execution id
 * @param templateId  source template (nullable)
 * @param mode        dispatch policy
 * @param status      execution status
 * @param progress    derived progress figures
 * @param steps       per-step state in definition order
 * @param stages      dependency stages (step ids), stage 0 first
 * @param failures    failed step id to its last error message
 * @param createdAt   submission time
 * @param startedAt   start time (nullable)
 * @param completedAt terminal time (nullable)
 * @param durationMs  started-to-completed duration once terminal (nullable)
 */
public record ExecutionView(
    String executionId,
    String templateId,
    ExecutionMode mode,
    ExecutionStatus status,
    Progress progress,
    List<Step> steps,
    List<List<String>> stages,
    Map<String, String> failures,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Long durationMs
) implements Serializable {}
