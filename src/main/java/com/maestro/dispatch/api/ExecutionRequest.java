package com.maestro.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.maestro.core.model.StepDefinition;

import java.util.List;
import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/executions.
 *
 * @param templateId template to run; mutually exclusive with {@code steps}
 * @param steps      ad-hoc step definitions; mutually exclusive with {@code templateId}
 * @param mode       sequential, parallel or staged; nullable, defaults to the configured mode
 * @param context    working context handed to every step; nullable
 */
public record ExecutionRequest(
    @JsonProperty("template_id") String templateId,
    List<StepDefinition> steps,
    String mode,
    Map<String, Object> context
) {}
