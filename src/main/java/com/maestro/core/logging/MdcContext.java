package com.maestro.core.logging;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Utility for managing Maestro-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setExecution(String executionId) {
        MDC.put("executionId", executionId);
    }

    public static void setStep(String executionId, String stepId, String agentId) {
        MDC.put("executionId", executionId);
        MDC.put("stepId", stepId);
        MDC.put("agentId", agentId);
    }

    public static void setStage(String executionId, int stage) {
        MDC.put("executionId", executionId);
        MDC.put("stage", String.valueOf(stage));
    }

    /** Copies the current MDC so it can be carried onto another thread. */
    public static Map<String, String> snapshot() {
        return MDC.getCopyOfContextMap();
    }

    public static void restore(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }

    public static void clear() {
        MDC.remove("executionId");
        MDC.remove("stepId");
        MDC.remove("agentId");
        MDC.remove("stage");
    }
}
