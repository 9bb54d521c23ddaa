package com.maestro.core.model;

/**
 * Action names written to {@link AuditRecord#action()}.
 */
public final class AuditAction {

    public static final String EXECUTION_STARTED = "execution_started";
    public static final String EXECUTION_COMPLETED = "execution_completed";
    public static final String EXECUTION_FAILED = "execution_failed";
    public static final String EXECUTION_CANCELLED = "execution_cancelled";
    public static final String EXECUTION_RECOVERED = "execution_recovered";
    public static final String STEP_STARTED = "step_started";
    public static final String STEP_ATTEMPT = "step_attempt";
    public static final String STEP_COMPLETED = "step_completed";
    public static final String STEP_FAILED = "step_failed";
    public static final String STEP_SKIPPED = "step_skipped";
    public static final String STEP_UNBLOCKED = "step_unblocked";
    public static final String COMMUNICATION_SENT = "communication_sent";
    public static final String COMMUNICATION_ANSWERED = "communication_answered";

    private AuditAction() {}
}
