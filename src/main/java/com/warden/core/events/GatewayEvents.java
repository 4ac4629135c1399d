package com.warden.core.events;

/**
 * Event type names published on the {@link EventBus}.
 */
public final class GatewayEvents {

    private GatewayEvents() {}

    public static final String VALIDATION_REQUESTED = "validation.requested";
    public static final String VALIDATION_COMPLETED = "validation.completed";
    public static final String SECURITY_VIOLATION_DETECTED = "security.violation_detected";
    public static final String SANDBOX_CREATED = "sandbox.created";
    public static final String SANDBOX_DESTROYED = "sandbox.destroyed";
    public static final String DEGRADATION_TRIGGERED = "degradation.triggered";
    public static final String DEGRADATION_RESET = "degradation.reset";
    public static final String ALERT_RAISED = "alert.raised";
}
