package com.warden.core.audit;

public enum AuditEventType {
    /** A complete request: validation, execution and degradation outcome. */
    REQUEST,
    NETWORK_ACCESS,
    DEGRADATION,
    SANDBOX_LIFECYCLE,
    POLICY_CHANGE,
    ALERT
}
