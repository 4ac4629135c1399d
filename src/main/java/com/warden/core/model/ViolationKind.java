package com.warden.core.model;

/**
 * Closed error taxonomy shared by validation, execution and infrastructure failures.
 */
public enum ViolationKind {
    /** Parse error or content-type rule violation. */
    VALIDATION_FAILED,
    /** Explicit denied call, module or namespace. */
    BLACKLIST_DETECTED,
    SANDBOX_CREATION_FAILED,
    TIMEOUT_EXCEEDED,
    MEMORY_EXCEEDED,
    PROCESS_LIMIT_EXCEEDED,
    NETWORK_VIOLATION,
    /** Sandboxed code raised or crashed. */
    EXECUTION_FAILED,
    POOL_EXHAUSTED,
    /** Non-fatal; buffered and retried. */
    AUDIT_WRITE_FAILED;

    /** Resource and network breaches are surfaced to the caller and never retried. */
    public boolean isResourceBreach() {
        return this == TIMEOUT_EXCEEDED || this == MEMORY_EXCEEDED
                || this == PROCESS_LIMIT_EXCEEDED || this == NETWORK_VIOLATION;
    }
}
