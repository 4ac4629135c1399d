package com.warden.core.model;

/**
 * How a sandboxed execution ended.
 */
public enum ExitClassification {
    SUCCESS,
    EXECUTION_FAILED,
    TIMEOUT_EXCEEDED,
    MEMORY_EXCEEDED,
    PROCESS_LIMIT_EXCEEDED,
    NETWORK_VIOLATION,
    SANDBOX_CREATION_FAILED,
    POOL_EXHAUSTED,
    /** Approved but run at NONE_AST_ONLY, so nothing was executed. */
    NOT_EXECUTED;

    public ViolationKind toViolationKind() {
        return switch (this) {
            case EXECUTION_FAILED -> ViolationKind.EXECUTION_FAILED;
            case TIMEOUT_EXCEEDED -> ViolationKind.TIMEOUT_EXCEEDED;
            case MEMORY_EXCEEDED -> ViolationKind.MEMORY_EXCEEDED;
            case PROCESS_LIMIT_EXCEEDED -> ViolationKind.PROCESS_LIMIT_EXCEEDED;
            case NETWORK_VIOLATION -> ViolationKind.NETWORK_VIOLATION;
            case SANDBOX_CREATION_FAILED -> ViolationKind.SANDBOX_CREATION_FAILED;
            case POOL_EXHAUSTED -> ViolationKind.POOL_EXHAUSTED;
            case SUCCESS, NOT_EXECUTED -> null;
        };
    }

    /** Remediation the caller should apply to a later, independent request. */
    public Remediation remediation() {
        return switch (this) {
            case TIMEOUT_EXCEEDED, PROCESS_LIMIT_EXCEEDED, NETWORK_VIOLATION -> Remediation.DO_NOT_RETRY;
            case MEMORY_EXCEEDED -> Remediation.SMALLER_BUDGET_CLASS;
            case EXECUTION_FAILED -> Remediation.REGENERATE_CONTENT;
            case POOL_EXHAUSTED, SANDBOX_CREATION_FAILED -> Remediation.RETRY_LATER;
            case SUCCESS, NOT_EXECUTED -> Remediation.NONE;
        };
    }

    public enum Remediation {
        NONE,
        DO_NOT_RETRY,
        SMALLER_BUDGET_CLASS,
        REGENERATE_CONTENT,
        RETRY_LATER
    }
}
