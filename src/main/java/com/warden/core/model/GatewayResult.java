package com.warden.core.model;

import java.io.Serializable;
import java.util.Map;
import java.util.Optional;

/**
 * What a caller receives from the gateway: the validation outcome and, if and only if the content
 * was approved, at most one execution outcome.
 *
 * @param requestId    request this result belongs to
 * @param validation   the terminal validation result
 * @param execution    execution result, null when not approved or when validation only was requested
 * @param reason       short human-readable summary
 * @param degraded     true when execution ran at a weaker level than requested
 * @param layerResults per-layer diagnostics (content type detection, AST validation, sandbox, degradation)
 * @param totalMillis  end-to-end time
 */
public record GatewayResult(
    String requestId,
    ValidationResult validation,
    ExecutionResult execution,
    String reason,
    boolean degraded,
    Map<String, Object> layerResults,
    long totalMillis
) implements Serializable {

    public GatewayResult {
        if (execution != null && !validation.approved()) {
            throw new IllegalArgumentException("execution result without approval");
        }
        layerResults = layerResults == null ? Map.of() : Map.copyOf(layerResults);
    }

    public boolean approved() {
        return validation.approved();
    }

    public Optional<ExecutionResult> executionResult() {
        return Optional.ofNullable(execution);
    }

    /** Approved and, if executed, executed successfully. */
    public boolean succeeded() {
        return approved() && (execution == null || execution.success());
    }
}
