package com.warden.dispatch.api;

import com.warden.core.model.ExecutionResult;
import com.warden.core.model.GatewayResult;
import com.warden.core.model.ValidationResult;

import java.util.Map;

/**
 * Outbound JSON body of the gateway endpoints.
 */
public record GatewayResponse(
    String requestId,
    boolean approved,
    boolean succeeded,
    String reason,
    boolean degraded,
    String remediation,
    ValidationResult validation,
    ExecutionResult execution,
    Map<String, Object> layerResults,
    long totalMillis
) {

    public static GatewayResponse from(GatewayResult result) {
        String remediation = result.executionResult()
                .map(e -> e.remediation().name())
                .orElse(result.approved() ? "NONE" : "REGENERATE_CONTENT");
        return new GatewayResponse(result.requestId(), result.approved(), result.succeeded(), result.reason(),
                result.degraded(), remediation, result.validation(), result.execution(),
                result.layerResults(), result.totalMillis());
    }
}
