package com.warden.core.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.warden.core.model.ContentType;
import com.warden.core.model.IsolationLevel;

import java.util.List;
import java.util.Map;

/**
 * Versioned policy document accepted for runtime reload. Every section except {@code version}
 * is optional; an absent section keeps the active value.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PolicyDocument(
    String version,
    Map<ContentType, Capabilities> capabilities,
    ValidationLimits limits,
    List<String> maliciousPatterns,
    List<String> injectionMarkers,
    Network network,
    Map<IsolationLevel, Ceiling> ceilings,
    Map<IsolationLevel, Integer> poolTargets,
    Long defaultTimeoutSeconds,
    Integer auditRetentionDays
) {

    public record Capabilities(
        List<String> allowedCalls,
        List<String> allowedModules,
        List<String> deniedCalls,
        List<String> deniedModules
    ) {}

    public record Network(
        List<String> allowedDomains,
        List<String> denyRanges,
        Integer repeatedDenialThreshold
    ) {}

    public record Ceiling(
        int maxMemoryMb,
        double maxCpuCores,
        int maxProcesses,
        long maxWallTimeSeconds
    ) {}
}
