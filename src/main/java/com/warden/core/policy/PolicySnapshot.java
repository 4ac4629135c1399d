package com.warden.core.policy;

import com.warden.core.model.ContentType;
import com.warden.core.model.IsolationLevel;
import com.warden.core.model.ResourceBudget;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, validated view of the active gateway policy. Never mutated; a reload builds a new
 * snapshot and swaps it in through {@link PolicyHolder}.
 */
public record PolicySnapshot(
    String version,
    Map<ContentType, CapabilitySet> capabilities,
    ValidationLimits limits,
    List<String> maliciousPatterns,
    List<String> injectionMarkers,
    NetworkPolicy network,
    Map<IsolationLevel, ResourceBudget> ceilings,
    Map<IsolationLevel, Integer> poolTargets,
    Duration defaultTimeout,
    int auditRetentionDays,
    Instant loadedAt
) {

    public PolicySnapshot {
        if (version == null || version.isBlank()) {
            throw new PolicyConfigurationException("policy version is required");
        }
        var caps = new EnumMap<ContentType, CapabilitySet>(ContentType.class);
        for (ContentType type : ContentType.values()) {
            CapabilitySet set = capabilities.getOrDefault(type, CapabilitySet.EMPTY);
            Set<String> overlap = set.overlaps();
            if (!overlap.isEmpty()) {
                throw new PolicyConfigurationException(
                        "identifiers both allowed and denied for " + type + ": " + overlap);
            }
            caps.put(type, set);
        }
        capabilities = Map.copyOf(caps);
        maliciousPatterns = List.copyOf(maliciousPatterns);
        injectionMarkers = List.copyOf(injectionMarkers);
        ceilings = Map.copyOf(ceilings);
        for (IsolationLevel level : IsolationLevel.values()) {
            if (level.executes() && !ceilings.containsKey(level)) {
                throw new PolicyConfigurationException("no resource ceiling for " + level);
            }
        }
        poolTargets = Map.copyOf(poolTargets);
        if (poolTargets.values().stream().anyMatch(t -> t < 0)) {
            throw new PolicyConfigurationException("pool targets must not be negative");
        }
        if (defaultTimeout == null || defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new PolicyConfigurationException("defaultTimeout must be positive");
        }
        if (auditRetentionDays <= 0) {
            throw new PolicyConfigurationException("auditRetentionDays must be positive");
        }
        loadedAt = loadedAt == null ? Instant.now() : loadedAt;
    }

    public CapabilitySet capabilitiesFor(ContentType type) {
        return capabilities.get(type);
    }

    public ResourceBudget ceilingFor(IsolationLevel level) {
        return ceilings.getOrDefault(level, ResourceBudget.DEFAULT);
    }

    public int poolTargetFor(IsolationLevel level) {
        return poolTargets.getOrDefault(level, 0);
    }

    /**
     * Applies a policy document on top of this snapshot. Sections absent from the document keep
     * their current values. The result is validated like any other snapshot.
     */
    public PolicySnapshot apply(PolicyDocument doc) {
        var caps = new EnumMap<ContentType, CapabilitySet>(capabilities);
        if (doc.capabilities() != null) {
            doc.capabilities().forEach((type, c) -> caps.put(type, new CapabilitySet(
                    orEmpty(c.allowedCalls()), orEmpty(c.allowedModules()),
                    orEmpty(c.deniedCalls()), orEmpty(c.deniedModules()))));
        }
        var newCeilings = new LinkedHashMap<>(ceilings);
        if (doc.ceilings() != null) {
            doc.ceilings().forEach((level, c) -> newCeilings.put(level, new ResourceBudget(
                    c.maxMemoryMb(), c.maxCpuCores(), c.maxProcesses(),
                    Duration.ofSeconds(c.maxWallTimeSeconds()))));
        }
        var newTargets = new LinkedHashMap<>(poolTargets);
        if (doc.poolTargets() != null) {
            newTargets.putAll(doc.poolTargets());
        }
        NetworkPolicy net = network;
        if (doc.network() != null) {
            var n = doc.network();
            net = new NetworkPolicy(
                    n.allowedDomains() != null ? Set.copyOf(n.allowedDomains()) : network.allowedDomains(),
                    n.denyRanges() != null ? n.denyRanges() : network.denyRanges(),
                    n.repeatedDenialThreshold() != null ? n.repeatedDenialThreshold() : network.repeatedDenialThreshold());
        }
        return new PolicySnapshot(
                doc.version(),
                caps,
                doc.limits() != null ? doc.limits() : limits,
                doc.maliciousPatterns() != null ? doc.maliciousPatterns() : maliciousPatterns,
                doc.injectionMarkers() != null ? doc.injectionMarkers() : injectionMarkers,
                net,
                newCeilings,
                newTargets,
                doc.defaultTimeoutSeconds() != null ? Duration.ofSeconds(doc.defaultTimeoutSeconds()) : defaultTimeout,
                doc.auditRetentionDays() != null ? doc.auditRetentionDays() : auditRetentionDays,
                Instant.now());
    }

    public PolicySnapshot withNetwork(NetworkPolicy newNetwork) {
        return new PolicySnapshot(version, capabilities, limits, maliciousPatterns, injectionMarkers,
                newNetwork, ceilings, poolTargets, defaultTimeout, auditRetentionDays, Instant.now());
    }

    /** Flat view for the configuration endpoint and CLI. */
    public Map<String, Object> describe() {
        var view = new LinkedHashMap<String, Object>();
        view.put("version", version);
        view.put("loadedAt", loadedAt.toString());
        var caps = new LinkedHashMap<String, Object>();
        capabilities.forEach((type, set) -> caps.put(type.name(), Map.of(
                "allowedCalls", set.allowedCalls().size(),
                "allowedModules", set.allowedModules().size(),
                "deniedCalls", set.deniedCalls().size(),
                "deniedModules", set.deniedModules().size())));
        view.put("capabilities", caps);
        view.put("limits", limits);
        view.put("maliciousPatterns", maliciousPatterns.size());
        view.put("injectionMarkers", injectionMarkers.size());
        view.put("allowedDomains", network.allowedDomains().stream().sorted().toList());
        view.put("denyRanges", network.denyRanges());
        var ceilingView = new LinkedHashMap<String, Object>();
        ceilings.forEach((level, b) -> ceilingView.put(level.name(), Map.of(
                "maxMemoryMb", b.maxMemoryMb(),
                "maxCpuCores", b.maxCpuCores(),
                "maxProcesses", b.maxProcesses(),
                "maxWallTimeSeconds", b.maxWallTime().toSeconds())));
        view.put("ceilings", ceilingView);
        view.put("poolTargets", poolTargets);
        view.put("defaultTimeoutSeconds", defaultTimeout.toSeconds());
        view.put("auditRetentionDays", auditRetentionDays);
        return view;
    }

    private static Set<String> orEmpty(List<String> values) {
        return values == null ? Set.of() : Set.copyOf(values);
    }
}
