package com.warden.core.policy;

import java.util.List;
import java.util.Set;

/**
 * Outbound network policy. Deny ranges always win over the domain allow-list.
 *
 * @param allowedDomains          lower-case domains; subdomains of an entry are allowed too
 * @param denyRanges              CIDR ranges, invalid entries are skipped by the guard
 * @param repeatedDenialThreshold denied attempts from one context that make up a violation
 */
public record NetworkPolicy(
    Set<String> allowedDomains,
    List<String> denyRanges,
    int repeatedDenialThreshold
) {

    public NetworkPolicy {
        allowedDomains = Set.copyOf(allowedDomains);
        denyRanges = List.copyOf(denyRanges);
        if (repeatedDenialThreshold <= 0) {
            throw new PolicyConfigurationException("repeatedDenialThreshold must be positive");
        }
    }
}
