package com.warden.core.resource;

import com.warden.core.model.IsolationLevel;
import com.warden.core.model.ResourceBudget;
import com.warden.core.policy.PolicyHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a logical resource budget into enforcement directives for a backend.
 */
@Component
public class ResourceLimiter {

    private static final Logger log = LoggerFactory.getLogger(ResourceLimiter.class);

    static final long CPU_PERIOD_MICROS = 100_000;

    private final PolicyHolder policyHolder;

    public ResourceLimiter(PolicyHolder policyHolder) {
        this.policyHolder = policyHolder;
    }

    /**
     * Caps {@code requested} to the ceiling configured for {@code level} and derives the plan.
     */
    public EnforcementPlan plan(ResourceBudget requested, IsolationLevel level) {
        ResourceBudget ceiling = policyHolder.current().ceilingFor(level);
        ResourceBudget effective = requested.capTo(ceiling);
        if (!effective.equals(requested)) {
            log.info("Resource budget {} capped to {} for {}", requested, effective, level);
        }
        long quota = Math.max(1_000, Math.round(effective.maxCpuCores() * CPU_PERIOD_MICROS));
        long wallSeconds = (effective.maxWallTime().toMillis() + 999) / 1000;
        return new EnforcementPlan(
                effective,
                level,
                effective.maxMemoryBytes(),
                Math.round(effective.maxCpuCores() * 1_000_000_000L),
                CPU_PERIOD_MICROS,
                quota,
                effective.maxProcesses(),
                effective.maxWallTime(),
                wallSeconds + 1);
    }
}
