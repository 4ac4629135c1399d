package com.warden.sandbox;

import com.warden.core.model.ContentType;
import com.warden.core.model.SecurityContext;
import com.warden.core.policy.CapabilitySet;
import com.warden.core.resource.BreachCheck;
import com.warden.core.resource.EnforcementPlan;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Everything a backend needs to run validated content once.
 *
 * @param content     approved content
 * @param contentType CODE or EXPRESSION
 * @param context     security context of the request
 * @param plan        resource limits to enforce
 * @param deadline    hard deadline of the request
 * @param checks       extra breach conditions watched while the content runs
 * @param capabilities capability set the content was approved under, re-applied by the runtime
 */
public record ExecutionRequest(
    String content,
    ContentType contentType,
    SecurityContext context,
    EnforcementPlan plan,
    Instant deadline,
    List<BreachCheck> checks,
    CapabilitySet capabilities
) {

    public ExecutionRequest {
        checks = checks == null ? List.of() : List.copyOf(checks);
        capabilities = capabilities == null ? CapabilitySet.EMPTY : capabilities;
    }

    public String requestId() {
        return context.requestId();
    }

    /** Time left before the deadline, never negative. */
    public Duration remaining() {
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
