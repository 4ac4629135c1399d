package com.warden.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable per-request security context. Owned by the request that carries it.
 *
 * @param requestId      unique id of the request (generated when not supplied)
 * @param componentName  calling component, e.g. "factor-mining", "prompt-evolution"
 * @param userId         user or service identity
 * @param sessionId      session identifier, may be empty
 * @param isolationLevel requested isolation level
 * @param budget         resource budget for execution
 * @param timeout        single deadline governing pool wait, execution and the whole request
 * @param inputs         named numeric series made available to EXPRESSION content
 */
public record SecurityContext(
    String requestId,
    String componentName,
    String userId,
    String sessionId,
    IsolationLevel isolationLevel,
    ResourceBudget budget,
    Duration timeout,
    Map<String, double[]> inputs
) implements Serializable {

    public SecurityContext {
        if (componentName == null || componentName.isBlank()) {
            throw new IllegalArgumentException("componentName is required");
        }
        requestId = requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
        userId = userId == null || userId.isBlank() ? "system" : userId;
        sessionId = sessionId == null ? "" : sessionId;
        isolationLevel = isolationLevel == null ? IsolationLevel.CONTAINER : isolationLevel;
        budget = budget == null ? ResourceBudget.DEFAULT : budget;
        timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        inputs = inputs == null ? Map.of() : Map.copyOf(inputs);
    }

    public static Builder builder(String componentName) {
        return new Builder(componentName);
    }

    public SecurityContext withIsolationLevel(IsolationLevel level) {
        return new SecurityContext(requestId, componentName, userId, sessionId, level, budget, timeout, inputs);
    }

    public static final class Builder {
        private final String componentName;
        private String requestId;
        private String userId;
        private String sessionId;
        private IsolationLevel isolationLevel;
        private ResourceBudget budget;
        private Duration timeout;
        private Map<String, double[]> inputs;

        private Builder(String componentName) {
            this.componentName = componentName;
        }

        public Builder requestId(String requestId) { this.requestId = requestId; return this; }
        public Builder userId(String userId) { this.userId = userId; return this; }
        public Builder sessionId(String sessionId) { this.sessionId = sessionId; return this; }
        public Builder isolationLevel(IsolationLevel level) { this.isolationLevel = level; return this; }
        public Builder budget(ResourceBudget budget) { this.budget = budget; return this; }
        public Builder timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Builder inputs(Map<String, double[]> inputs) { this.inputs = inputs; return this; }

        public SecurityContext build() {
            return new SecurityContext(requestId, componentName, userId, sessionId,
                    isolationLevel, budget, timeout, inputs);
        }
    }
}
