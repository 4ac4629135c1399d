package com.warden.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.core.model.ContentType;
import com.warden.core.model.IsolationLevel;
import com.warden.core.model.ResourceBudget;
import com.warden.core.model.SecurityContext;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Duration;
import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/gateway/validate and /execute.
 *
 * @param content        untrusted content
 * @param contentType    CODE, EXPRESSION, PROMPT or CONFIG
 * @param component      calling component name
 * @param requestId      optional caller-supplied id; generated when absent
 * @param userId         nullable, defaults to "system"
 * @param sessionId      nullable
 * @param isolationLevel nullable, defaults to CONTAINER
 * @param maxMemoryMb    nullable budget override
 * @param maxCpuCores    nullable budget override
 * @param maxProcesses   nullable budget override
 * @param timeoutSeconds nullable, defaults to 30
 * @param inputs         named numeric series for EXPRESSION content
 */
public record GatewayRequest(
    @NotBlank String content,
    @NotNull @JsonProperty("content_type") ContentType contentType,
    @NotBlank String component,
    @JsonProperty("request_id") String requestId,
    @JsonProperty("user_id") String userId,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("isolation_level") IsolationLevel isolationLevel,
    @Positive @JsonProperty("max_memory_mb") Integer maxMemoryMb,
    @Positive @JsonProperty("max_cpu_cores") Double maxCpuCores,
    @Positive @JsonProperty("max_processes") Integer maxProcesses,
    @Positive @JsonProperty("timeout_seconds") Integer timeoutSeconds,
    Map<String, double[]> inputs
) {

    public SecurityContext toContext() {
        Duration timeout = Duration.ofSeconds(timeoutSeconds != null ? timeoutSeconds : 30);
        var defaults = ResourceBudget.DEFAULT;
        var budget = new ResourceBudget(
                maxMemoryMb != null ? maxMemoryMb : defaults.maxMemoryMb(),
                maxCpuCores != null ? maxCpuCores : defaults.maxCpuCores(),
                maxProcesses != null ? maxProcesses : defaults.maxProcesses(),
                timeout);
        return SecurityContext.builder(component)
                .requestId(requestId)
                .userId(userId)
                .sessionId(sessionId)
                .isolationLevel(isolationLevel)
                .budget(budget)
                .timeout(timeout)
                .inputs(inputs)
                .build();
    }
}
