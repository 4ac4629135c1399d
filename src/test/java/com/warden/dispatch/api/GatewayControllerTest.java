package com.warden.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.gateway.GatewayConfigService;
import com.warden.core.gateway.SecurityGateway;
import com.warden.core.model.ContentType;
import com.warden.core.model.ExecutionResult;
import com.warden.core.model.ExitClassification;
import com.warden.core.model.GatewayResult;
import com.warden.core.model.IsolationLevel;
import com.warden.core.model.SecurityContext;
import com.warden.core.model.ValidationResult;
import com.warden.core.model.Violation;
import com.warden.core.model.ViolationKind;
import com.warden.core.policy.GatewayProperties;
import com.warden.core.policy.PolicyConfigurationException;
import com.warden.core.policy.PolicyHolder;
import com.warden.core.policy.PolicySnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(GatewayController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class GatewayControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SecurityGateway gateway;

    @MockitoBean
    private GatewayConfigService configService;

    private static ValidationResult approved(ContentType type) {
        return new ValidationResult(true, type, List.of(), 0.0, 1_000, "ab".repeat(32));
    }

    // ── POST /api/v1/gateway/execute ─────────────────────────────────

    @Test
    @DisplayName("POST /execute returns the execution outcome and maps the request onto a context")
    void executeApproved() throws Exception {
        var execution = ExecutionResult.success("-0.25", IsolationLevel.MICRO_VM, "sbx-1", 12, 4096);
        when(gateway.validateAndExecute(anyString(), any(), any())).thenReturn(
                new GatewayResult("req-1", approved(ContentType.EXPRESSION), execution, "executed at MICRO_VM",
                        false, Map.of(), 20));

        mockMvc.perform(post("/api/v1/gateway/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"content":"mean(close)","content_type":"EXPRESSION","component":"factor-mining",
                                 "request_id":"req-1","isolation_level":"MICRO_VM","max_memory_mb":128,
                                 "timeout_seconds":5,"inputs":{"close":[1.0,2.0]}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requestId").value("req-1"))
                .andExpect(jsonPath("$.approved").value(true))
                .andExpect(jsonPath("$.succeeded").value(true))
                .andExpect(jsonPath("$.remediation").value("NONE"))
                .andExpect(jsonPath("$.execution.output").value("-0.25"))
                .andExpect(jsonPath("$.execution.classification").value("SUCCESS"));

        var captor = ArgumentCaptor.forClass(SecurityContext.class);
        verify(gateway).validateAndExecute(eq("mean(close)"), eq(ContentType.EXPRESSION), captor.capture());
        SecurityContext context = captor.getValue();
        assertEquals("req-1", context.requestId());
        assertEquals("factor-mining", context.componentName());
        assertEquals(IsolationLevel.MICRO_VM, context.isolationLevel());
        assertEquals(128, context.budget().maxMemoryMb());
        assertEquals(Duration.ofSeconds(5), context.timeout());
        assertEquals(2, context.inputs().get("close").length);
    }

    @Test
    @DisplayName("POST /execute answers 200 with a remediation hint when the execution breached a limit")
    void executeBreach() throws Exception {
        var execution = ExecutionResult.failure(ExitClassification.MEMORY_EXCEEDED, "peak above 64MB",
                IsolationLevel.CONTAINER, "sbx-2", 40, 70_000_000, 137);
        when(gateway.validateAndExecute(anyString(), any(), any())).thenReturn(
                new GatewayResult("req-2", approved(ContentType.CODE), execution, "MEMORY_EXCEEDED: peak above 64MB",
                        false, Map.of(), 60));

        mockMvc.perform(post("/api/v1/gateway/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"content":"x = 1","content_type":"CODE","component":"factor-mining"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.succeeded").value(false))
                .andExpect(jsonPath("$.remediation").value("SMALLER_BUDGET_CLASS"))
                .andExpect(jsonPath("$.execution.classification").value("MEMORY_EXCEEDED"));
    }

    @Test
    @DisplayName("POST /execute without content returns 400 with field details")
    void executeMissingContent() throws Exception {
        mockMvc.perform(post("/api/v1/gateway/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"content_type":"CODE","component":"factor-mining"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.content").exists());

        verify(gateway, never()).validateAndExecute(any(), any(), any());
    }

    @Test
    @DisplayName("POST /execute with an unknown content type returns 400")
    void executeUnknownType() throws Exception {
        mockMvc.perform(post("/api/v1/gateway/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"content":"x","content_type":"SHELL","component":"factor-mining"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    // ── POST /api/v1/gateway/validate ────────────────────────────────

    @Test
    @DisplayName("POST /validate returns violations and a regenerate hint for rejected content")
    void validateRejected() throws Exception {
        var validation = new ValidationResult(false, ContentType.CODE,
                List.of(Violation.of(ViolationKind.BLACKLIST_DETECTED, "Denied module import: os")),
                0.9, 1_000, "cd".repeat(32));
        when(gateway.validateOnly(anyString(), any(), any())).thenReturn(
                new GatewayResult("req-3", validation, null, "rejected", false, Map.of(), 3));

        mockMvc.perform(post("/api/v1/gateway/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"content":"import os","content_type":"CODE","component":"factor-mining"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.approved").value(false))
                .andExpect(jsonPath("$.remediation").value("REGENERATE_CONTENT"))
                .andExpect(jsonPath("$.validation.violations[0].kind").value("BLACKLIST_DETECTED"))
                .andExpect(jsonPath("$.execution").doesNotExist());
    }

    // ── Policy and configuration ─────────────────────────────────────

    @Test
    @DisplayName("POST /policy returns the applied version")
    void reloadPolicy() throws Exception {
        PolicySnapshot snapshot = new PolicyHolder(new GatewayProperties(), new ObjectMapper())
                .reload("{\"version\":\"7\"}");
        when(gateway.reloadPolicy(anyString(), eq("api"))).thenReturn(snapshot);

        mockMvc.perform(post("/api/v1/gateway/policy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"version\":\"7\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPLIED"))
                .andExpect(jsonPath("$.version").value("7"));
    }

    @Test
    @DisplayName("POST /policy with a rejected document returns 422")
    void reloadPolicyRejected() throws Exception {
        when(gateway.reloadPolicy(anyString(), anyString()))
                .thenThrow(new PolicyConfigurationException("allow-list and deny-list overlap: eval"));

        mockMvc.perform(post("/api/v1/gateway/policy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"version\":\"8\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("POLICY_REJECTED"))
                .andExpect(jsonPath("$.path").value("/api/v1/gateway/policy"));
    }

    @Test
    @DisplayName("GET /config returns the effective configuration")
    void config() throws Exception {
        when(configService.configuration()).thenReturn(Map.of("degradation", Map.of("floor", "NONE_AST_ONLY")));

        mockMvc.perform(get("/api/v1/gateway/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.degradation.floor").value("NONE_AST_ONLY"));
    }

    @Test
    @DisplayName("unexpected errors return 500 without internals")
    void unexpectedError() throws Exception {
        when(gateway.validateOnly(anyString(), any(), any())).thenThrow(new IllegalStateException("secret detail"));

        mockMvc.perform(post("/api/v1/gateway/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"content":"x = 1","content_type":"CODE","component":"factor-mining"}
                                """))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }
}
