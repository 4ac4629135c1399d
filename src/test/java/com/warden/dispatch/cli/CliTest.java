package com.warden.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.audit.AuditQueryService;
import com.warden.core.audit.IntegrityReport;
import com.warden.core.gateway.GatewayConfigService;
import com.warden.core.gateway.SecurityGateway;
import com.warden.core.health.HealthCheckService;
import com.warden.core.health.HealthStatus;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the Warden CLI command structure.
 * These tests exercise picocli directly without Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private SecurityGateway gateway;
    private AuditQueryService auditQueryService;
    private HealthCheckService healthCheckService;
    private GatewayConfigService configService;

    @BeforeEach
    void setUp() {
        gateway = mock(SecurityGateway.class);
        auditQueryService = mock(AuditQueryService.class);
        healthCheckService = mock(HealthCheckService.class);
        configService = mock(GatewayConfigService.class);
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ValidateCommand.class) {
                    return (K) new ValidateCommand(gateway);
                }
                if (cls == ExecuteCommand.class) {
                    return (K) new ExecuteCommand(gateway);
                }
                if (cls == AuditCommand.Verify.class) {
                    return (K) new AuditCommand.Verify(auditQueryService);
                }
                if (cls == AuditCommand.Recent.class) {
                    return (K) new AuditCommand.Recent(auditQueryService);
                }
                if (cls == PolicyCommand.class) {
                    return (K) new PolicyCommand(configService, new ObjectMapper());
                }
                if (cls == PolicyCommand.Check.class) {
                    return (K) new PolicyCommand.Check(gateway);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new WardenCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static ValidationResult approved(ContentType type) {
        return new ValidationResult(true, type, List.of(), 0.0, 1_000, "ab".repeat(32));
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            for (String sub : List.of("validate", "execute", "audit", "policy", "health", "serve", "help")) {
                assertTrue(output.contains(sub), "Help should list '" + sub + "' subcommand");
            }
            assertTrue(output.contains("Security gateway for AI-generated content"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Warden 0.1.0"));
        }

        @Test
        @DisplayName("execute --help shows content options")
        void executeHelpOutput() {
            CliResult result = execute("execute", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--type"));
            assertTrue(result.output().contains("--memory-mb"));
            assertTrue(result.output().contains("--level"));
        }
    }

    // =====================================================================
    //  validate / execute
    // =====================================================================

    @Nested
    @DisplayName("Content commands")
    class ContentTests {

        @Test
        @DisplayName("validate exits 1 and lists violations for rejected content")
        void validateRejected() {
            var validation = new ValidationResult(false, ContentType.CODE,
                    List.of(Violation.of(ViolationKind.BLACKLIST_DETECTED, "Denied module import: os")),
                    0.9, 1_000, "cd".repeat(32));
            when(gateway.validateOnly(anyString(), any(), any())).thenReturn(
                    new GatewayResult("req-1", validation, null, "rejected", false, Map.of(), 2));

            CliResult result = execute("validate", "-t", "CODE", "-e", "import os");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Validation rejected"));
            assertTrue(result.output().contains("Denied module import: os"));
        }

        @Test
        @DisplayName("execute exits 0 and prints the output on success")
        void executeSuccess() {
            when(gateway.validateAndExecute(anyString(), any(), any())).thenReturn(new GatewayResult("req-2",
                    approved(ContentType.EXPRESSION),
                    ExecutionResult.success("0.5", IsolationLevel.CONTAINER, "sbx-1", 10, 2048),
                    "executed at CONTAINER", false, Map.of(), 15));

            CliResult result = execute("execute", "-t", "EXPRESSION", "-e", "mean(close)",
                    "-l", "CONTAINER", "--memory-mb", "128", "--timeout", "5", "-i", "close=1,2,3");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Output: 0.5"));

            var captor = ArgumentCaptor.forClass(SecurityContext.class);
            verify(gateway).validateAndExecute(eq("mean(close)"), eq(ContentType.EXPRESSION), captor.capture());
            SecurityContext context = captor.getValue();
            assertEquals("cli", context.componentName());
            assertEquals(IsolationLevel.CONTAINER, context.isolationLevel());
            assertEquals(128, context.budget().maxMemoryMb());
            assertEquals(Duration.ofSeconds(5), context.timeout());
            assertArrayEquals(new double[]{1, 2, 3}, context.inputs().get("close"));
        }

        @Test
        @DisplayName("execute exits 2 with a remediation hint when execution failed")
        void executeFailure() {
            when(gateway.validateAndExecute(anyString(), any(), any())).thenReturn(new GatewayResult("req-3",
                    approved(ContentType.CODE),
                    ExecutionResult.failure(ExitClassification.TIMEOUT_EXCEEDED, "deadline", IsolationLevel.CONTAINER,
                            "sbx-2", 30_000, 0, -1),
                    "TIMEOUT_EXCEEDED: deadline", false, Map.of(), 30_001));

            CliResult result = execute("execute", "-t", "CODE", "-e", "while True: pass");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("TIMEOUT_EXCEEDED"));
            assertTrue(result.output().contains("Remediation: DO_NOT_RETRY"));
        }

        @Test
        @DisplayName("content is read from a file")
        void readsFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("factor.txt");
            Files.writeString(file, "rank(close)");
            when(gateway.validateOnly(anyString(), any(), any())).thenReturn(
                    new GatewayResult("req-4", approved(ContentType.EXPRESSION), null, "approved", false, Map.of(), 1));

            CliResult result = execute("validate", "-t", "EXPRESSION", file.toString());

            assertEquals(0, result.exitCode());
            verify(gateway).validateOnly(eq("rank(close)"), eq(ContentType.EXPRESSION), any());
        }

        @Test
        @DisplayName("missing --type is a usage error")
        void missingType() {
            CliResult result = execute("validate", "-e", "x = 1");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("--type"));
        }

        @Test
        @DisplayName("no content at all fails without calling the gateway")
        void noContent() {
            CliResult result = execute("validate", "-t", "CODE");
            assertNotEquals(0, result.exitCode());
            assertTrue(result.output().contains("No content"));
        }

        @Test
        @DisplayName("non-numeric inputs are rejected")
        void nonNumericInput() {
            assertThrows(IllegalArgumentException.class,
                    () -> ContentOptions.parseInputs(Map.of("close", "1,two,3")));
        }
    }

    // =====================================================================
    //  audit / policy / health
    // =====================================================================

    @Nested
    @DisplayName("Operational commands")
    class OperationalTests {

        @Test
        @DisplayName("audit verify exits 1 and names tampered lines")
        void auditVerifyTampered() {
            var date = LocalDate.of(2026, 3, 1);
            when(auditQueryService.verify(date))
                    .thenReturn(new IntegrityReport(date, "audit_20260301.jsonl", 5, List.of(3)));

            CliResult result = execute("audit", "verify", "--date", "2026-03-01");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("tampered lines [3]"));
        }

        @Test
        @DisplayName("audit recent reports an empty trail")
        void auditRecentEmpty() {
            when(auditQueryService.recent(anyInt())).thenReturn(List.of());

            CliResult result = execute("audit", "recent", "-n", "5");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No audit events"));
            verify(auditQueryService).recent(5);
        }

        @Test
        @DisplayName("policy prints the effective configuration as JSON")
        void policyPrintsConfiguration() {
            when(configService.configuration()).thenReturn(Map.of("degradation", Map.of("floor", "NONE_AST_ONLY")));

            CliResult result = execute("policy");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("\"floor\" : \"NONE_AST_ONLY\""), result.output());
        }

        @Test
        @DisplayName("policy check accepts a valid document")
        void policyCheckAccepted(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("policy.json");
            Files.writeString(file, "{\"version\":\"9\"}");
            var snapshot = new PolicyHolder(new GatewayProperties(), new ObjectMapper()).reload("{\"version\":\"9\"}");
            when(gateway.reloadPolicy(anyString(), eq("cli"))).thenReturn(snapshot);

            CliResult result = execute("policy", "check", file.toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Policy accepted, version 9"));
        }

        @Test
        @DisplayName("policy check exits 1 for a rejected document")
        void policyCheckRejected(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("policy.json");
            Files.writeString(file, "{}");
            when(gateway.reloadPolicy(anyString(), anyString()))
                    .thenThrow(new PolicyConfigurationException("policy version is required"));

            CliResult result = execute("policy", "check", file.toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Policy rejected: policy version is required"));
        }

        @Test
        @DisplayName("health exits 1 when a component is down")
        void healthDown() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("policy", HealthStatus.Status.UP, "Policy version 1 active", Map.of()),
                    new HealthStatus("sandboxes", HealthStatus.Status.DOWN, "No sandbox pool configured", Map.of())));

            CliResult result = execute("health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("one or more components down"));
        }

        @Test
        @DisplayName("health exits 0 when running degraded")
        void healthDegraded() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("degradation", HealthStatus.Status.DEGRADED, "Levels down until reset: MICRO_VM",
                            Map.of())));

            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("running degraded"));
        }
    }
}
