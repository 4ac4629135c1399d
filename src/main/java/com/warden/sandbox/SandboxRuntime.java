package com.warden.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.model.ExecutionResult;
import com.warden.core.model.ExitClassification;
import com.warden.core.model.IsolationLevel;
import com.warden.core.resource.Breach;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bridge to the Python runner shipped as {@code sandbox-runtime/runner.py}: builds the payload
 * handed to it and turns its exit code and output into an {@link ExecutionResult}. Shared by all
 * executing backends so classification is identical across isolation levels.
 */
public class SandboxRuntime {

    private static final Logger log = LoggerFactory.getLogger(SandboxRuntime.class);

    public static final String RUNNER_RESOURCE = "sandbox-runtime/runner.py";

    static final int EXIT_OK = 0;
    static final int EXIT_BAD_INPUT = 2;
    static final int EXIT_MEMORY = 3;
    static final int EXIT_PROCESSES = 4;
    static final int EXIT_SIGKILL = 137;

    /** Below the kernel's per-argument limit of 128 KiB. */
    static final int ARG_CHUNK = 64 * 1024;

    private final ObjectMapper objectMapper;
    private final String runnerSource;
    private final int outputLimitBytes;

    public SandboxRuntime(ObjectMapper objectMapper, int outputLimitBytes) {
        this(objectMapper, loadRunner(), outputLimitBytes);
    }

    public SandboxRuntime(ObjectMapper objectMapper, String runnerSource, int outputLimitBytes) {
        this.objectMapper = objectMapper;
        this.runnerSource = runnerSource;
        this.outputLimitBytes = outputLimitBytes;
    }

    static String loadRunner() {
        try (InputStream in = SandboxRuntime.class.getClassLoader().getResourceAsStream(RUNNER_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RUNNER_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + RUNNER_RESOURCE, e);
        }
    }

    public String runnerSource() {
        return runnerSource;
    }

    public int outputLimitBytes() {
        return outputLimitBytes;
    }

    /** Interpreter invocation that runs the runner in isolated mode. */
    public List<String> command(String interpreter) {
        return List.of(interpreter, "-I", "-c", runnerSource);
    }

    public byte[] payload(ExecutionRequest request) {
        Map<String, Object> limits = new LinkedHashMap<>();
        limits.put("memory_bytes", request.plan().memoryBytes());
        limits.put("processes", request.plan().pidsLimit());
        limits.put("cpu_seconds", request.plan().cpuSeconds());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("content", request.content());
        payload.put("type", request.contentType().name());
        payload.put("inputs", request.context().inputs());
        payload.put("limits", limits);
        payload.put("denied_calls", request.capabilities().deniedCalls());
        payload.put("allowed_modules", request.capabilities().allowedModules());
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize sandbox payload", e);
        }
    }

    /** Payload as base64 chunks, passed as trailing arguments where stdin is not available. */
    public List<String> payloadArguments(byte[] payload) {
        String encoded = Base64.getEncoder().encodeToString(payload);
        List<String> chunks = new ArrayList<>();
        for (int i = 0; i < encoded.length(); i += ARG_CHUNK) {
            chunks.add(encoded.substring(i, Math.min(encoded.length(), i + ARG_CHUNK)));
        }
        return chunks;
    }

    /**
     * Classifies a finished run. A recorded breach or an expired deadline wins over whatever the
     * process reported.
     */
    public ExecutionResult interpret(RunOutcome run) {
        if (run.breach() != null) {
            return failure(run, run.breach().classification(), run.breach().detail());
        }
        if (run.timedOut()) {
            return failure(run, ExitClassification.TIMEOUT_EXCEEDED,
                    "execution did not finish within " + run.wallTimeMs() + "ms");
        }
        switch (run.exitCode()) {
            case EXIT_OK:
                return success(run);
            case EXIT_MEMORY:
                return failure(run, ExitClassification.MEMORY_EXCEEDED, "MemoryError raised under limit of "
                        + run.memoryLimitBytes() + " bytes");
            case EXIT_PROCESSES:
                return failure(run, ExitClassification.PROCESS_LIMIT_EXCEEDED, "process limit reached: "
                        + tail(run.stderr()));
            case EXIT_BAD_INPUT:
                return failure(run, ExitClassification.EXECUTION_FAILED, "runtime rejected payload: "
                        + tail(run.stderr()));
            case EXIT_SIGKILL:
                // Our own kills are recorded as breaches, so SIGKILL here came from the kernel.
                if (run.peakMemoryBytes() == 0 || run.peakMemoryBytes() >= run.memoryLimitBytes() * 9 / 10) {
                    return failure(run, ExitClassification.MEMORY_EXCEEDED, "killed by the OOM killer at limit of "
                            + run.memoryLimitBytes() + " bytes");
                }
                return failure(run, ExitClassification.EXECUTION_FAILED, "killed by SIGKILL");
            default:
                return failure(run, ExitClassification.EXECUTION_FAILED, errorMessage(run));
        }
    }

    private ExecutionResult success(RunOutcome run) {
        JsonNode report = report(run.stdout());
        if (report == null || !"ok".equals(report.path("status").asText())) {
            return failure(run, ExitClassification.EXECUTION_FAILED, "unreadable runtime output");
        }
        JsonNode result = report.path("result");
        String output;
        if (result.isMissingNode() || result.isNull()) {
            output = report.path("output").asText("");
        } else {
            output = result.isTextual() ? result.asText() : result.toString();
        }
        return ExecutionResult.success(truncate(output), run.level(), run.sandboxId(),
                run.wallTimeMs(), run.peakMemoryBytes());
    }

    private String errorMessage(RunOutcome run) {
        JsonNode report = report(run.stdout());
        if (report != null && report.hasNonNull("error")) {
            return report.get("error").asText();
        }
        return "exit code " + run.exitCode() + ": " + tail(run.stderr());
    }

    private JsonNode report(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(stdout.trim());
        } catch (JsonProcessingException e) {
            log.debug("Runtime output is not a JSON report: {}", e.getOriginalMessage());
            return null;
        }
    }

    private ExecutionResult failure(RunOutcome run, ExitClassification classification, String reason) {
        return ExecutionResult.failure(classification, reason, run.level(), run.sandboxId(),
                run.wallTimeMs(), run.peakMemoryBytes(), run.exitCode());
    }

    private String truncate(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= outputLimitBytes) {
            return text;
        }
        return new String(bytes, 0, outputLimitBytes, StandardCharsets.UTF_8) + "...[truncated]";
    }

    private static String tail(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        return trimmed.length() <= 2000 ? trimmed : trimmed.substring(trimmed.length() - 2000);
    }

    /**
     * Raw facts about one finished run, gathered by a backend.
     *
     * @param exitCode         process exit code, 137 for SIGKILL
     * @param stdout           captured stdout (the runner's JSON report)
     * @param stderr           captured stderr
     * @param breach           breach recorded by the resource monitor, null when none
     * @param timedOut         true when the request deadline expired first
     * @param wallTimeMs       elapsed wall time
     * @param peakMemoryBytes  highest observed memory, 0 when unknown
     * @param memoryLimitBytes enforced memory limit
     * @param level            isolation level the run used
     * @param sandboxId        instance id
     */
    public record RunOutcome(
        int exitCode,
        String stdout,
        String stderr,
        Breach breach,
        boolean timedOut,
        long wallTimeMs,
        long peakMemoryBytes,
        long memoryLimitBytes,
        IsolationLevel level,
        String sandboxId
    ) {}
}
