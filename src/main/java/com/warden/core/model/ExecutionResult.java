package com.warden.core.model;

import java.io.Serializable;

/**
 * Outcome of one execution attempt. Created once per attempt.
 *
 * @param success        true only for {@link ExitClassification#SUCCESS}
 * @param output         captured stdout (or the printed return value) on success
 * @param failureReason  failure description, empty on success
 * @param classification exit classification
 * @param isolationLevel level the content actually ran at
 * @param sandboxId      instance that ran the content, empty when none was used
 * @param wallTimeMs     wall-clock time of the execution
 * @param peakMemoryBytes highest memory sample observed, 0 when unknown
 * @param exitCode       process exit code, -1 when not applicable
 */
public record ExecutionResult(
    boolean success,
    String output,
    String failureReason,
    ExitClassification classification,
    IsolationLevel isolationLevel,
    String sandboxId,
    long wallTimeMs,
    long peakMemoryBytes,
    int exitCode
) implements Serializable {

    public ExecutionResult {
        output = output == null ? "" : output;
        failureReason = failureReason == null ? "" : failureReason;
        sandboxId = sandboxId == null ? "" : sandboxId;
    }

    public static ExecutionResult success(String output, IsolationLevel level, String sandboxId,
                                          long wallTimeMs, long peakMemoryBytes) {
        return new ExecutionResult(true, output, "", ExitClassification.SUCCESS, level, sandboxId,
                wallTimeMs, peakMemoryBytes, 0);
    }

    public static ExecutionResult failure(ExitClassification classification, String reason,
                                          IsolationLevel level, String sandboxId,
                                          long wallTimeMs, long peakMemoryBytes, int exitCode) {
        return new ExecutionResult(false, "", reason, classification, level, sandboxId,
                wallTimeMs, peakMemoryBytes, exitCode);
    }

    public static ExecutionResult notExecuted(IsolationLevel level) {
        return new ExecutionResult(true, "", "", ExitClassification.NOT_EXECUTED, level, "", 0, 0, -1);
    }

    public ExitClassification.Remediation remediation() {
        return classification.remediation();
    }
}
