package com.warden.dispatch.cli;

import com.warden.core.model.ExecutionResult;
import com.warden.core.model.GatewayResult;
import com.warden.core.model.Violation;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Warden CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) WARDEN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WARDEN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void sandbox(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [SANDBOX]|@ " + message));
    }

    public static void violation(Violation violation) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "    @|fg(red) -|@ " + violation));
    }

    public static void gatewayResult(GatewayResult result) {
        info("Request " + result.requestId() + " (" + result.totalMillis() + "ms)");
        var validation = result.validation();
        if (validation.approved()) {
            success("Validation approved, risk " + String.format("%.2f", validation.riskScore()));
        } else {
            error("Validation rejected: " + result.reason());
            validation.violations().forEach(ConsoleOutput::violation);
        }
        result.executionResult().ifPresent(ConsoleOutput::execution);
        if (result.degraded()) {
            warn("Executed at a degraded isolation level");
        }
    }

    private static void execution(ExecutionResult execution) {
        sandbox(execution.isolationLevel() + " " + execution.sandboxId()
                + " " + execution.wallTimeMs() + "ms, peak " + execution.peakMemoryBytes() + " bytes");
        if (execution.success()) {
            success("Output: " + execution.output());
        } else {
            error(execution.classification() + ": " + execution.failureReason());
            info("Remediation: " + execution.remediation());
        }
    }
}
