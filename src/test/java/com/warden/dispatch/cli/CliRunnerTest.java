package com.warden.dispatch.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CliRunnerTest {

    @Test
    @DisplayName("serve as the subcommand starts server mode")
    void serveSubcommand() {
        assertTrue(CliRunner.isServe("serve"));
        assertTrue(CliRunner.isServe("--spring.profiles.active=dev", "serve"));
    }

    @Test
    @DisplayName("help and version on serve are answered by picocli")
    void serveHelp() {
        assertFalse(CliRunner.isServe("serve", "--help"));
        assertFalse(CliRunner.isServe("serve", "-V"));
    }

    @Test
    @DisplayName("serve appearing as an argument of another command is not server mode")
    void serveAsArgument() {
        assertFalse(CliRunner.isServe("validate", "-t", "prompt", "serve"));
        assertFalse(CliRunner.isServe());
        assertFalse(CliRunner.isServe("--help"));
    }

    @Test
    @DisplayName("serve mode leaves the exit code at zero without parsing")
    void serveRunIsNoOp() {
        var runner = new CliRunner(new WardenCommand(), null);

        runner.run("serve");

        assertEquals(0, runner.getExitCode());
    }
}
