package com.warden.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Warden.
 * Routes to subcommands: validate, execute, audit, policy, health, serve.
 */
@Command(
        name = "warden",
        mixinStandardHelpOptions = true,
        version = "Warden 0.1.0",
        description = "Security gateway for AI-generated content",
        subcommands = {
                ValidateCommand.class,
                ExecuteCommand.class,
                AuditCommand.class,
                PolicyCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class WardenCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
