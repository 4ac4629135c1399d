package com.warden.dispatch.cli;

import com.warden.core.gateway.SecurityGateway;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * CLI command: warden execute
 * <p>
 * Validates, then runs approved content in a sandbox.
 * Exit code 0 on success, 1 when rejected, 2 when execution failed.
 */
@Command(name = "execute", mixinStandardHelpOptions = true,
        description = "Validate and execute content in a sandbox")
@Component
public class ExecuteCommand implements Callable<Integer> {

    private final SecurityGateway gateway;

    @Mixin
    ContentOptions options;

    public ExecuteCommand(SecurityGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public Integer call() throws Exception {
        var result = gateway.validateAndExecute(options.content(), options.type, options.context());
        ConsoleOutput.gatewayResult(result);
        if (!result.approved()) {
            return 1;
        }
        return result.succeeded() ? 0 : 2;
    }
}
