package com.warden.dispatch.cli;

import com.warden.core.gateway.SecurityGateway;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * CLI command: warden validate
 * <p>
 * Static validation only. Exit code 0 when approved, 1 when rejected.
 */
@Command(name = "validate", mixinStandardHelpOptions = true,
        description = "Validate content without executing it")
@Component
public class ValidateCommand implements Callable<Integer> {

    private final SecurityGateway gateway;

    @Mixin
    ContentOptions options;

    public ValidateCommand(SecurityGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public Integer call() throws Exception {
        var result = gateway.validateOnly(options.content(), options.type, options.context());
        ConsoleOutput.gatewayResult(result);
        return result.approved() ? 0 : 1;
    }
}
