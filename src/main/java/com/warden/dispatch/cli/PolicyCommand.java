package com.warden.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.gateway.GatewayConfigService;
import com.warden.core.gateway.SecurityGateway;
import com.warden.core.policy.PolicyConfigurationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: warden policy
 */
@Command(name = "policy", mixinStandardHelpOptions = true,
        description = "Print the effective gateway configuration, or check a policy document",
        subcommands = {PolicyCommand.Check.class})
@Component
public class PolicyCommand implements Callable<Integer> {

    private final GatewayConfigService configService;
    private final ObjectMapper objectMapper;

    public PolicyCommand(GatewayConfigService configService, ObjectMapper objectMapper) {
        this.configService = configService;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() throws Exception {
        System.out.println(objectMapper.writerWithDefaultPrettyPrinter()
                .writeValueAsString(configService.configuration()));
        return 0;
    }

    /**
     * Loads a policy document into this process. Useful as a pre-deployment check;
     * the running server is not affected.
     */
    @Command(name = "check", mixinStandardHelpOptions = true, description = "Validate a policy document")
    @Component
    public static class Check implements Callable<Integer> {

        private final SecurityGateway gateway;

        @Parameters(index = "0", description = "Policy JSON file")
        Path file;

        public Check(SecurityGateway gateway) {
            this.gateway = gateway;
        }

        @Override
        public Integer call() throws Exception {
            try {
                var snapshot = gateway.reloadPolicy(Files.readString(file), "cli");
                ConsoleOutput.success("Policy accepted, version " + snapshot.version());
                return 0;
            } catch (PolicyConfigurationException e) {
                ConsoleOutput.error("Policy rejected: " + e.getMessage());
                return 1;
            }
        }
    }
}
