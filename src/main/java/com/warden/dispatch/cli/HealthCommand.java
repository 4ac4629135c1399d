package com.warden.dispatch.cli;

import com.warden.core.health.HealthCheckService;
import com.warden.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: warden health
 * <p>
 * Runs all registered health checks and prints each with its status color.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check gateway health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> ConsoleOutput.error(label);
            }
        }

        System.out.println("──────────────────────────────────");
        HealthStatus.Status overall = HealthStatus.overall(checks);
        switch (overall) {
            case UP -> ConsoleOutput.success("Overall: all components operational");
            case DEGRADED -> ConsoleOutput.warn("Overall: running degraded");
            case DOWN -> ConsoleOutput.error("Overall: one or more components down");
        }
        return overall == HealthStatus.Status.DOWN ? 1 : 0;
    }
}
