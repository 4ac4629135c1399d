package com.warden.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: warden serve
 * <p>
 * Starts the gateway as a long-running HTTP server. The web server is enabled by
 * {@link com.warden.WardenApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli in that mode. The banner is printed once Tomcat is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Warden HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Warden gateway listening on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1/gateway");
        System.out.println("  Health:     http://localhost:" + port + "/api/v1/health");
        System.out.println("  Metrics:    http://localhost:" + port + "/actuator/prometheus");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
