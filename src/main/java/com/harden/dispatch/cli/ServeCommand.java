package com.harden.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: harden serve
 * <p>
 * Starts the REST API and SSE stream. The web server is enabled by
 * {@link com.harden.HardenApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli in that mode. The banner is printed once
 * the server reports its port.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 harden serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the pipeline HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; CliRunner skips picocli in serve mode.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Pipeline server running on port " + port);
        System.out.println();
        System.out.println("  Status:  http://localhost:" + port + "/api/v1/pipeline/status");
        System.out.println("  Events:  http://localhost:" + port + "/api/v1/pipeline/events");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
