package com.codescout.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: codescout serve
 * <p>
 * Starts Codescout as a long-running HTTP server exposing the review and
 * session API. The web server is enabled by
 * {@link com.codescout.CodescoutApplication#main} detecting "serve" in args,
 * and {@link CliRunner} skips picocli in that mode. The banner is printed once
 * the web server is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 codescout serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Codescout HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; CliRunner skips picocli for serve.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Codescout server running on port " + port);
        System.out.println();
        System.out.println("  Reviews:   POST http://localhost:" + port + "/api/v1/reviews");
        System.out.println("  Sessions:  GET  http://localhost:" + port + "/api/v1/sessions");
        System.out.println("  Health:    GET  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
