package com.syncline.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: syncline serve
 * <p>
 * Starts Syncline as a long-running HTTP server accepting envelopes and streaming
 * notifications. The web server is enabled by {@link com.syncline.SynclineApplication#main}
 * detecting "serve" in args; {@link CliRunner} then skips picocli and the banner is printed
 * once the web server is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 syncline serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Syncline HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // only reached through --help style invocations; CliRunner skips picocli in serve mode
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Syncline server running on port " + port);
        System.out.println();
        System.out.println("  Events:        POST http://localhost:" + port + "/api/v1/events");
        System.out.println("  Notifications: GET  http://localhost:" + port + "/api/v1/notifications/stream");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
