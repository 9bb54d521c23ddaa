package com.maestro.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: maestro serve
 * <p>
 * Runs Maestro as a long-running HTTP server exposing the REST API and SSE event streams.
 * {@link com.maestro.MaestroApplication#main} enables the web server when "serve" is among
 * the arguments, and {@link CliRunner} then skips picocli. The banner is printed once the
 * embedded server reports its port.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 maestro serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Maestro HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // only reached through picocli, e.g. "maestro help serve"
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Maestro server running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1");
        System.out.println("  Templates:  http://localhost:" + port + "/api/v1/templates");
        System.out.println("  Health:     http://localhost:" + port + "/actuator/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
