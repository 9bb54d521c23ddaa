package com.maestro.dispatch.cli;

import com.maestro.core.engine.OrchestrationEngine;
import com.maestro.core.model.ExecutionNotFoundException;
import com.maestro.core.model.ExecutionView;
import com.maestro.core.model.Step;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

/**
 * CLI command: maestro status &lt;execution-id&gt;
 * <p>
 * Reads the execution from the configured repository and prints its steps, stages and
 * progress. With {@code --watch} it instead follows the live event stream of a running
 * {@code maestro serve} instance.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check execution status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Execution ID")
    private String executionId;

    @Option(names = {"--watch", "-w"}, description = "Watch for live updates via SSE")
    private boolean watch;

    @Option(names = {"--port"}, description = "Server port for watch mode (default: ${DEFAULT-VALUE})",
            defaultValue = "8080")
    private int port;

    private final OrchestrationEngine engine;

    public StatusCommand(OrchestrationEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        if (watch) {
            runWatchMode();
            return;
        }

        ConsoleOutput.printBanner();

        ExecutionView view;
        try {
            view = engine.getExecution(executionId);
        } catch (ExecutionNotFoundException e) {
            ConsoleOutput.error("Execution not found: " + executionId);
            return;
        }

        System.out.println();
        System.out.println("EXECUTION " + view.executionId());
        if (view.templateId() != null) {
            System.out.println("Template: " + view.templateId());
        }
        System.out.println("Mode: " + view.mode());

        List<List<String>> stages = view.stages();
        for (int i = 0; i < stages.size(); i++) {
            ConsoleOutput.stage(i, stages.get(i).size());
            for (String stepId : stages.get(i)) {
                view.steps().stream()
                        .filter(s -> s.id().equals(stepId))
                        .findFirst()
                        .ifPresent(ConsoleOutput::stepStatus);
            }
        }
        ConsoleOutput.summary(view);
    }

    private void runWatchMode() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Watching execution " + executionId + " (connecting to localhost:" + port + ")...");
        System.out.println();

        URI uri = URI.create("http://localhost:" + port + "/api/v1/executions/" + executionId + "/events");

        try {
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(5))
                    .build();

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(uri)
                    .header("Accept", "text/event-stream")
                    .GET()
                    .build();

            HttpResponse<Stream<String>> response = client.send(request, HttpResponse.BodyHandlers.ofLines());

            if (response.statusCode() == 404) {
                ConsoleOutput.error("Execution not found: " + executionId);
                return;
            }
            if (response.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + response.statusCode());
                return;
            }

            final String[] currentEventType = {""};
            response.body().forEach(line -> {
                if (line.startsWith("event:")) {
                    currentEventType[0] = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    String data = line.substring(5).trim();
                    String eventType = currentEventType[0].isEmpty() ? "message" : currentEventType[0];
                    ConsoleOutput.watchEvent(eventType, data);
                    currentEventType[0] = "";
                }
            });

            System.out.println();
            ConsoleOutput.info("Stream ended.");

        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Maestro server at localhost:" + port);
            ConsoleOutput.info("Start the server first: maestro serve");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Watch interrupted.");
        } catch (Exception e) {
            ConsoleOutput.error("Watch failed: " + e.getMessage());
        }
    }
}
