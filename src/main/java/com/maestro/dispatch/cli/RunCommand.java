package com.maestro.dispatch.cli;

import com.maestro.core.engine.OrchestrationEngine;
import com.maestro.core.events.EventBus;
import com.maestro.core.events.ExecutionEvent;
import com.maestro.core.model.ExecutionMode;
import com.maestro.core.model.ExecutionStatus;
import com.maestro.core.model.MaestroException;
import com.maestro.core.model.Step;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: maestro run &lt;template-id&gt;
 * <p>
 * Instantiates a workflow template in-process, prints step events as they arrive and
 * waits for the execution to reach a terminal status. Exit code is 0 only when the
 * execution completed.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a workflow template")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Template ID")
    private String templateId;

    @Option(names = {"--mode", "-m"},
            description = "Execution mode: SEQUENTIAL, PARALLEL, STAGED (default: configured mode)")
    private String mode;

    @Option(names = {"--context", "-c"}, description = "Context entry passed to every step (key=value)")
    private Map<String, String> context = new LinkedHashMap<>();

    @Option(names = {"--timeout"}, description = "Maximum minutes to wait (default: ${DEFAULT-VALUE})",
            defaultValue = "60")
    private long timeoutMinutes;

    private final OrchestrationEngine engine;
    private final EventBus eventBus;

    public RunCommand(OrchestrationEngine engine, EventBus eventBus) {
        this.engine = engine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ExecutionMode executionMode = null;
        if (mode != null) {
            try {
                executionMode = ExecutionMode.parse(mode);
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error("Invalid mode: " + mode + ". Valid modes: SEQUENTIAL, PARALLEL, STAGED");
                return 2;
            }
        }

        EventBus.Subscription subscription = eventBus.subscribeAll(RunCommand::printEvent);
        try {
            String executionId;
            try {
                executionId = engine.startExecution(templateId, null, executionMode, new LinkedHashMap<>(context));
            } catch (MaestroException e) {
                ConsoleOutput.error("Execution rejected: " + e.getMessage());
                return 2;
            }
            ConsoleOutput.info("Execution " + executionId + " started");

            boolean finished = engine.awaitCompletion(executionId, Duration.ofMinutes(timeoutMinutes));
            if (!finished) {
                ConsoleOutput.error("Timed out after " + timeoutMinutes + " minute(s); cancelling");
                engine.cancelExecution(executionId);
            }

            var view = engine.getExecution(executionId);
            System.out.println();
            for (Step step : view.steps()) {
                ConsoleOutput.stepStatus(step);
            }
            ConsoleOutput.summary(view);
            return view.status() == ExecutionStatus.COMPLETED ? 0 : 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Run interrupted.");
            return 130;
        } finally {
            subscription.unsubscribe();
        }
    }

    private static void printEvent(ExecutionEvent event) {
        if (event.stepId() == null) {
            return;
        }
        Object error = event.payload().get("error");
        ConsoleOutput.watchEvent(event.eventType(),
                event.stepId() + (error != null ? ": " + error : ""));
    }
}
