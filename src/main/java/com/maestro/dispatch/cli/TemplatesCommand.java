package com.maestro.dispatch.cli;

import com.maestro.core.engine.OrchestrationEngine;
import com.maestro.core.model.TemplateSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: maestro templates
 * <p>
 * Lists the registered workflow templates.
 */
@Command(name = "templates", mixinStandardHelpOptions = true, description = "List workflow templates")
@Component
public class TemplatesCommand implements Runnable {

    private final OrchestrationEngine engine;

    public TemplatesCommand(OrchestrationEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<TemplateSummary> templates = engine.listTemplates();
        if (templates.isEmpty()) {
            ConsoleOutput.info("No templates registered.");
            return;
        }

        System.out.println();
        System.out.printf("  %-24s %-6s %-30s %s%n", "ID", "STEPS", "NAME", "AGENTS");
        System.out.println("  " + "-".repeat(80));
        for (var t : templates) {
            System.out.printf("  %-24s %-6d %-30s %s%n",
                    t.id(), t.stepCount(), truncate(t.name(), 30), String.join(", ", t.agents()));
        }
        System.out.println();
        ConsoleOutput.info(templates.size() + " template(s)");
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
