package com.maestro.dispatch.cli;

import com.maestro.core.audit.AuditExport;
import com.maestro.core.engine.OrchestrationEngine;
import com.maestro.core.model.AuditRecord;
import com.maestro.core.model.MaestroException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * CLI command: maestro audit &lt;execution-id&gt;
 * <p>
 * Prints the audit trail of an execution, or exports it with {@code --format}.
 */
@Command(name = "audit", mixinStandardHelpOptions = true, description = "Show or export an execution's audit trail")
@Component
public class AuditCommand implements Runnable {

    @Parameters(index = "0", description = "Execution ID")
    private String executionId;

    @Option(names = {"--format", "-f"}, description = "Export format (csv)")
    private String format;

    @Option(names = {"--output", "-o"}, description = "Write the export to this file instead of stdout")
    private Path output;

    private final OrchestrationEngine engine;

    public AuditCommand(OrchestrationEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        try {
            if (format != null) {
                export();
            } else {
                print();
            }
        } catch (MaestroException e) {
            ConsoleOutput.error(e.getMessage());
        }
    }

    private void print() {
        ConsoleOutput.printBanner();
        List<AuditRecord> records = engine.listAudit(executionId);
        if (records.isEmpty()) {
            ConsoleOutput.info("No audit records for " + executionId);
            return;
        }
        System.out.println();
        System.out.printf("  %-24s %-12s %-20s %-10s %s%n", "TIMESTAMP", "AGENT", "ACTION", "STATUS", "MESSAGE");
        System.out.println("  " + "-".repeat(90));
        for (AuditRecord r : records) {
            System.out.printf("  %-24s %-12s %-20s %-10s %s%n",
                    r.timestamp(), orDash(r.agentId()), r.action(), orDash(r.status()), orDash(r.message()));
        }
    }

    private void export() {
        AuditExport export = engine.exportAudit(executionId, format);
        if (output == null) {
            System.out.print(new String(export.content(), StandardCharsets.UTF_8));
            return;
        }
        try {
            Files.write(output, export.content());
            ConsoleOutput.success("Exported " + export.recordCount() + " record(s) to " + output);
        } catch (IOException e) {
            ConsoleOutput.error("Could not write " + output + ": " + e.getMessage());
        }
    }

    private static String orDash(String value) {
        return value == null || value.isEmpty() ? "-" : value;
    }
}
