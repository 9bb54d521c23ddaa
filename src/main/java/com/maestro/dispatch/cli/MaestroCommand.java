package com.maestro.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Maestro.
 * Routes to subcommands: run, status, templates, audit, serve.
 */
@Command(
        name = "maestro",
        mixinStandardHelpOptions = true,
        version = "Maestro 0.1.0",
        description = "Multi-agent workflow orchestration engine",
        subcommands = {
                RunCommand.class,
                StatusCommand.class,
                TemplatesCommand.class,
                AuditCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class MaestroCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // no subcommand given
        spec.commandLine().usage(System.out);
    }
}
