package com.maestro.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final MaestroCommand maestroCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(MaestroCommand maestroCommand, IFactory factory) {
        this.maestroCommand = maestroCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // Serve mode: the embedded web server owns the JVM, picocli would return at once.
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(maestroCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
