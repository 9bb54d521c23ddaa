package com.maestro.dispatch.cli;

import com.maestro.core.model.ExecutionView;
import com.maestro.core.model.Progress;
import com.maestro.core.model.Step;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Maestro CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) MAESTRO v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [MAESTRO]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void stage(int stageNumber, int stepCount) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [STAGE " + stageNumber + "]|@ " +
                stepCount + " step" + (stepCount != 1 ? "s" : "")));
    }

    public static void stepStatus(Step step) {
        String color = switch (step.status()) {
            case COMPLETED -> "fg(green)";
            case FAILED -> "fg(red)";
            case SKIPPED -> "fg(yellow)";
            case RUNNING -> "fg(blue)";
            default -> "fg(white)";
        };
        String detail = step.error() != null ? " - " + step.error() : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + step.status() + "|@ " + step.id() + " [" + step.agentId() + "]"
                        + (step.retryCount() > 0 ? " (retries: " + step.retryCount() + ")" : "") + detail));
    }

    public static void progress(Progress p) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Progress: @|bold " + p.percent() + "%|@ - @|fg(green) " + p.completed() + " completed|@"
                        + (p.failed() > 0 ? ", @|fg(red) " + p.failed() + " failed|@" : "")
                        + (p.skipped() > 0 ? ", @|fg(yellow) " + p.skipped() + " skipped|@" : "")
                        + " of " + p.total()));
    }

    public static void summary(ExecutionView view) {
        System.out.println("──────────────────────────────────");
        String status = switch (view.status()) {
            case COMPLETED -> "@|fg(green),bold COMPLETED|@";
            case FAILED -> "@|fg(red),bold FAILED|@";
            case CANCELLED -> "@|fg(yellow),bold CANCELLED|@";
            default -> "@|fg(cyan) " + view.status() + "|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Execution " + view.executionId() + "|@ " + status));
        progress(view.progress());
        if (view.durationMs() != null) {
            System.out.println("  Duration: " + formatDuration(view.durationMs()));
        }
        view.failures().forEach((stepId, error) -> error("  " + stepId + ": " + error));
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "execution_snapshot" -> "@|fg(cyan) [STATUS]|@";
            case "execution_started" -> "@|fg(cyan) [EXECUTION]|@";
            case "step_started", "step_completed" -> "@|fg(blue) [STEP]|@";
            case "step_progress" -> "@|fg(yellow) [RETRY]|@";
            case "step_failed" -> "@|fg(red) [STEP]|@";
            case "step_skipped" -> "@|fg(yellow) [SKIP]|@";
            case "execution_completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "execution_failed" -> "@|fg(red),bold [FAILED]|@";
            case "execution_cancelled" -> "@|fg(yellow),bold [CANCELLED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
