package com.agentbench.dispatch.cli;

import com.agentbench.core.model.Job;
import com.agentbench.core.model.JobMetrics;
import com.agentbench.core.model.JobStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the agentbench CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AGENTBENCH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AGENTBENCH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void status(JobStatus status) {
        String color = switch (status) {
            case COMPLETED -> "fg(green)";
            case FAILED, ABANDONED -> "fg(red)";
            case BUILDING, RUNNING -> "fg(yellow)";
            default -> "fg(cyan)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Status: @|" + color + " " + status + "|@"));
    }

    public static void logLine(String line) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|faint |@ " + line));
    }

    public static void watchEvent(String type, String detail) {
        String color = switch (type) {
            case "job.status" -> "fg(yellow)";
            case "job.progress" -> "fg(blue)";
            default -> "fg(cyan)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " [" + type + "]|@ " + detail));
    }

    public static void job(Job job) {
        System.out.println();
        System.out.println("TEST " + job.id());
        System.out.println("Agent: " + job.agentId() + " | Provider: "
                + (job.provider() != null ? job.provider().tag() : "-"));
        System.out.println("Query: " + truncate(job.query(), 60));
        status(job.status());
        if (job.result().response() != null) {
            success("Response: " + job.result().response());
        }
        if (job.result().error() != null) {
            error("Error (" + job.result().errorStage() + "): " + job.result().error());
        }
        metrics(job.metrics());
    }

    public static void metrics(JobMetrics m) {
        if (m.queueWaitMs() == null && m.executionTimeMs() == null) {
            return;
        }
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Metrics|@"));
        if (m.queueWaitMs() != null) {
            System.out.println("  Queue wait: " + formatDuration(m.queueWaitMs()));
        }
        if (m.buildTimeMs() != null) {
            System.out.println("  Build:      " + formatDuration(m.buildTimeMs()));
        }
        if (m.executionTimeMs() != null) {
            System.out.println("  Execution:  " + formatDuration(m.executionTimeMs()));
        }
        if (m.memoryUsedMb() != null) {
            System.out.println("  Memory:     " + m.memoryUsedMb() + " MB");
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
