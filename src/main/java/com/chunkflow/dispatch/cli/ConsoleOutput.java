package com.chunkflow.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Chunkflow CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CHUNKFLOW v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CHUNKFLOW]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "job.completed" -> "@|fg(green) [CHUNK]|@";
            case "job.attempt.failed" -> "@|fg(yellow) [RETRY]|@";
            case "job.failed" -> "@|fg(red),bold [FAILED]|@";
            case "job.replayed" -> "@|fg(cyan) [REPLAY]|@";
            case "batch.completed" -> "@|fg(blue) [BATCH]|@";
            case "batch.failed" -> "@|fg(red) [BATCH]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        String oneLine = s.replace('\n', ' ');
        return oneLine.length() <= max ? oneLine : oneLine.substring(0, max - 3) + "...";
    }
}
