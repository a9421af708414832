package com.codescout.dispatch.cli;

import com.codescout.core.llm.TokenUsage;
import com.codescout.core.navigation.NavigationSummary;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Codescout CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CODESCOUT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CODESCOUT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void navigation(NavigationSummary summary) {
        if (summary == null) {
            return;
        }
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Navigation|@"));
        System.out.println("  Tool calls: " + summary.totalCalls() + " (" + summary.cachedCalls() + " cached)");
        System.out.println("  Symbols searched: " + summary.symbolsSearched());
        System.out.println("  Files read: " + summary.filesRead().size());
        for (String file : summary.filesRead()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(blue) -|@ " + file));
        }
    }

    public static void tokens(TokenUsage usage) {
        if (usage == null) {
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tokens: " + usage.inputTokens() + " in, " + usage.outputTokens() + " out, "
                        + "@|bold " + usage.totalTokens() + " total|@"));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
