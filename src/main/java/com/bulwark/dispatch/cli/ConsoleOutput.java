package com.bulwark.dispatch.cli;

import com.bulwark.core.model.CheckResult;
import com.bulwark.core.model.Issue;
import com.bulwark.core.model.StatusBand;
import com.bulwark.core.model.ScoreSummary;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for Bulwark CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) BULWARK v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [BULWARK]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /** Fatal errors go to stderr so that piped report output stays clean. */
    public static void fatal(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(red) ERROR:|@ " + message));
    }

    public static void checkScore(CheckResult result) {
        String color = result.score() >= 7 ? "green" : result.score() >= 4 ? "yellow" : "red";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(Locale.ROOT,
                "  %-24s @|fg(%s) %2d/%d|@", result.displayName(), color, result.score(), CheckResult.MAX_SCORE)));
    }

    public static void issue(Issue issue) {
        String color = switch (issue.severity()) {
            case CRITICAL, HIGH -> "red";
            case MEDIUM -> "yellow";
            case WARNING -> "cyan";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "    @|fg(" + color + ") [" + issue.severity().label().toUpperCase(Locale.ROOT) + "]|@ "
                        + issue.component() + ": " + issue.message()));
    }

    public static void summary(ScoreSummary summary) {
        String color = summary.band() == StatusBand.EXCELLENT || summary.band() == StatusBand.GOOD ? "green"
                : summary.band() == StatusBand.FAIR ? "yellow" : "red";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(Locale.ROOT,
                "@|bold Overall Score:|@ %d/%d (%.1f%%) @|bold,fg(%s) %s|@",
                summary.total(), summary.max(), summary.percentage(), color,
                summary.band().name())));
        System.out.println("  " + summary.band().verdict());
    }
}
