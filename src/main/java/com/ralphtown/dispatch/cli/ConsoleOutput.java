package com.ralphtown.dispatch.cli;

import com.ralphtown.core.clone.CloneProgress;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Ralphtown CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) RALPHTOWN v0.1.0|@"));
        rule();
    }

    public static void rule() {
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [RALPHTOWN]|@ " + message));
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

    public static void hint(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "    @|faint -|@ " + message));
    }

    public static void cloneProgress(CloneProgress p) {
        String line;
        if (p.totalDeltas() > 0) {
            line = "Resolving deltas: " + percent(p.indexedDeltas(), p.totalDeltas())
                    + " (" + p.indexedDeltas() + "/" + p.totalDeltas() + ")";
        } else {
            line = "Receiving objects: " + percent(p.receivedObjects(), p.totalObjects())
                    + " (" + p.receivedObjects() + "/" + p.totalObjects() + ")";
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(blue) [CLONE]|@ " + line));
    }

    static String percent(long done, long total) {
        if (total <= 0) return "0%";
        return (done * 100 / total) + "%";
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
