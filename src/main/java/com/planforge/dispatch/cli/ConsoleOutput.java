package com.planforge.dispatch.cli;

import com.planforge.daemon.LivenessState;
import com.planforge.daemon.SessionRecord;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the PlanForge CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PLANFORGE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PLANFORGE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void session(SessionRecord record) {
        String liveness = switch (record.liveness()) {
            case RUNNING -> "@|fg(green) RUNNING     |@";
            case UNRESPONSIVE -> "@|fg(yellow) UNRESPONSIVE|@";
            case STOPPED -> "@|fg(red) STOPPED     |@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + liveness + " " + record.sessionId() + "  " + record.featureName()
                        + "  @|faint " + record.workflowStatus() + " (pid " + record.pid() + ")|@"));
    }

    public static void sessionSummary(long running, long unresponsive, long stopped) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) " + running + " running|@, @|fg(yellow) " + unresponsive
                        + " unresponsive|@, @|fg(red) " + stopped + " stopped|@"));
    }

    static long count(Iterable<SessionRecord> records, LivenessState liveness) {
        long n = 0;
        for (SessionRecord record : records) {
            if (record.liveness() == liveness) {
                n++;
            }
        }
        return n;
    }
}
