package com.proofline.dispatch.cli;

import com.proofline.core.events.SessionEvent;
import com.proofline.core.model.TaskStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Proofline CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PROOFLINE v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PROOFLINE]|@ " + message));
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

    /**
     * One progress line per scheduler event.
     */
    public static void event(SessionEvent event) {
        String prefix = switch (event.eventType()) {
            case SessionEvent.SESSION_STARTED -> "@|fg(cyan) [SESSION]|@";
            case SessionEvent.TASK_STARTED -> "@|fg(blue) [START]|@";
            case SessionEvent.TASK_SUCCEEDED -> "@|fg(green) [PASS]|@";
            case SessionEvent.TASK_FAILED -> "@|fg(red) [FAIL]|@";
            case SessionEvent.TASK_TIMED_OUT -> "@|fg(yellow) [TIMEOUT]|@";
            case SessionEvent.TASK_CASCADED -> "@|fg(red) [SKIP]|@";
            case SessionEvent.TASK_ABORTED -> "@|fg(red) [ABORT]|@";
            case SessionEvent.SESSION_COMPLETED -> "@|bold [DONE]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.taskId() != null ? event.taskId() : event.sessionId();
        String detail = switch (event.eventType()) {
            case SessionEvent.TASK_SUCCEEDED, SessionEvent.TASK_TIMED_OUT ->
                    " (" + formatDuration(longValue(event.payload().get("durationMs"))) + ")";
            case SessionEvent.TASK_FAILED -> " (exit code " + event.payload().get("exitCode") + ")";
            case SessionEvent.TASK_CASCADED -> " (dependency " + event.payload().get("dependency") + " did not succeed)";
            default -> "";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject + detail));
    }

    static String statusMarkup(TaskStatus status) {
        String color = switch (status) {
            case SUCCEEDED -> "fg(green)";
            case FAILED -> "fg(red)";
            case TIMED_OUT -> "fg(yellow)";
            default -> "fg(white)";
        };
        return "@|" + color + " " + String.format("%-9s", status.name()) + "|@";
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        if (seconds < 3600) return (seconds / 60) + "m " + (seconds % 60) + "s";
        return (seconds / 3600) + "h " + (seconds % 3600 / 60) + "m";
    }

    private static long longValue(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }
}
