package com.proofline.dispatch.cli;

import com.proofline.core.model.FailureCause;
import com.proofline.core.model.TaskStatus;
import com.proofline.core.summary.Reporter;
import com.proofline.core.summary.SessionSummary;
import com.proofline.core.summary.TaskSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Prints a session summary as a per-task table followed by the totals and the verdict.
 */
@Component
public class ConsoleReporter implements Reporter {

    @Override
    public void report(SessionSummary summary) {
        System.out.println(ConsoleOutput.RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Session " + summary.sessionId() + "|@"));
        for (TaskSummary task : summary.tasks()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("  %s %-28s %-12s %8s  %s",
                    ConsoleOutput.statusMarkup(task.status()),
                    task.id(),
                    task.kind(),
                    ConsoleOutput.formatDuration(task.durationMs()),
                    detail(task))));
        }
        System.out.println(ConsoleOutput.RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  Tasks: %d, @|fg(green) %d succeeded|@, @|fg(red) %d failed|@, @|fg(yellow) %d timed out|@",
                summary.tasks().size(),
                summary.count(TaskStatus.SUCCEEDED),
                summary.count(TaskStatus.FAILED),
                summary.count(TaskStatus.TIMED_OUT))));
        System.out.println("  Duration: " + ConsoleOutput.formatDuration(summary.totalDurationMs())
                + " (concurrency " + summary.concurrency() + ")");
        switch (summary.overallStatus()) {
            case SUCCESS -> ConsoleOutput.success("Overall: SUCCESS");
            case FAILURE -> ConsoleOutput.error("Overall: FAILURE");
            case TIMEOUT -> ConsoleOutput.warn("Overall: TIMEOUT");
        }
    }

    private static String detail(TaskSummary task) {
        if (task.status() == TaskStatus.FAILED) {
            if (task.failureCause() == FailureCause.DEPENDENCY) {
                return "skipped, dependency failed";
            }
            if (task.failureCause() == FailureCause.ABORTED) {
                return "aborted";
            }
            return "exit code " + task.exitCode() + logHint(task);
        }
        if (task.status() == TaskStatus.TIMED_OUT) {
            return "timed out" + logHint(task);
        }
        return "";
    }

    private static String logHint(TaskSummary task) {
        return task.logPath() != null ? ", see " + task.logPath() : "";
    }
}
