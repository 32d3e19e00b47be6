package com.proofline.core.summary;

import com.proofline.core.error.AggregationInconsistencyException;
import com.proofline.core.model.OverallStatus;
import com.proofline.core.model.TaskRun;
import com.proofline.core.model.TaskStatus;
import com.proofline.core.scheduler.ExecutionSession;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds a completed session into a {@link SessionSummary} and derives the overall verdict.
 */
@Service
public class ResultAggregator {

    /**
     * @throws AggregationInconsistencyException if any task of the session is not terminal
     */
    public SessionSummary summarize(ExecutionSession session) {
        List<TaskRun> runs = session.snapshot();
        for (TaskRun run : runs) {
            if (!run.status().isTerminal()) {
                throw new AggregationInconsistencyException("Task " + run.id() + " is still " + run.status()
                        + " in session " + session.sessionId());
            }
        }

        Map<TaskStatus, Integer> counts = new LinkedHashMap<>();
        counts.put(TaskStatus.SUCCEEDED, 0);
        counts.put(TaskStatus.FAILED, 0);
        counts.put(TaskStatus.TIMED_OUT, 0);
        runs.forEach(run -> counts.merge(run.status(), 1, Integer::sum));

        List<TaskSummary> tasks = runs.stream().map(ResultAggregator::toSummary).toList();

        long totalMs = session.startedAt() != null && session.finishedAt() != null
                ? Duration.between(session.startedAt(), session.finishedAt()).toMillis()
                : 0L;

        return new SessionSummary(
                session.sessionId(),
                session.requestedTasks(),
                overallStatus(runs),
                counts,
                tasks,
                session.concurrency(),
                session.timeoutSeconds(),
                session.failFast(),
                session.startedAt(),
                session.finishedAt(),
                totalMs);
    }

    /**
     * FAILURE when any task failed, whatever the cause, even if timeouts are also present.
     * TIMEOUT when there were no failures but at least one timeout. SUCCESS otherwise.
     */
    static OverallStatus overallStatus(List<TaskRun> runs) {
        if (runs.stream().anyMatch(run -> run.status() == TaskStatus.FAILED)) {
            return OverallStatus.FAILURE;
        }
        if (runs.stream().anyMatch(run -> run.status() == TaskStatus.TIMED_OUT)) {
            return OverallStatus.TIMEOUT;
        }
        return OverallStatus.SUCCESS;
    }

    private static TaskSummary toSummary(TaskRun run) {
        return new TaskSummary(
                run.id(),
                run.kind(),
                run.status(),
                run.failureCause(),
                run.exitCode(),
                run.durationMs(),
                run.dependencies(),
                run.logPath() != null ? run.logPath().toString() : null,
                run.requested());
    }
}
