package com.proofline.core.summary;

import com.proofline.core.model.OverallStatus;
import com.proofline.core.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregated result of a verification session, as persisted to {@code summary.json}.
 *
 * @param requestedTasks task names as given by the caller ({@code all} kept verbatim)
 * @param counts         number of tasks per terminal status
 * @param tasks          per-task entries in execution order
 */
public record SessionSummary(
    String sessionId,
    List<String> requestedTasks,
    OverallStatus overallStatus,
    Map<TaskStatus, Integer> counts,
    List<TaskSummary> tasks,
    int concurrency,
    int timeoutSeconds,
    boolean failFast,
    Instant startedAt,
    Instant finishedAt,
    long totalDurationMs
) {

    public int count(TaskStatus status) {
        return counts.getOrDefault(status, 0);
    }
}
