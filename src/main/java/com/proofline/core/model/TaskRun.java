package com.proofline.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot of one task's state within a session.
 *
 * @param id           task identifier
 * @param kind         verification engine kind
 * @param status       current status
 * @param failureCause set only when {@code status} is {@link TaskStatus#FAILED}
 * @param exitCode     verifier exit status, when the task ran and did not time out
 * @param startedAt    launch time (null if never launched)
 * @param finishedAt   completion time (null if never launched)
 * @param logPath      verifier log location (nullable)
 * @param dependencies names of the task's direct dependencies
 * @param requested    true if the caller asked for this task, false if pulled in as a dependency
 */
public record TaskRun(
    String id,
    TaskKind kind,
    TaskStatus status,
    FailureCause failureCause,
    Integer exitCode,
    Instant startedAt,
    Instant finishedAt,
    Path logPath,
    List<String> dependencies,
    boolean requested
) {

    public long durationMs() {
        if (startedAt == null || finishedAt == null) return 0L;
        return Duration.between(startedAt, finishedAt).toMillis();
    }
}
