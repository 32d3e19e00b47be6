package com.proofline.core.summary;

import com.proofline.core.model.FailureCause;
import com.proofline.core.model.TaskKind;
import com.proofline.core.model.TaskStatus;

import java.util.List;

/**
 * Per-task entry of a {@link SessionSummary}.
 *
 * @param exitCode     verifier exit status; null when the task timed out or never ran
 * @param failureCause null unless {@code status} is FAILED
 * @param logPath      verifier log location, null if the task never ran
 * @param requested    false when the task was only pulled in as a dependency
 */
public record TaskSummary(
    String id,
    TaskKind kind,
    TaskStatus status,
    FailureCause failureCause,
    Integer exitCode,
    long durationMs,
    List<String> dependencies,
    String logPath,
    boolean requested
) {
}
