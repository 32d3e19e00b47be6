package com.proofline.core.engine;

import java.nio.file.Path;
import java.util.List;

/**
 * Parameters of one verification session. Null overrides fall back to the configured defaults.
 *
 * @param tasks          requested task names, or {@code all}
 * @param concurrency    worker limit override
 * @param timeoutSeconds per-task timeout override; 0 disables the timeout
 * @param failFast       fail-fast override
 * @param resultsDir     results directory override
 */
public record SessionRequest(
    List<String> tasks,
    Integer concurrency,
    Integer timeoutSeconds,
    Boolean failFast,
    Path resultsDir
) {

    public SessionRequest {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public static SessionRequest of(String... tasks) {
        return new SessionRequest(List.of(tasks), null, null, null, null);
    }
}
