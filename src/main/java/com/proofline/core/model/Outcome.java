package com.proofline.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * Result of one verifier invocation, produced exactly once per executed task.
 *
 * @param result     succeeded, failed or timed out
 * @param exitCode   process exit status; {@code null} when the invocation timed out
 * @param startedAt  wall-clock launch time
 * @param finishedAt wall-clock completion time
 * @param logPath    log location reported by the verifier (nullable)
 */
public record Outcome(
    Result result,
    Integer exitCode,
    Instant startedAt,
    Instant finishedAt,
    Path logPath
) {

    public enum Result { SUCCEEDED, FAILED, TIMED_OUT }

    public static Outcome succeeded(Instant startedAt, Instant finishedAt, Path logPath) {
        return new Outcome(Result.SUCCEEDED, 0, startedAt, finishedAt, logPath);
    }

    public static Outcome failed(int exitCode, Instant startedAt, Instant finishedAt, Path logPath) {
        return new Outcome(Result.FAILED, exitCode, startedAt, finishedAt, logPath);
    }

    public static Outcome timedOut(Instant startedAt, Instant finishedAt, Path logPath) {
        return new Outcome(Result.TIMED_OUT, null, startedAt, finishedAt, logPath);
    }

    public boolean succeeded() {
        return result == Result.SUCCEEDED;
    }

    public TaskStatus status() {
        return switch (result) {
            case SUCCEEDED -> TaskStatus.SUCCEEDED;
            case FAILED -> TaskStatus.FAILED;
            case TIMED_OUT -> TaskStatus.TIMED_OUT;
        };
    }

    public long durationMs() {
        return Duration.between(startedAt, finishedAt).toMillis();
    }
}
