package com.proofline.verifier;

import java.nio.file.Path;
import java.time.Duration;

/**
 * @param exitCode process-style exit status (0 = success)
 * @param duration wall-clock time spent in the engine
 * @param logPath  location of the captured output; its contents are never interpreted
 * @param timedOut true when the verifier terminated the engine because the timeout expired
 */
public record VerifierResult(
    int exitCode,
    Duration duration,
    Path logPath,
    boolean timedOut
) {

    /** Exit status of {@code timeout(1)} when it kills its child; the verification scripts use it too. */
    public static final int TIMEOUT_EXIT_CODE = 124;

    public static VerifierResult completed(int exitCode, Duration duration, Path logPath) {
        return new VerifierResult(exitCode, duration, logPath, false);
    }

    public static VerifierResult timedOut(Duration duration, Path logPath) {
        return new VerifierResult(TIMEOUT_EXIT_CODE, duration, logPath, true);
    }
}
