package com.proofline.core.model;

/**
 * Verdict of a whole session, with the process exit code the CLI reports for it.
 */
public enum OverallStatus {
    SUCCESS(0),
    FAILURE(1),
    TIMEOUT(2);

    private final int exitCode;

    OverallStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
