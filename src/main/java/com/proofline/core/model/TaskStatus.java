package com.proofline.core.model;

/**
 * Status of an individual task within a session.
 */
public enum TaskStatus {
    PENDING,
    READY,
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == TIMED_OUT;
    }
}
