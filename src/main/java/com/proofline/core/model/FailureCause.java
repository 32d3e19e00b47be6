package com.proofline.core.model;

/**
 * Why a task ended {@link TaskStatus#FAILED}.
 */
public enum FailureCause {
    /** The verifier ran and returned a nonzero status. */
    EXECUTION,
    /** A dependency failed or timed out; the task never ran. */
    DEPENDENCY,
    /** Fail-fast stopped the session before the task was launched. */
    ABORTED
}
