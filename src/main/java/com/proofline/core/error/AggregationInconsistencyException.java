package com.proofline.core.error;

/**
 * Internal invariant violation in the scheduler or the status table, such as a task
 * reported terminal twice. Indicates a bug, not a verification failure.
 */
public class AggregationInconsistencyException extends IllegalStateException {

    public AggregationInconsistencyException(String message) {
        super(message);
    }
}
