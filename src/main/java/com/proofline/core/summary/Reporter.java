package com.proofline.core.summary;

/**
 * Renders a finished session summary.
 */
@FunctionalInterface
public interface Reporter {

    void report(SessionSummary summary);
}
