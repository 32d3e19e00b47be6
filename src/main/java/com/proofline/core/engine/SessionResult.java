package com.proofline.core.engine;

import com.proofline.core.summary.SessionSummary;

import java.nio.file.Path;

/**
 * @param summary     aggregated session result
 * @param summaryFile persisted {@code summary.json}, or null if it could not be written
 */
public record SessionResult(SessionSummary summary, Path summaryFile) {
}
