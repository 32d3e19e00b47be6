package com.proofline.verifier;

import com.proofline.core.model.TaskKind;

import java.nio.file.Path;

/**
 * @param taskId         task identifier
 * @param kind           engine kind, selects the command template
 * @param target         engine-specific argument
 * @param timeoutSeconds per-task timeout; 0 means unlimited
 * @param logPath        where the engine's output should be written
 */
public record VerificationRequest(
    String taskId,
    TaskKind kind,
    String target,
    int timeoutSeconds,
    Path logPath
) {
}
