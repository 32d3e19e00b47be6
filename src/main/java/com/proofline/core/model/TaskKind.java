package com.proofline.core.model;

/**
 * Kind of verification engine a task runs on. Each kind maps to one command
 * template in the invocation table ({@code proofline.commands.<kind>}).
 */
public enum TaskKind {
    MODEL_CHECK,
    PROOF,
    HARNESS
}
