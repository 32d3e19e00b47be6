package com.proofline.core.error;

/**
 * Raised before any scheduling starts when the task table or the requested options
 * are unusable. Always fatal for the invocation.
 */
public class ConfigurationException extends RuntimeException {

    /** Process exit code reported by the CLI for configuration errors. */
    public static final int EXIT_CODE = 3;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
