package com.proofline.verifier;

/**
 * Thrown when a verification engine cannot be started or supervised.
 */
public class VerifierException extends RuntimeException {
    public VerifierException(String message) {
        super(message);
    }

    public VerifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
