package com.proofline.verifier;

/**
 * Capability that performs one task's check.
 * Implementations: ProcessVerifier (external engine processes); tests supply their own.
 *
 * <p>Contract: return within the request's timeout plus a small grace period, or react to
 * thread interruption by forcibly terminating the underlying work. The returned exit status
 * follows process conventions (0 = success).
 */
public interface Verifier {

    /**
     * Runs the check described by {@code request} and blocks until it finishes.
     *
     * @throws VerifierException if the check could not be started or supervised
     */
    VerifierResult execute(VerificationRequest request);
}
