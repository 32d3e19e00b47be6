package com.proofline.core.error;

/**
 * An invocation option is out of range (e.g. a concurrency limit below 1).
 */
public class InvalidOptionException extends ConfigurationException {

    public InvalidOptionException(String message) {
        super(message);
    }
}
