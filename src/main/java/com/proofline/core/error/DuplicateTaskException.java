package com.proofline.core.error;

public class DuplicateTaskException extends ConfigurationException {

    public DuplicateTaskException(String taskName) {
        super("Task declared more than once: " + taskName);
    }
}
