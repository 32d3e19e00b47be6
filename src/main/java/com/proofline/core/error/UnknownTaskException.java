package com.proofline.core.error;

/**
 * A requested task name is not declared in the task table.
 */
public class UnknownTaskException extends ConfigurationException {

    private final String taskName;

    public UnknownTaskException(String taskName) {
        super("Unknown task: " + taskName);
        this.taskName = taskName;
    }

    public String getTaskName() {
        return taskName;
    }
}
