package com.proofline.core.error;

/**
 * A declared task depends on a name that is not declared.
 */
public class UnknownDependencyException extends ConfigurationException {

    private final String taskName;
    private final String dependencyName;

    public UnknownDependencyException(String taskName, String dependencyName) {
        super("Task " + taskName + " depends on undeclared task " + dependencyName);
        this.taskName = taskName;
        this.dependencyName = dependencyName;
    }

    public String getTaskName() {
        return taskName;
    }

    public String getDependencyName() {
        return dependencyName;
    }
}
