package com.proofline.config;

import com.proofline.core.model.TaskDeclaration;
import com.proofline.core.model.TaskKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "proofline")
public class ProoflineProperties {

    private int concurrency = 0;
    private int timeoutSeconds = 3600;
    private int graceSeconds = 5;
    private boolean failFast = false;
    private String resultsDir = "results/proofline";
    private String workingDir = ".";
    private Map<TaskKind, List<String>> commands = new EnumMap<>(TaskKind.class);
    private List<TaskDefinition> tasks = new ArrayList<>();

    /**
     * Concurrency limit to use when none is given on the command line.
     * A configured value of 0 means half of the available processors, at least 1.
     */
    public int effectiveConcurrency() {
        if (concurrency > 0) return concurrency;
        return Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
    }

    /** The task table in declaration order. */
    public List<TaskDeclaration> declarations() {
        return tasks.stream().map(TaskDefinition::toDeclaration).toList();
    }

    public Path resultsPath() { return Path.of(resultsDir); }
    public Path workingPath() { return Path.of(workingDir); }

    public int getConcurrency() { return concurrency; }
    public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    public int getGraceSeconds() { return graceSeconds; }
    public void setGraceSeconds(int graceSeconds) { this.graceSeconds = graceSeconds; }
    public boolean isFailFast() { return failFast; }
    public void setFailFast(boolean failFast) { this.failFast = failFast; }
    public String getResultsDir() { return resultsDir; }
    public void setResultsDir(String resultsDir) { this.resultsDir = resultsDir; }
    public String getWorkingDir() { return workingDir; }
    public void setWorkingDir(String workingDir) { this.workingDir = workingDir; }
    public Map<TaskKind, List<String>> getCommands() { return commands; }
    public void setCommands(Map<TaskKind, List<String>> commands) { this.commands = commands; }
    public List<TaskDefinition> getTasks() { return tasks; }
    public void setTasks(List<TaskDefinition> tasks) { this.tasks = tasks; }

    public static class TaskDefinition {
        private String name;
        private TaskKind kind;
        private String target;
        private List<String> dependsOn = new ArrayList<>();

        public TaskDeclaration toDeclaration() {
            return new TaskDeclaration(name, kind, target, dependsOn);
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public TaskKind getKind() { return kind; }
        public void setKind(TaskKind kind) { this.kind = kind; }
        public String getTarget() { return target; }
        public void setTarget(String target) { this.target = target; }
        public List<String> getDependsOn() { return dependsOn; }
        public void setDependsOn(List<String> dependsOn) { this.dependsOn = dependsOn; }
    }
}
