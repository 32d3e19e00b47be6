package com.proofline.core.model;

import java.util.List;

/**
 * One row of the static task table.
 *
 * @param name         unique task identifier (e.g. "Safety")
 * @param kind         verification engine the task runs on
 * @param target       engine-specific argument substituted for {@code {target}}; defaults to the name
 * @param dependencies names of tasks that must succeed first
 */
public record TaskDeclaration(
    String name,
    TaskKind kind,
    String target,
    List<String> dependencies
) {

    public TaskDeclaration {
        target = target == null || target.isBlank() ? name : target;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static TaskDeclaration of(String name, TaskKind kind, String... dependencies) {
        return new TaskDeclaration(name, kind, null, List.of(dependencies));
    }
}
