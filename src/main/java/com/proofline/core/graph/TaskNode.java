package com.proofline.core.graph;

import com.proofline.core.model.TaskKind;

import java.util.List;

/**
 * A task in the graph arena. Dependencies and dependents are stored as node indices,
 * so the scheduler never re-resolves names.
 *
 * @param index        position in declaration order; also the tie-breaker for scheduling
 * @param name         unique task identifier
 * @param kind         verification engine kind
 * @param target       engine-specific argument
 * @param dependencies indices of direct dependencies
 * @param dependents   indices of tasks that directly depend on this one
 */
public record TaskNode(
    int index,
    String name,
    TaskKind kind,
    String target,
    List<Integer> dependencies,
    List<Integer> dependents
) {
}
