package com.proofline.core.graph;

import com.proofline.core.error.CycleDetectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Computes a deterministic execution order for a set of tasks.
 *
 * <p>Iterative topological sort: repeatedly take the task with no unresolved dependencies
 * inside the set, preferring the earliest declared one. Dependencies outside the set are
 * treated as already resolved.
 */
@Service
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    /**
     * Resolves the transitive closure of {@code names} and orders it.
     */
    public List<TaskNode> resolve(TaskGraph graph, Collection<String> names) {
        return order(graph, graph.transitiveClosure(names));
    }

    /**
     * @param graph   the graph the tasks belong to
     * @param taskSet tasks to order
     * @return every task of {@code taskSet}, each after all of its dependencies
     */
    public List<TaskNode> order(TaskGraph graph, Collection<TaskNode> taskSet) {
        var members = new BitSet(graph.size());
        for (var node : taskSet) {
            members.set(node.index());
        }

        int[] unresolved = new int[graph.size()];
        var ready = new PriorityQueue<Integer>();
        members.stream().forEach(i -> {
            for (int dep : graph.node(i).dependencies()) {
                if (members.get(dep)) unresolved[i]++;
            }
            if (unresolved[i] == 0) ready.add(i);
        });

        var ordered = new ArrayList<TaskNode>(members.cardinality());
        while (!ready.isEmpty()) {
            var node = graph.node(ready.poll());
            ordered.add(node);
            for (int dependent : node.dependents()) {
                if (members.get(dependent) && --unresolved[dependent] == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (ordered.size() != members.cardinality()) {
            // unreachable for graphs built through TaskGraph.build
            var stuck = new ArrayList<String>();
            members.stream().filter(i -> unresolved[i] > 0).forEach(i -> stuck.add(graph.node(i).name()));
            throw new CycleDetectedException(stuck);
        }

        log.debug("Execution order: {}", ordered.stream().map(TaskNode::name).toList());
        return ordered;
    }
}
