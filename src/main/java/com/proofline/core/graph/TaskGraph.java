package com.proofline.core.graph;

import com.proofline.core.error.CycleDetectedException;
import com.proofline.core.error.DuplicateTaskException;
import com.proofline.core.error.UnknownDependencyException;
import com.proofline.core.error.UnknownTaskException;
import com.proofline.core.model.TaskDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, validated task dependency graph.
 *
 * <p>Nodes live in an arena indexed by declaration order. Construction verifies that
 * every dependency is declared and that the dependency relation is acyclic, so any
 * subset closed under dependencies can always be ordered.
 */
public final class TaskGraph {

    private static final Logger log = LoggerFactory.getLogger(TaskGraph.class);

    /** Target sentinel selecting every declared task. */
    public static final String ALL = "all";

    private static final int UNVISITED = 0;
    private static final int IN_PROGRESS = 1;
    private static final int DONE = 2;

    private final List<TaskNode> nodes;
    private final Map<String, Integer> indexByName;

    private TaskGraph(List<TaskNode> nodes, Map<String, Integer> indexByName) {
        this.nodes = nodes;
        this.indexByName = indexByName;
    }

    /**
     * Builds and validates a graph from the ordered task table.
     *
     * @throws DuplicateTaskException     if a name is declared twice
     * @throws UnknownDependencyException if a dependency is not declared
     * @throws CycleDetectedException     if the dependency relation has a cycle
     */
    public static TaskGraph build(List<TaskDeclaration> declarations) {
        var indexByName = new HashMap<String, Integer>();
        for (int i = 0; i < declarations.size(); i++) {
            String name = declarations.get(i).name();
            if (indexByName.putIfAbsent(name, i) != null) {
                throw new DuplicateTaskException(name);
            }
        }

        int size = declarations.size();
        var dependencies = new ArrayList<List<Integer>>(size);
        var dependents = new ArrayList<List<Integer>>(size);
        for (int i = 0; i < size; i++) {
            dependents.add(new ArrayList<>());
        }
        for (int i = 0; i < size; i++) {
            var declaration = declarations.get(i);
            var deps = new ArrayList<Integer>();
            for (String dep : declaration.dependencies()) {
                Integer depIndex = indexByName.get(dep);
                if (depIndex == null) {
                    throw new UnknownDependencyException(declaration.name(), dep);
                }
                if (!deps.contains(depIndex)) {
                    deps.add(depIndex);
                    dependents.get(depIndex).add(i);
                }
            }
            dependencies.add(deps);
        }

        var nodes = new ArrayList<TaskNode>(size);
        for (int i = 0; i < size; i++) {
            var declaration = declarations.get(i);
            nodes.add(new TaskNode(i, declaration.name(), declaration.kind(), declaration.target(),
                    List.copyOf(dependencies.get(i)), List.copyOf(dependents.get(i))));
        }

        var graph = new TaskGraph(List.copyOf(nodes), Map.copyOf(indexByName));
        graph.verifyAcyclic();
        log.debug("Built task graph with {} tasks", size);
        return graph;
    }

    /**
     * Returns the requested tasks plus all of their direct and indirect dependencies,
     * in declaration order. The name {@value #ALL} selects every task.
     *
     * @throws UnknownTaskException if a requested name is not declared
     */
    public List<TaskNode> transitiveClosure(Collection<String> names) {
        var selected = new BitSet(nodes.size());
        var stack = new ArrayDeque<Integer>();
        for (String name : names) {
            if (ALL.equals(name)) {
                selected.set(0, nodes.size());
                continue;
            }
            stack.push(indexOf(name));
        }
        while (!stack.isEmpty()) {
            int index = stack.pop();
            if (selected.get(index)) continue;
            selected.set(index);
            for (int dep : nodes.get(index).dependencies()) {
                stack.push(dep);
            }
        }
        var closure = new ArrayList<TaskNode>(selected.cardinality());
        selected.stream().forEach(i -> closure.add(nodes.get(i)));
        return closure;
    }

    public List<TaskNode> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public TaskNode node(int index) {
        return nodes.get(index);
    }

    public Optional<TaskNode> find(String name) {
        Integer index = indexByName.get(name);
        return index == null ? Optional.empty() : Optional.of(nodes.get(index));
    }

    /**
     * @throws UnknownTaskException if the name is not declared
     */
    public TaskNode node(String name) {
        return nodes.get(indexOf(name));
    }

    public List<String> dependencyNames(TaskNode node) {
        return node.dependencies().stream().map(i -> nodes.get(i).name()).toList();
    }

    private int indexOf(String name) {
        Integer index = indexByName.get(name);
        if (index == null) {
            throw new UnknownTaskException(name);
        }
        return index;
    }

    /**
     * Depth-first traversal with three-color marking. Reaching a node that is still
     * in progress closes a cycle; the path on the stack from that node is reported,
     * each name followed by one of its dependencies.
     */
    private void verifyAcyclic() {
        int[] color = new int[nodes.size()];
        Deque<Integer> path = new ArrayDeque<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (color[i] == UNVISITED) {
                visit(i, color, path);
            }
        }
    }

    private void visit(int index, int[] color, Deque<Integer> path) {
        color[index] = IN_PROGRESS;
        path.addLast(index);
        for (int dep : nodes.get(index).dependencies()) {
            if (color[dep] == IN_PROGRESS) {
                throw new CycleDetectedException(cyclePath(path, dep));
            }
            if (color[dep] == UNVISITED) {
                visit(dep, color, path);
            }
        }
        path.removeLast();
        color[index] = DONE;
    }

    private List<String> cyclePath(Deque<Integer> path, int start) {
        var cycle = new ArrayList<String>();
        boolean inCycle = false;
        for (int index : path) {
            if (index == start) inCycle = true;
            if (inCycle) cycle.add(nodes.get(index).name());
        }
        cycle.add(nodes.get(start).name());
        return cycle;
    }
}
