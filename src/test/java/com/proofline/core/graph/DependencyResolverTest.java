package com.proofline.core.graph;

import com.proofline.core.model.TaskDeclaration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Random;

import static com.proofline.core.model.TaskDeclaration.of;
import static com.proofline.core.model.TaskKind.HARNESS;
import static com.proofline.core.model.TaskKind.MODEL_CHECK;
import static com.proofline.core.model.TaskKind.PROOF;
import static org.junit.jupiter.api.Assertions.*;

class DependencyResolverTest {

    private DependencyResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new DependencyResolver();
    }

    private static List<String> names(List<TaskNode> nodes) {
        return nodes.stream().map(TaskNode::name).toList();
    }

    @Test
    @DisplayName("requesting Safety schedules [Types, Utils, Safety]")
    void proofChain() {
        var graph = TaskGraph.build(List.of(
                of("Types", PROOF),
                of("Utils", PROOF, "Types"),
                of("Safety", PROOF, "Utils"),
                of("Liveness", PROOF, "Safety"),
                of("Resilience", PROOF, "Liveness"),
                of("WhitepaperTheorems", PROOF, "Resilience")));
        assertEquals(List.of("Types", "Utils", "Safety"), names(resolver.resolve(graph, List.of("Safety"))));
        assertEquals(List.of("Types", "Utils", "Safety", "Liveness", "Resilience", "WhitepaperTheorems"),
                names(resolver.resolve(graph, List.of("all"))));
    }

    @Test
    @DisplayName("ties are broken by declaration order")
    void declarationOrderTies() {
        var graph = TaskGraph.build(List.of(
                of("late", HARNESS, "base"),
                of("base", PROOF),
                of("early", MODEL_CHECK),
                of("mid", PROOF, "base")));
        assertEquals(List.of("base", "late", "early", "mid"), names(resolver.resolve(graph, List.of("all"))));
    }

    @Test
    @DisplayName("dependencies outside the ordered set are ignored")
    void subsetIgnoresOutsideDependencies() {
        var graph = TaskGraph.build(List.of(
                of("A", PROOF),
                of("B", PROOF, "A"),
                of("C", PROOF, "B")));
        var subset = List.of(graph.node("C"), graph.node("B"));
        assertEquals(List.of("B", "C"), names(resolver.order(graph, subset)));
    }

    @Test
    @DisplayName("ordering is deterministic")
    void deterministic() {
        var graph = TaskGraph.build(List.of(
                of("A", PROOF),
                of("B", PROOF, "A"),
                of("C", PROOF, "A"),
                of("D", PROOF, "B", "C")));
        var first = resolver.resolve(graph, List.of("D"));
        for (int i = 0; i < 10; i++) {
            assertEquals(first, resolver.resolve(graph, List.of("D")));
        }
    }

    @RepeatedTest(25)
    @DisplayName("random DAG orders are valid linearizations")
    void randomDagIsLinearized() {
        var random = new Random();
        int size = 1 + random.nextInt(30);
        var declarations = new ArrayList<TaskDeclaration>();
        for (int i = 0; i < size; i++) {
            var deps = new ArrayList<String>();
            for (int j = 0; j < i; j++) {
                if (random.nextInt(4) == 0) deps.add("t" + j);
            }
            declarations.add(new TaskDeclaration("t" + i, PROOF, null, deps));
        }
        // shuffle declaration order; edges stay acyclic because they follow the original numbering
        Collections.shuffle(declarations, random);
        var graph = TaskGraph.build(declarations);

        var order = resolver.resolve(graph, List.of("all"));
        assertEquals(size, order.size());
        var position = new HashMap<String, Integer>();
        for (int i = 0; i < order.size(); i++) {
            position.put(order.get(i).name(), i);
        }
        for (var node : order) {
            for (String dep : graph.dependencyNames(node)) {
                assertTrue(position.get(dep) < position.get(node.name()),
                        dep + " must come before " + node.name());
            }
        }
    }
}
