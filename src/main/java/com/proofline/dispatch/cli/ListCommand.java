package com.proofline.dispatch.cli;

import com.proofline.core.engine.SessionEngine;
import com.proofline.core.error.ConfigurationException;
import com.proofline.core.graph.TaskGraph;
import com.proofline.core.graph.TaskNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: proofline list
 */
@Command(name = "list", mixinStandardHelpOptions = true,
        description = "List the configured tasks",
        exitCodeOnInvalidInput = ConfigurationException.EXIT_CODE)
@Component
public class ListCommand implements Callable<Integer> {

    private final SessionEngine sessionEngine;

    public ListCommand(SessionEngine sessionEngine) {
        this.sessionEngine = sessionEngine;
    }

    @Override
    public Integer call() {
        TaskGraph graph;
        try {
            graph = sessionEngine.loadGraph();
        } catch (ConfigurationException e) {
            ConsoleOutput.error(e.getMessage());
            return ConfigurationException.EXIT_CODE;
        }

        if (graph.size() == 0) {
            ConsoleOutput.info("No tasks configured.");
            return 0;
        }
        System.out.printf("%-28s %-12s %-24s %s%n", "TASK", "KIND", "TARGET", "DEPENDS ON");
        for (TaskNode node : graph.nodes()) {
            List<String> deps = graph.dependencyNames(node);
            System.out.printf("%-28s %-12s %-24s %s%n", node.name(), node.kind(), node.target(),
                    deps.isEmpty() ? "-" : String.join(", ", deps));
        }
        return 0;
    }
}
