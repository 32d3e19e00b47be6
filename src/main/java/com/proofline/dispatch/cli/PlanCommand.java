package com.proofline.dispatch.cli;

import com.proofline.core.engine.SessionEngine;
import com.proofline.core.error.ConfigurationException;
import com.proofline.core.graph.TaskNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: proofline plan &lt;task|all&gt;...
 * <p>
 * Prints the order in which the requested tasks and their dependencies would run.
 */
@Command(name = "plan", mixinStandardHelpOptions = true,
        description = "Show the execution order without running anything",
        exitCodeOnInvalidInput = ConfigurationException.EXIT_CODE)
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "TASK", description = "Task names, or 'all'")
    private List<String> tasks;

    private final SessionEngine sessionEngine;

    public PlanCommand(SessionEngine sessionEngine) {
        this.sessionEngine = sessionEngine;
    }

    @Override
    public Integer call() {
        List<TaskNode> order;
        try {
            order = sessionEngine.plan(tasks);
        } catch (ConfigurationException e) {
            ConsoleOutput.error(e.getMessage());
            return ConfigurationException.EXIT_CODE;
        }

        ConsoleOutput.info("Execution order for " + String.join(", ", tasks) + ":");
        int position = 1;
        for (TaskNode node : order) {
            System.out.printf("  %2d. %-28s [%s]%n", position++, node.name(), node.kind());
        }
        return 0;
    }
}
