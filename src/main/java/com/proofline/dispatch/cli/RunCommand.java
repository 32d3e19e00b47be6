package com.proofline.dispatch.cli;

import com.proofline.core.engine.SessionEngine;
import com.proofline.core.engine.SessionRequest;
import com.proofline.core.engine.SessionResult;
import com.proofline.core.error.ConfigurationException;
import com.proofline.core.events.EventBus;
import com.proofline.core.summary.Reporter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: proofline run &lt;task|all&gt;...
 * <p>
 * Runs the requested tasks and everything they depend on, prints progress and a summary,
 * and exits with 0 (success), 1 (failure), 2 (timeout) or 3 (configuration error).
 */
@Command(name = "run", mixinStandardHelpOptions = true,
        description = "Run verification tasks and their dependencies",
        exitCodeOnInvalidInput = ConfigurationException.EXIT_CODE)
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "TASK", description = "Task names, or 'all'")
    private List<String> tasks;

    @Option(names = {"--concurrency", "-j"}, description = "Maximum number of tasks running at once")
    private Integer concurrency;

    @Option(names = {"--timeout", "-t"}, description = "Per-task timeout in seconds (0 disables it)")
    private Integer timeoutSeconds;

    @Option(names = "--fail-fast", description = "Stop launching tasks after the first failure or timeout")
    private Boolean failFast;

    @Option(names = "--results-dir", description = "Directory for session logs and summary.json")
    private Path resultsDir;

    @Option(names = {"--quiet", "-q"}, description = "Only print the final summary")
    private boolean quiet;

    private final SessionEngine sessionEngine;
    private final EventBus eventBus;
    private final Reporter reporter;

    public RunCommand(SessionEngine sessionEngine, EventBus eventBus, Reporter reporter) {
        this.sessionEngine = sessionEngine;
        this.eventBus = eventBus;
        this.reporter = reporter;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        SessionResult result;
        try (EventBus.Subscription ignored = quiet ? null : eventBus.subscribe(ConsoleOutput::event)) {
            result = sessionEngine.run(new SessionRequest(tasks, concurrency, timeoutSeconds, failFast, resultsDir));
        } catch (ConfigurationException e) {
            ConsoleOutput.error(e.getMessage());
            return ConfigurationException.EXIT_CODE;
        }

        reporter.report(result.summary());
        if (result.summaryFile() != null) {
            ConsoleOutput.info("Summary written to " + result.summaryFile());
        }
        return result.summary().overallStatus().exitCode();
    }
}
