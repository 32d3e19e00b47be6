package com.proofline.dispatch.cli;

import com.proofline.core.error.ConfigurationException;
import com.proofline.core.summary.Reporter;
import com.proofline.core.summary.SessionSummary;
import com.proofline.core.summary.SummaryWriter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: proofline show &lt;summary.json|session dir&gt;
 * <p>
 * Re-renders a persisted session summary and exits with that session's status code.
 */
@Command(name = "show", mixinStandardHelpOptions = true,
        description = "Show the summary of a previous session",
        exitCodeOnInvalidInput = ConfigurationException.EXIT_CODE)
@Component
public class ShowCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "PATH", description = "summary.json file or session directory")
    private Path location;

    private final SummaryWriter summaryWriter;
    private final Reporter reporter;

    public ShowCommand(SummaryWriter summaryWriter, Reporter reporter) {
        this.summaryWriter = summaryWriter;
        this.reporter = reporter;
    }

    @Override
    public Integer call() {
        SessionSummary summary;
        try {
            summary = summaryWriter.read(location);
        } catch (UncheckedIOException e) {
            ConsoleOutput.error("Cannot read session summary: " + e.getMessage());
            return ConfigurationException.EXIT_CODE;
        }
        reporter.report(summary);
        return summary.overallStatus().exitCode();
    }
}
