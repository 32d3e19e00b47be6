package com.proofline.dispatch.cli;

import com.proofline.core.error.ConfigurationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Proofline.
 * Routes to subcommands: run, plan, list, show, health.
 */
@Command(
        name = "proofline",
        mixinStandardHelpOptions = true,
        version = "Proofline 0.1.0",
        description = "Runs model checks, proofs and test harnesses in dependency order",
        exitCodeOnInvalidInput = ConfigurationException.EXIT_CODE,
        subcommands = {
                RunCommand.class,
                PlanCommand.class,
                ListCommand.class,
                ShowCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ProoflineCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
