package com.proofline.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Executes the command line once the context is up and keeps the command's return value.
 * <p>
 * That value is the process exit status: 0, 1 or 2 for a run's verdict, 3 for a configuration
 * error or invalid input. {@code ProoflineApplication} reads it back through
 * {@link ExitCodeGenerator} and passes it to {@code System.exit}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ProoflineCommand prooflineCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ProoflineCommand prooflineCommand, IFactory factory) {
        this.prooflineCommand = prooflineCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(prooflineCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
