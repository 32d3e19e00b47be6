package com.proofline.dispatch.cli;

import com.proofline.core.error.ConfigurationException;
import com.proofline.core.health.HealthStatus;
import com.proofline.core.health.ToolHealthService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: proofline health
 * <p>
 * Checks that each verification engine can be found and that results can be written.
 * Exits with 1 if any check is down or degraded.
 */
@Command(name = "health", mixinStandardHelpOptions = true,
        description = "Check verification tool availability",
        exitCodeOnInvalidInput = ConfigurationException.EXIT_CODE)
@Component
public class HealthCommand implements Callable<Integer> {

    private final ToolHealthService healthService;

    public HealthCommand(ToolHealthService healthService) {
        this.healthService = healthService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<HealthStatus> checks = healthService.checkAll();
        for (HealthStatus check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> ConsoleOutput.error(label);
            }
        }
        boolean allUp = checks.stream().allMatch(HealthStatus::isUp);

        System.out.println(ConsoleOutput.RULE);
        if (allUp) {
            ConsoleOutput.success("Overall: all verification tools available");
            return 0;
        }
        ConsoleOutput.error("Overall: one or more tools unavailable");
        return 1;
    }
}
