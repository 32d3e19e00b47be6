package com.proofline.core.health;

import com.proofline.config.ProoflineProperties;
import com.proofline.core.model.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks that the verification engines can be launched and that results can be written.
 */
@Service
public class ToolHealthService {

    private static final Logger log = LoggerFactory.getLogger(ToolHealthService.class);

    private final Map<TaskKind, List<String>> commands;
    private final Path workingDir;
    private final Path resultsDir;
    private final String searchPath;

    @Autowired
    public ToolHealthService(ProoflineProperties properties) {
        this(properties.getCommands(), properties.workingPath(), properties.resultsPath(), System.getenv("PATH"));
    }

    ToolHealthService(Map<TaskKind, List<String>> commands, Path workingDir, Path resultsDir, String searchPath) {
        this.commands = commands;
        this.workingDir = workingDir;
        this.resultsDir = resultsDir;
        this.searchPath = searchPath == null ? "" : searchPath;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        for (TaskKind kind : TaskKind.values()) {
            results.add(checkTool(kind));
        }
        results.add(checkResultsDir());
        return results;
    }

    HealthStatus checkTool(TaskKind kind) {
        String component = "tool:" + kind.name().toLowerCase();
        List<String> template = commands.get(kind);
        if (template == null || template.isEmpty()) {
            return HealthStatus.down(component, "No command configured", Map.of());
        }
        String executable = template.get(0);
        Map<String, String> metadata = Map.of("executable", executable);
        Optional<Path> resolved = resolveExecutable(executable);
        if (resolved.isPresent()) {
            return HealthStatus.up(component, "Found " + resolved.get(), metadata);
        }
        Optional<Path> present = locate(executable);
        if (present.isPresent()) {
            log.debug("Executable {} for {} exists at {} without execute permission", executable, kind, present.get());
            return HealthStatus.degraded(component, present.get() + " is not executable", metadata);
        }
        log.debug("Executable {} for {} not found", executable, kind);
        return HealthStatus.down(component, executable + " not available", metadata);
    }

    HealthStatus checkResultsDir() {
        try {
            Files.createDirectories(resultsDir);
        } catch (IOException e) {
            log.warn("Results directory check failed: {}", e.getMessage());
            return HealthStatus.down("results-dir", "Cannot create " + resultsDir + ": " + e.getMessage(), Map.of());
        }
        if (!Files.isWritable(resultsDir)) {
            return HealthStatus.down("results-dir", resultsDir + " is not writable", Map.of());
        }
        return HealthStatus.up("results-dir", resultsDir.toAbsolutePath() + " is writable", Map.of());
    }

    /**
     * Executables containing a path separator are resolved against the working directory,
     * bare names against the search path.
     */
    Optional<Path> resolveExecutable(String executable) {
        return candidates(executable).stream().filter(Files::isExecutable).findFirst();
    }

    /** Like {@link #resolveExecutable} but ignores the execute permission. */
    Optional<Path> locate(String executable) {
        return candidates(executable).stream().findFirst();
    }

    private List<Path> candidates(String executable) {
        var found = new ArrayList<Path>();
        if (executable.contains("/") || executable.contains(File.separator)) {
            Path candidate = workingDir.resolve(executable);
            if (Files.isRegularFile(candidate)) found.add(candidate);
            return found;
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            Path candidate = Path.of(dir, executable);
            if (Files.isRegularFile(candidate)) found.add(candidate);
        }
        return found;
    }
}
