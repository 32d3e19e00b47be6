package com.proofline.verifier;

import com.proofline.core.model.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Verifier that runs each task as an external process.
 *
 * <p>The command comes from the invocation table: one template per {@link TaskKind}, with
 * the placeholders {@code {task}}, {@code {target}} and {@code {timeout}} substituted per task.
 * stdout and stderr go to the request's log file. When the timeout expires, or the calling
 * thread is interrupted, the process and all of its descendants are destroyed forcibly.
 */
public class ProcessVerifier implements Verifier {

    private static final Logger log = LoggerFactory.getLogger(ProcessVerifier.class);

    private static final long DESTROY_WAIT_SECONDS = 5;

    private final Map<TaskKind, List<String>> commands;
    private final Path workingDir;

    public ProcessVerifier(Map<TaskKind, List<String>> commands, Path workingDir) {
        this.commands = commands.isEmpty() ? Map.of() : new EnumMap<>(commands);
        this.workingDir = workingDir;
    }

    @Override
    public VerifierResult execute(VerificationRequest request) {
        List<String> command = buildCommand(request);
        Path logPath = request.logPath();
        try {
            if (logPath.getParent() != null) {
                Files.createDirectories(logPath.getParent());
            }
        } catch (IOException e) {
            throw new VerifierException("Cannot create log directory for task " + request.taskId(), e);
        }

        log.info("Starting {} for task {}: {}", request.kind(), request.taskId(), String.join(" ", command));
        long startNanos = System.nanoTime();
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workingDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(logPath.toFile())
                    .start();
        } catch (IOException e) {
            throw new VerifierException("Cannot start verifier for task " + request.taskId()
                    + ": " + e.getMessage(), e);
        }

        try {
            boolean finished;
            if (request.timeoutSeconds() > 0) {
                finished = process.waitFor(request.timeoutSeconds(), TimeUnit.SECONDS);
            } else {
                process.waitFor();
                finished = true;
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            if (!finished) {
                log.warn("Task {} exceeded {}s, terminating verifier", request.taskId(), request.timeoutSeconds());
                destroyTree(process);
                return VerifierResult.timedOut(elapsed, logPath);
            }
            int exitCode = process.exitValue();
            log.info("Task {} verifier exited with code {} after {}ms", request.taskId(), exitCode, elapsed.toMillis());
            return VerifierResult.completed(exitCode, elapsed, logPath);
        } catch (InterruptedException e) {
            destroyTree(process);
            Thread.currentThread().interrupt();
            throw new VerifierException("Verification of task " + request.taskId() + " was cancelled", e);
        }
    }

    /**
     * Substitutes the per-task placeholders into the kind's command template.
     *
     * @throws VerifierException if no command is configured for the request's kind
     */
    List<String> buildCommand(VerificationRequest request) {
        List<String> template = commands.get(request.kind());
        if (template == null || template.isEmpty()) {
            throw new VerifierException("No command configured for task kind " + request.kind());
        }
        var command = new ArrayList<String>(template.size());
        for (String part : template) {
            command.add(part
                    .replace("{task}", request.taskId())
                    .replace("{target}", request.target())
                    .replace("{timeout}", String.valueOf(request.timeoutSeconds())));
        }
        return command;
    }

    private void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(DESTROY_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Verifier process {} did not exit after forced termination", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
