package com.proofline.core.executor;

import com.proofline.config.ProoflineProperties;
import com.proofline.core.graph.TaskNode;
import com.proofline.core.model.Outcome;
import com.proofline.verifier.VerificationRequest;
import com.proofline.verifier.Verifier;
import com.proofline.verifier.VerifierResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one verifier invocation for a task and classifies its result into an {@link Outcome}.
 *
 * <p>The verifier runs on a separate invocation thread so that the per-task timeout holds even
 * when a verifier ignores its own deadline. After {@code timeout + grace} the invocation is
 * cancelled with interruption and the task is reported as timed out.
 */
@Component
public class TaskExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    /** Reported for infrastructure errors where the verifier never produced an exit status. */
    public static final int INFRASTRUCTURE_ERROR = -1;

    private static final long MIN_CANCEL_CHECK_MS = 250;

    private static final int RUNNING = 0;
    private static final int RETURNED = 1;
    private static final int STUCK = 2;

    private final Verifier verifier;
    private final Duration grace;
    private final ExecutorService invocations;
    private final AtomicInteger stuck = new AtomicInteger();

    @Autowired
    public TaskExecutor(Verifier verifier, ProoflineProperties properties) {
        this(verifier, Duration.ofSeconds(properties.getGraceSeconds()));
    }

    public TaskExecutor(Verifier verifier, Duration grace) {
        this.verifier = verifier;
        this.grace = grace;
        var counter = new AtomicInteger();
        this.invocations = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "verifier-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Executes {@code task} and blocks until it finishes or its timeout expires.
     *
     * @param timeoutSeconds per-task timeout; 0 waits without limit
     * @param logPath        where the verifier should write the task's output
     * @return the classified outcome, never {@code null}
     */
    public Outcome run(TaskNode task, int timeoutSeconds, Path logPath) {
        var request = new VerificationRequest(task.name(), task.kind(), task.target(), timeoutSeconds, logPath);
        Instant startedAt = Instant.now();
        var state = new AtomicInteger(RUNNING);
        Future<VerifierResult> invocation = invocations.submit(() -> {
            try {
                return verifier.execute(request);
            } finally {
                if (!state.compareAndSet(RUNNING, RETURNED)) {
                    stuck.decrementAndGet();
                    log.info("Cancelled verifier for task {} has returned", task.name());
                }
            }
        });
        try {
            VerifierResult result = timeoutSeconds > 0
                    ? invocation.get(timeoutSeconds + grace.toSeconds(), TimeUnit.SECONDS)
                    : invocation.get();
            return classify(task, result, startedAt, logPath);
        } catch (TimeoutException e) {
            invocation.cancel(true);
            watchCancelled(task, state);
            log.warn("Task {} did not finish within {}s, cancelled", task.name(), timeoutSeconds);
            return Outcome.timedOut(startedAt, Instant.now(), logPath);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Verifier failed for task {}: {}", task.name(), cause.getMessage(), cause);
            return Outcome.failed(INFRASTRUCTURE_ERROR, startedAt, Instant.now(), logPath);
        } catch (InterruptedException e) {
            invocation.cancel(true);
            watchCancelled(task, state);
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for task {}", task.name());
            return Outcome.failed(INFRASTRUCTURE_ERROR, startedAt, Instant.now(), logPath);
        }
    }

    /**
     * Number of cancelled invocations whose verifier has not returned yet. Each one holds an
     * invocation thread until it does.
     */
    public int stuckInvocations() {
        return stuck.get();
    }

    private void watchCancelled(TaskNode task, AtomicInteger state) {
        long delayMs = Math.max(grace.toMillis(), MIN_CANCEL_CHECK_MS);
        CompletableFuture.runAsync(() -> {
            if (state.compareAndSet(RUNNING, STUCK)) {
                int count = stuck.incrementAndGet();
                log.warn("Verifier for task {} ignored cancellation and is still running {}ms later ({} stuck invocation(s))",
                        task.name(), delayMs, count);
            }
        }, CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS));
    }

    private Outcome classify(TaskNode task, VerifierResult result, Instant startedAt, Path requestedLog) {
        Instant finishedAt = Instant.now();
        Path logPath = result.logPath() != null ? result.logPath() : requestedLog;
        if (result.timedOut() || result.exitCode() == VerifierResult.TIMEOUT_EXIT_CODE) {
            log.warn("Task {} timed out (exit code {})", task.name(), result.exitCode());
            return Outcome.timedOut(startedAt, finishedAt, logPath);
        }
        if (result.exitCode() == 0) {
            return Outcome.succeeded(startedAt, finishedAt, logPath);
        }
        log.info("Task {} failed with exit code {}", task.name(), result.exitCode());
        return Outcome.failed(result.exitCode(), startedAt, finishedAt, logPath);
    }

    @Override
    public void close() {
        invocations.shutdownNow();
    }
}
