package com.proofline.core.executor;

import com.proofline.core.graph.TaskNode;
import com.proofline.core.model.Outcome;
import com.proofline.core.model.TaskKind;
import com.proofline.verifier.VerificationRequest;
import com.proofline.verifier.Verifier;
import com.proofline.verifier.VerifierException;
import com.proofline.verifier.VerifierResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TaskExecutorTest {

    private static final TaskNode SAFETY = new TaskNode(0, "Safety", TaskKind.PROOF, "Safety", List.of(), List.of());
    private static final Path LOG = Path.of("results", "Safety.log");

    private TaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.close();
        }
    }

    private TaskExecutor executorReturning(VerifierResult result) {
        Verifier verifier = mock(Verifier.class);
        when(verifier.execute(any())).thenReturn(result);
        executor = new TaskExecutor(verifier, Duration.ZERO);
        return executor;
    }

    @Nested
    @DisplayName("Classification")
    class ClassificationTests {

        @Test
        @DisplayName("exit 0 -> succeeded")
        void success() {
            var outcome = executorReturning(VerifierResult.completed(0, Duration.ofMillis(5), LOG))
                    .run(SAFETY, 10, LOG);
            assertEquals(Outcome.Result.SUCCEEDED, outcome.result());
            assertEquals(0, outcome.exitCode());
            assertEquals(LOG, outcome.logPath());
            assertFalse(outcome.finishedAt().isBefore(outcome.startedAt()));
        }

        @Test
        @DisplayName("nonzero exit -> failed with that code")
        void failure() {
            var outcome = executorReturning(VerifierResult.completed(12, Duration.ofMillis(5), LOG))
                    .run(SAFETY, 10, LOG);
            assertEquals(Outcome.Result.FAILED, outcome.result());
            assertEquals(12, outcome.exitCode());
        }

        @Test
        @DisplayName("exit 124 -> timed out")
        void exitCode124IsTimeout() {
            var outcome = executorReturning(VerifierResult.completed(124, Duration.ofSeconds(1), LOG))
                    .run(SAFETY, 10, LOG);
            assertEquals(Outcome.Result.TIMED_OUT, outcome.result());
            assertNull(outcome.exitCode());
        }

        @Test
        @DisplayName("verifier-reported timeout -> timed out")
        void reportedTimeout() {
            var outcome = executorReturning(VerifierResult.timedOut(Duration.ofSeconds(1), LOG))
                    .run(SAFETY, 10, LOG);
            assertEquals(Outcome.Result.TIMED_OUT, outcome.result());
        }

        @Test
        @DisplayName("verifier exception -> failed(-1)")
        void verifierThrows() {
            Verifier verifier = mock(Verifier.class);
            when(verifier.execute(any())).thenThrow(new VerifierException("cannot start"));
            executor = new TaskExecutor(verifier, Duration.ZERO);

            var outcome = executor.run(SAFETY, 10, LOG);
            assertEquals(Outcome.Result.FAILED, outcome.result());
            assertEquals(TaskExecutor.INFRASTRUCTURE_ERROR, outcome.exitCode());
        }
    }

    @Test
    @DisplayName("request carries task id, kind, target, timeout and log path")
    void buildsRequest() {
        Verifier verifier = mock(Verifier.class);
        when(verifier.execute(any())).thenReturn(VerifierResult.completed(0, Duration.ZERO, LOG));
        executor = new TaskExecutor(verifier, Duration.ZERO);

        var node = new TaskNode(3, "model-small", TaskKind.MODEL_CHECK, "Small", List.of(), List.of());
        executor.run(node, 30, LOG);

        verify(verifier).execute(new VerificationRequest("model-small", TaskKind.MODEL_CHECK, "Small", 30, LOG));
    }

    @Test
    @DisplayName("verifier ignoring its deadline is cancelled and reported as timed out")
    void hungVerifierIsCancelled() throws Exception {
        var interrupted = new CountDownLatch(1);
        Verifier hung = request -> {
            try {
                Thread.sleep(60_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return VerifierResult.completed(0, Duration.ZERO, request.logPath());
        };
        executor = new TaskExecutor(hung, Duration.ZERO);

        long start = System.nanoTime();
        var outcome = executor.run(SAFETY, 1, LOG);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals(Outcome.Result.TIMED_OUT, outcome.result());
        assertTrue(elapsedMs >= 900 && elapsedMs < 5_000, "took " + elapsedMs + "ms");
        assertTrue(interrupted.await(5, TimeUnit.SECONDS), "invocation should be interrupted");
        awaitStuck(0);
    }

    @Test
    @DisplayName("verifier that swallows interruption is counted as stuck until it returns")
    void stubbornVerifierIsTracked() throws Exception {
        var release = new CountDownLatch(1);
        Verifier stubborn = request -> {
            while (true) {
                try {
                    if (release.await(60, TimeUnit.SECONDS)) {
                        return VerifierResult.completed(0, Duration.ZERO, request.logPath());
                    }
                } catch (InterruptedException ignored) {
                    // keeps running after cancellation
                }
            }
        };
        executor = new TaskExecutor(stubborn, Duration.ZERO);

        var outcome = executor.run(SAFETY, 1, LOG);

        assertEquals(Outcome.Result.TIMED_OUT, outcome.result());
        awaitStuck(1);
        release.countDown();
        awaitStuck(0);
    }

    private void awaitStuck(int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (executor.stuckInvocations() != expected && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(expected, executor.stuckInvocations());
    }
}
