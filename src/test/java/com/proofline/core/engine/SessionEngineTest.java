package com.proofline.core.engine;

import com.proofline.config.ProoflineProperties;
import com.proofline.core.error.CycleDetectedException;
import com.proofline.core.error.InvalidOptionException;
import com.proofline.core.error.UnknownTaskException;
import com.proofline.core.events.EventBus;
import com.proofline.core.executor.TaskExecutor;
import com.proofline.core.graph.DependencyResolver;
import com.proofline.core.graph.TaskNode;
import com.proofline.core.metrics.ProoflineMetrics;
import com.proofline.core.model.OverallStatus;
import com.proofline.core.model.TaskKind;
import com.proofline.core.model.TaskStatus;
import com.proofline.core.scheduler.Scheduler;
import com.proofline.core.summary.ResultAggregator;
import com.proofline.core.summary.SummaryWriter;
import com.proofline.verifier.VerificationRequest;
import com.proofline.verifier.VerifierResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SessionEngineTest {

    @TempDir
    Path resultsDir;

    private ProoflineProperties properties;
    private SimpleMeterRegistry registry;
    private TaskExecutor executor;
    private SessionEngine engine;
    private final Map<String, Integer> exitCodes = new ConcurrentHashMap<>();
    private final List<VerificationRequest> requests = new CopyOnWriteArrayList<>();

    private static ProoflineProperties.TaskDefinition task(String name, TaskKind kind, String... deps) {
        var definition = new ProoflineProperties.TaskDefinition();
        definition.setName(name);
        definition.setKind(kind);
        definition.setDependsOn(new ArrayList<>(List.of(deps)));
        return definition;
    }

    @BeforeEach
    void setUp() {
        properties = new ProoflineProperties();
        properties.setConcurrency(2);
        properties.setTimeoutSeconds(120);
        properties.setResultsDir(resultsDir.toString());
        properties.setTasks(new ArrayList<>(List.of(
                task("Types", TaskKind.PROOF),
                task("Utils", TaskKind.PROOF, "Types"),
                task("Safety", TaskKind.PROOF, "Utils"),
                task("model-small", TaskKind.MODEL_CHECK))));

        executor = new TaskExecutor(request -> {
            requests.add(request);
            return VerifierResult.completed(exitCodes.getOrDefault(request.taskId(), 0), Duration.ZERO,
                    request.logPath());
        }, Duration.ZERO);
        registry = new SimpleMeterRegistry();
        var metrics = new ProoflineMetrics(registry);
        engine = new SessionEngine(properties, new DependencyResolver(),
                new Scheduler(executor, new EventBus(), metrics),
                new ResultAggregator(), new SummaryWriter(), metrics);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("runs the closure and persists summary.json")
        void runsAndPersists() {
            var result = engine.run(SessionRequest.of("Safety"));

            assertEquals(OverallStatus.SUCCESS, result.summary().overallStatus());
            assertEquals(3, result.summary().tasks().size());
            assertNotNull(result.summaryFile());
            assertTrue(Files.exists(result.summaryFile()));
            assertEquals(resultsDir.resolve(result.summary().sessionId()), result.summaryFile().getParent());
            assertEquals(List.of("Types", "Utils", "Safety"),
                    requests.stream().map(VerificationRequest::taskId).toList());
        }

        @Test
        @DisplayName("uses configured defaults when no overrides are given")
        void usesDefaults() {
            var result = engine.run(SessionRequest.of("model-small"));

            assertEquals(2, result.summary().concurrency());
            assertEquals(120, result.summary().timeoutSeconds());
            assertEquals(120, requests.get(0).timeoutSeconds());
        }

        @Test
        @DisplayName("request overrides win over configuration")
        void overrides() {
            Path other = resultsDir.resolve("other");
            var result = engine.run(new SessionRequest(List.of("model-small"), 1, 0, true, other));

            assertEquals(1, result.summary().concurrency());
            assertEquals(0, result.summary().timeoutSeconds());
            assertTrue(result.summary().failFast());
            assertTrue(result.summaryFile().startsWith(other));
        }

        @Test
        @DisplayName("failed dependency yields FAILURE with the dependent cascaded")
        void failure() {
            exitCodes.put("Utils", 1);
            var summary = engine.run(SessionRequest.of("all")).summary();

            assertEquals(OverallStatus.FAILURE, summary.overallStatus());
            assertEquals(2, summary.count(TaskStatus.SUCCEEDED));
            assertEquals(2, summary.count(TaskStatus.FAILED));
        }

        @Test
        @DisplayName("exit 124 yields TIMEOUT")
        void timeout() {
            exitCodes.put("model-small", VerifierResult.TIMEOUT_EXIT_CODE);
            var summary = engine.run(SessionRequest.of("model-small")).summary();
            assertEquals(OverallStatus.TIMEOUT, summary.overallStatus());
        }

        @Test
        @DisplayName("timed-out dependency yields FAILURE because its dependent is cascaded")
        void timeoutCascadeIsFailure() {
            exitCodes.put("Types", VerifierResult.TIMEOUT_EXIT_CODE);
            var summary = engine.run(SessionRequest.of("Safety")).summary();

            assertEquals(OverallStatus.FAILURE, summary.overallStatus());
            assertEquals(1, summary.count(TaskStatus.TIMED_OUT));
            assertEquals(2, summary.count(TaskStatus.FAILED));
            assertEquals(1, summary.overallStatus().exitCode());
        }

        @Test
        @DisplayName("records session metrics")
        void recordsMetrics() {
            engine.run(SessionRequest.of("Safety"));

            var sessions = registry.find("proofline.sessions.total").tag("status", "success").counter();
            assertNotNull(sessions);
            assertEquals(1.0, sessions.count());
            var tasks = registry.find("proofline.task.duration").tag("kind", "proof").timer();
            assertNotNull(tasks);
            assertEquals(3, tasks.count());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("concurrency below 1 is rejected before anything runs")
        void invalidConcurrency() {
            assertThrows(InvalidOptionException.class,
                    () -> engine.run(new SessionRequest(List.of("Types"), 0, null, null, null)));
            assertTrue(requests.isEmpty());
        }

        @Test
        @DisplayName("negative timeout is rejected")
        void negativeTimeout() {
            assertThrows(InvalidOptionException.class,
                    () -> engine.run(new SessionRequest(List.of("Types"), null, -1, null, null)));
        }

        @Test
        @DisplayName("empty request is rejected")
        void emptyRequest() {
            assertThrows(InvalidOptionException.class, () -> engine.run(SessionRequest.of()));
        }

        @Test
        @DisplayName("unknown task is rejected and no session directory is created")
        void unknownTask() throws Exception {
            assertThrows(UnknownTaskException.class, () -> engine.run(SessionRequest.of("Nope")));
            try (var entries = Files.list(resultsDir)) {
                assertEquals(0, entries.count());
            }
        }

        @Test
        @DisplayName("cyclic task table is rejected")
        void cyclicTable() {
            properties.getTasks().add(task("X", TaskKind.HARNESS, "Y"));
            properties.getTasks().add(task("Y", TaskKind.HARNESS, "X"));
            assertThrows(CycleDetectedException.class, () -> engine.plan(List.of("Types")));
        }
    }

    @Test
    @DisplayName("plan resolves the order without running anything")
    void plan() {
        var order = engine.plan(List.of("Safety", "model-small"));
        assertEquals(List.of("Types", "Utils", "Safety", "model-small"),
                order.stream().map(TaskNode::name).toList());
        assertTrue(requests.isEmpty());
    }

    @Test
    @DisplayName("session ids are unique and timestamped")
    void sessionIds() {
        String first = SessionEngine.generateSessionId();
        String second = SessionEngine.generateSessionId();
        assertTrue(first.matches("PFL-\\d{8}-\\d{6}-\\d{4}"), first);
        assertNotEquals(first, second);
    }
}
