package com.proofline.core.scheduler;

import com.proofline.core.error.AggregationInconsistencyException;
import com.proofline.core.events.EventBus;
import com.proofline.core.events.SessionEvent;
import com.proofline.core.executor.TaskExecutor;
import com.proofline.core.graph.TaskNode;
import com.proofline.core.logging.MdcContext;
import com.proofline.core.metrics.ProoflineMetrics;
import com.proofline.core.model.FailureCause;
import com.proofline.core.model.Outcome;
import com.proofline.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the tasks of a session on a bounded worker pool, respecting dependencies.
 *
 * <p>A single control loop owns the session: it launches ready tasks while workers are free,
 * then blocks on the completion queue. Each worker posts exactly one completion per task.
 * A finished task either unblocks its dependents or fails every transitive dependent that has
 * not run yet. With fail-fast, the first unsuccessful outcome stops all further launches.
 */
@Service
public class Scheduler {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final TaskExecutor executor;
    private final EventBus eventBus;
    private final ProoflineMetrics metrics;

    @Autowired
    public Scheduler(TaskExecutor executor, EventBus eventBus,
                     @Autowired(required = false) ProoflineMetrics metrics) {
        this.executor = executor;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    Scheduler(TaskExecutor executor) {
        this(executor, new EventBus(), null);
    }

    private record Completion(int index, Outcome outcome) {}

    /**
     * Runs the session to completion. Returns once every task of the session is terminal.
     *
     * @throws AggregationInconsistencyException if the loop can make no further progress
     * @throws CancellationException             if the calling thread is interrupted
     */
    public void run(ExecutionSession session) {
        MdcContext.setSession(session.sessionId());
        var counter = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(Math.max(1, session.concurrency()), r -> {
            Thread t = new Thread(r, "proofline-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            new ControlLoop(session, workers).run();
        } finally {
            workers.shutdownNow();
            MdcContext.clear();
        }
    }

    /** Per-run state of the control loop; confined to the calling thread. */
    private final class ControlLoop {

        private final ExecutionSession session;
        private final ExecutorService workers;
        private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
        private final PriorityQueue<Integer> ready = new PriorityQueue<>();
        private int running;
        private boolean aborted;

        ControlLoop(ExecutionSession session, ExecutorService workers) {
            this.session = session;
            this.workers = workers;
        }

        void run() {
            session.markStarted(Instant.now());
            log.info("Session {} started: {} tasks, concurrency {}, timeout {}s{}",
                    session.sessionId(), session.order().size(), session.concurrency(),
                    session.timeoutSeconds(), session.failFast() ? ", fail-fast" : "");
            publish(SessionEvent.SESSION_STARTED, null, Map.of(
                    "tasks", session.order().stream().map(TaskNode::name).toList(),
                    "concurrency", session.concurrency()));

            for (TaskNode node : session.order()) {
                if (node.dependencies().isEmpty()) {
                    session.markReady(node.index());
                    ready.add(node.index());
                }
            }

            while (!session.isComplete()) {
                while (!aborted && running < session.concurrency() && !ready.isEmpty()) {
                    launch(session.graph().node(ready.poll()));
                }
                if (running == 0) {
                    throw new AggregationInconsistencyException("Session " + session.sessionId()
                            + " is stuck: " + session.remaining() + " tasks remain but none is ready or running");
                }
                Completion completion;
                try {
                    completion = completions.take();
                } catch (InterruptedException e) {
                    abortRemaining();
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Session " + session.sessionId() + " was interrupted");
                }
                running--;
                complete(completion);
            }

            session.markFinished(Instant.now());
            log.info("Session {} completed", session.sessionId());
            publish(SessionEvent.SESSION_COMPLETED, null, Map.of("aborted", aborted));
        }

        private void launch(TaskNode node) {
            Instant launchedAt = Instant.now();
            session.markRunning(node.index(), launchedAt);
            running++;
            log.info("Launching task {} [{}]", node.name(), node.kind());
            publish(SessionEvent.TASK_STARTED, node.name(), Map.of("kind", node.kind().name()));

            String sessionId = session.sessionId();
            int timeout = session.timeoutSeconds();
            var logPath = session.logPath(node);
            workers.execute(() -> {
                MdcContext.setTask(sessionId, node.name(), node.kind().name());
                Outcome outcome = null;
                try {
                    outcome = executor.run(node, timeout, logPath);
                } catch (RuntimeException e) {
                    log.error("Task {} failed with an unexpected error: {}", node.name(), e.getMessage(), e);
                } finally {
                    if (outcome == null) {
                        outcome = Outcome.failed(TaskExecutor.INFRASTRUCTURE_ERROR, launchedAt, Instant.now(), logPath);
                    }
                    completions.add(new Completion(node.index(), outcome));
                    MdcContext.clear();
                }
            });
        }

        private void complete(Completion completion) {
            TaskNode node = session.graph().node(completion.index());
            Outcome outcome = completion.outcome();
            session.recordOutcome(node.index(), outcome);
            if (metrics != null) {
                metrics.recordTaskExecution(node.kind(), outcome.status(), outcome.durationMs());
            }

            var payload = new LinkedHashMap<String, Object>();
            payload.put("kind", node.kind().name());
            payload.put("status", outcome.status().name());
            payload.put("durationMs", outcome.durationMs());
            if (outcome.exitCode() != null) {
                payload.put("exitCode", outcome.exitCode());
            }
            String eventType = switch (outcome.result()) {
                case SUCCEEDED -> SessionEvent.TASK_SUCCEEDED;
                case FAILED -> SessionEvent.TASK_FAILED;
                case TIMED_OUT -> SessionEvent.TASK_TIMED_OUT;
            };
            publish(eventType, node.name(), payload);

            if (outcome.succeeded()) {
                log.info("Task {} succeeded in {}ms", node.name(), outcome.durationMs());
                unblockDependents(node);
                return;
            }

            log.warn("Task {} ended {} (exit code {})", node.name(), outcome.status(), outcome.exitCode());
            cascade(node);
            if (session.failFast() && !aborted) {
                abortRemaining();
            }
        }

        private void unblockDependents(TaskNode node) {
            for (int dependent : node.dependents()) {
                if (!session.contains(dependent) || session.status(dependent) != TaskStatus.PENDING) {
                    continue;
                }
                boolean satisfied = session.graph().node(dependent).dependencies().stream()
                        .allMatch(dep -> session.status(dep) == TaskStatus.SUCCEEDED);
                if (satisfied) {
                    session.markReady(dependent);
                    ready.add(dependent);
                }
            }
        }

        /**
         * Fails every transitive dependent of {@code failed} that has not reached a terminal status.
         * None of them can be ready or running, since each depends on an unsuccessful task.
         */
        private void cascade(TaskNode failed) {
            var queue = new ArrayDeque<Integer>(failed.dependents());
            while (!queue.isEmpty()) {
                int index = queue.poll();
                if (!session.contains(index) || session.status(index).isTerminal()) {
                    continue;
                }
                TaskNode dependent = session.graph().node(index);
                session.markFailed(index, FailureCause.DEPENDENCY);
                if (metrics != null) {
                    metrics.recordCascade(dependent.kind());
                }
                log.info("Task {} skipped: dependency {} did not succeed", dependent.name(), failed.name());
                publish(SessionEvent.TASK_CASCADED, dependent.name(), Map.of("dependency", failed.name()));
                queue.addAll(dependent.dependents());
            }
        }

        private void abortRemaining() {
            aborted = true;
            ready.clear();
            int count = 0;
            for (TaskNode node : session.order()) {
                TaskStatus status = session.status(node.index());
                if (status == TaskStatus.PENDING || status == TaskStatus.READY) {
                    session.markFailed(node.index(), FailureCause.ABORTED);
                    publish(SessionEvent.TASK_ABORTED, node.name(), Map.of("kind", node.kind().name()));
                    count++;
                }
            }
            if (count > 0) {
                log.warn("Session {} aborted: {} tasks will not run, {} still running",
                        session.sessionId(), count, running);
            }
        }

        private void publish(String type, String taskId, Map<String, Object> payload) {
            eventBus.publish(new SessionEvent(type, session.sessionId(), taskId, payload, Instant.now()));
        }
    }
}
