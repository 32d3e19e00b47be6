package com.proofline.core.scheduler;

import com.proofline.core.error.AggregationInconsistencyException;
import com.proofline.core.graph.TaskGraph;
import com.proofline.core.graph.TaskNode;
import com.proofline.core.model.FailureCause;
import com.proofline.core.model.Outcome;
import com.proofline.core.model.TaskRun;
import com.proofline.core.model.TaskStatus;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * Live status table of one verification session.
 *
 * <p>State is held in arrays indexed by {@link TaskNode#index()}. Only the scheduler's control
 * loop mutates a session; everyone else reads it through {@link #snapshot()} once the run is over.
 */
public class ExecutionSession {

    private final String sessionId;
    private final TaskGraph graph;
    private final List<String> requestedTasks;
    private final List<TaskNode> order;
    private final int concurrency;
    private final int timeoutSeconds;
    private final boolean failFast;
    private final Path sessionDir;

    private final BitSet members;
    private final BitSet requested;
    private final TaskStatus[] status;
    private final FailureCause[] cause;
    private final Outcome[] outcome;
    private final Instant[] startedAt;
    private int terminalCount;

    private Instant sessionStartedAt;
    private Instant sessionFinishedAt;

    public ExecutionSession(String sessionId, TaskGraph graph, List<String> requestedTasks, List<TaskNode> order,
                            int concurrency, int timeoutSeconds, boolean failFast, Path sessionDir) {
        this.sessionId = sessionId;
        this.graph = graph;
        this.requestedTasks = List.copyOf(requestedTasks);
        this.order = List.copyOf(order);
        this.concurrency = concurrency;
        this.timeoutSeconds = timeoutSeconds;
        this.failFast = failFast;
        this.sessionDir = sessionDir;

        int size = graph.size();
        this.members = new BitSet(size);
        this.requested = new BitSet(size);
        this.status = new TaskStatus[size];
        this.cause = new FailureCause[size];
        this.outcome = new Outcome[size];
        this.startedAt = new Instant[size];
        Arrays.fill(status, TaskStatus.PENDING);

        boolean all = this.requestedTasks.contains(TaskGraph.ALL);
        for (TaskNode node : this.order) {
            members.set(node.index());
            if (all || this.requestedTasks.contains(node.name())) {
                requested.set(node.index());
            }
        }
    }

    public String sessionId() { return sessionId; }
    public TaskGraph graph() { return graph; }
    public List<String> requestedTasks() { return requestedTasks; }
    public List<TaskNode> order() { return order; }
    public int concurrency() { return concurrency; }
    public int timeoutSeconds() { return timeoutSeconds; }
    public boolean failFast() { return failFast; }
    public Path sessionDir() { return sessionDir; }
    public Instant startedAt() { return sessionStartedAt; }
    public Instant finishedAt() { return sessionFinishedAt; }

    public boolean contains(int index) {
        return members.get(index);
    }

    public TaskStatus status(int index) {
        return status[index];
    }

    public TaskStatus status(String name) {
        return status[graph.node(name).index()];
    }

    public FailureCause failureCause(int index) {
        return cause[index];
    }

    public boolean isRequested(int index) {
        return requested.get(index);
    }

    /** Number of tasks in the session that have not reached a terminal status. */
    public int remaining() {
        return order.size() - terminalCount;
    }

    public boolean isComplete() {
        return remaining() == 0;
    }

    public Path logPath(TaskNode node) {
        return sessionDir.resolve(node.name() + ".log");
    }

    void markStarted(Instant at) {
        this.sessionStartedAt = at;
    }

    void markFinished(Instant at) {
        this.sessionFinishedAt = at;
    }

    void markReady(int index) {
        expect(index, TaskStatus.PENDING, TaskStatus.READY);
        status[index] = TaskStatus.READY;
    }

    void markRunning(int index, Instant at) {
        expect(index, TaskStatus.READY, TaskStatus.RUNNING);
        status[index] = TaskStatus.RUNNING;
        startedAt[index] = at;
    }

    void recordOutcome(int index, Outcome result) {
        expect(index, TaskStatus.RUNNING, result.status());
        status[index] = result.status();
        if (result.status() == TaskStatus.FAILED) {
            cause[index] = FailureCause.EXECUTION;
        }
        outcome[index] = result;
        terminalCount++;
    }

    /**
     * Fails a task that never ran, through a failed dependency or an aborted session.
     */
    void markFailed(int index, FailureCause failureCause) {
        TaskStatus current = status[index];
        if (!members.get(index) || current.isTerminal() || current == TaskStatus.RUNNING) {
            throw new AggregationInconsistencyException("Task " + graph.node(index).name()
                    + " cannot be failed with cause " + failureCause + " from status " + current);
        }
        status[index] = TaskStatus.FAILED;
        cause[index] = failureCause;
        terminalCount++;
    }

    private void expect(int index, TaskStatus expected, TaskStatus next) {
        if (!members.get(index)) {
            throw new AggregationInconsistencyException("Task " + graph.node(index).name()
                    + " is not part of session " + sessionId);
        }
        if (status[index] != expected) {
            throw new AggregationInconsistencyException("Task " + graph.node(index).name()
                    + " cannot move from " + status[index] + " to " + next);
        }
    }

    /**
     * Immutable per-task view in execution order.
     */
    public List<TaskRun> snapshot() {
        var runs = new ArrayList<TaskRun>(order.size());
        for (TaskNode node : order) {
            int i = node.index();
            Outcome result = outcome[i];
            runs.add(new TaskRun(
                    node.name(),
                    node.kind(),
                    status[i],
                    cause[i],
                    result != null ? result.exitCode() : null,
                    result != null ? result.startedAt() : startedAt[i],
                    result != null ? result.finishedAt() : null,
                    result != null ? result.logPath() : null,
                    graph.dependencyNames(node),
                    requested.get(i)));
        }
        return runs;
    }
}
