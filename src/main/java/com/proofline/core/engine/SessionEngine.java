package com.proofline.core.engine;

import com.proofline.config.ProoflineProperties;
import com.proofline.core.error.InvalidOptionException;
import com.proofline.core.graph.DependencyResolver;
import com.proofline.core.graph.TaskGraph;
import com.proofline.core.graph.TaskNode;
import com.proofline.core.logging.MdcContext;
import com.proofline.core.metrics.ProoflineMetrics;
import com.proofline.core.scheduler.ExecutionSession;
import com.proofline.core.scheduler.Scheduler;
import com.proofline.core.summary.ResultAggregator;
import com.proofline.core.summary.SessionSummary;
import com.proofline.core.summary.SummaryWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a verification session end to end: validate the task table and the options,
 * resolve the requested tasks, schedule them, aggregate and persist the summary.
 * <p>
 * Configuration problems surface as {@link com.proofline.core.error.ConfigurationException}
 * before anything runs. Task failures and timeouts never throw; they are part of the summary.
 */
@Service
public class SessionEngine {

    private static final Logger log = LoggerFactory.getLogger(SessionEngine.class);
    private static final AtomicInteger SESSION_COUNTER = new AtomicInteger(0);
    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final ProoflineProperties properties;
    private final DependencyResolver resolver;
    private final Scheduler scheduler;
    private final ResultAggregator aggregator;
    private final SummaryWriter summaryWriter;
    private final ProoflineMetrics metrics;

    public SessionEngine(ProoflineProperties properties, DependencyResolver resolver, Scheduler scheduler,
                         ResultAggregator aggregator, SummaryWriter summaryWriter,
                         @Autowired(required = false) ProoflineMetrics metrics) {
        this.properties = properties;
        this.resolver = resolver;
        this.scheduler = scheduler;
        this.aggregator = aggregator;
        this.summaryWriter = summaryWriter;
        this.metrics = metrics;
    }

    /**
     * Builds and validates the configured task graph.
     */
    public TaskGraph loadGraph() {
        return TaskGraph.build(properties.declarations());
    }

    /**
     * Resolves the execution order for the requested tasks without running anything.
     */
    public List<TaskNode> plan(List<String> tasks) {
        requireTasks(tasks);
        return resolver.resolve(loadGraph(), tasks);
    }

    public SessionResult run(SessionRequest request) {
        requireTasks(request.tasks());
        int concurrency = request.concurrency() != null ? request.concurrency() : properties.effectiveConcurrency();
        int timeout = request.timeoutSeconds() != null ? request.timeoutSeconds() : properties.getTimeoutSeconds();
        boolean failFast = request.failFast() != null ? request.failFast() : properties.isFailFast();
        Path resultsDir = request.resultsDir() != null ? request.resultsDir() : properties.resultsPath();
        if (concurrency < 1) {
            throw new InvalidOptionException("Concurrency must be at least 1, got " + concurrency);
        }
        if (timeout < 0) {
            throw new InvalidOptionException("Timeout must not be negative, got " + timeout);
        }

        TaskGraph graph = loadGraph();
        List<TaskNode> order = resolver.resolve(graph, request.tasks());

        String sessionId = generateSessionId();
        Path sessionDir = resultsDir.resolve(sessionId);
        MdcContext.setSession(sessionId);
        try {
            log.info("Starting session {} for {} ({} tasks after dependency resolution)",
                    sessionId, request.tasks(), order.size());
            if (metrics != null) {
                metrics.recordSessionSize(order.size(), concurrency);
            }

            var session = new ExecutionSession(sessionId, graph, request.tasks(), order,
                    concurrency, timeout, failFast, sessionDir);
            scheduler.run(session);

            SessionSummary summary = aggregator.summarize(session);
            log.info("Session {} finished with {}: {}", sessionId, summary.overallStatus(), summary.counts());
            if (metrics != null) {
                metrics.recordSessionResult(summary.overallStatus(), summary.totalDurationMs());
            }

            Path summaryFile = null;
            try {
                summaryFile = summaryWriter.write(summary, sessionDir);
            } catch (UncheckedIOException e) {
                log.warn("Session {} summary was not persisted: {}", sessionId, e.getMessage());
            }
            return new SessionResult(summary, summaryFile);
        } finally {
            MdcContext.clear();
        }
    }

    private static void requireTasks(List<String> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            throw new InvalidOptionException("At least one task (or '" + TaskGraph.ALL + "') must be requested");
        }
    }

    static String generateSessionId() {
        return String.format("PFL-%s-%04d", LocalDateTime.now().format(ID_FORMAT), SESSION_COUNTER.incrementAndGet());
    }
}
