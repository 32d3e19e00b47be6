package com.proofline.core.metrics;

import com.proofline.core.model.OverallStatus;
import com.proofline.core.model.TaskKind;
import com.proofline.core.model.TaskStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for verification sessions.
 */
@Service
public class ProoflineMetrics {

    private final MeterRegistry registry;

    public ProoflineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(TaskKind kind, TaskStatus status, long ms) {
        Timer.builder("proofline.task.duration")
                .tag("kind", tagValue(kind.name()))
                .tag("status", tagValue(status.name()))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a task marked failed without running because a dependency did not succeed.
     */
    public void recordCascade(TaskKind kind) {
        Counter.builder("proofline.task.cascaded")
                .description("Tasks failed through a failed or timed-out dependency")
                .tag("kind", tagValue(kind.name()))
                .register(registry)
                .increment();
    }

    public void recordSessionResult(OverallStatus status, long ms) {
        Counter.builder("proofline.sessions.total")
                .tag("status", tagValue(status.name()))
                .register(registry)
                .increment();
        Timer.builder("proofline.session.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSessionSize(int taskCount, int concurrency) {
        DistributionSummary.builder("proofline.session.tasks")
                .description("Tasks scheduled per session, dependencies included")
                .register(registry)
                .record(taskCount);
        DistributionSummary.builder("proofline.session.concurrency")
                .register(registry)
                .record(concurrency);
    }

    private static String tagValue(String name) {
        return name.toLowerCase();
    }
}
