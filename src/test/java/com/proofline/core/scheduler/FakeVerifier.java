package com.proofline.core.scheduler;

import com.proofline.verifier.VerificationRequest;
import com.proofline.verifier.Verifier;
import com.proofline.verifier.VerifierResult;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic in-memory verifier: each task sleeps for its configured time and returns its
 * configured exit code. Records launches and the peak number of concurrent invocations.
 */
class FakeVerifier implements Verifier {

    private final Map<String, Integer> exitCodes = new ConcurrentHashMap<>();
    private final Map<String, Long> sleepMs = new ConcurrentHashMap<>();
    private final long defaultSleepMs;

    final List<String> started = new CopyOnWriteArrayList<>();
    final Map<String, Long> startNanos = new ConcurrentHashMap<>();
    final Map<String, Long> endNanos = new ConcurrentHashMap<>();
    final AtomicInteger running = new AtomicInteger();
    final AtomicInteger maxRunning = new AtomicInteger();

    FakeVerifier(long defaultSleepMs) {
        this.defaultSleepMs = defaultSleepMs;
    }

    FakeVerifier exit(String task, int code) {
        exitCodes.put(task, code);
        return this;
    }

    FakeVerifier sleep(String task, long ms) {
        sleepMs.put(task, ms);
        return this;
    }

    @Override
    public VerifierResult execute(VerificationRequest request) {
        String task = request.taskId();
        started.add(task);
        startNanos.put(task, System.nanoTime());
        maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
        try {
            Thread.sleep(sleepMs.getOrDefault(task, defaultSleepMs));
            return VerifierResult.completed(exitCodes.getOrDefault(task, 0), Duration.ZERO, request.logPath());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return VerifierResult.timedOut(Duration.ZERO, request.logPath());
        } finally {
            running.decrementAndGet();
            endNanos.put(task, System.nanoTime());
        }
    }
}
