package com.proofline.core.summary;

import com.proofline.core.model.FailureCause;
import com.proofline.core.model.OverallStatus;
import com.proofline.core.model.TaskKind;
import com.proofline.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SummaryWriterTest {

    @TempDir
    Path resultsDir;

    private SummaryWriter writer;

    @BeforeEach
    void setUp() {
        writer = new SummaryWriter();
    }

    private SessionSummary summary() {
        var counts = new LinkedHashMap<TaskStatus, Integer>();
        counts.put(TaskStatus.SUCCEEDED, 1);
        counts.put(TaskStatus.FAILED, 1);
        counts.put(TaskStatus.TIMED_OUT, 1);
        Instant start = Instant.parse("2026-10-19T08:00:00Z");
        return new SessionSummary("PFL-20261019-080000-0001", List.of("all"), OverallStatus.FAILURE, counts,
                List.of(
                        new TaskSummary("model-small", TaskKind.MODEL_CHECK, TaskStatus.TIMED_OUT, null, null,
                                3_600_000, List.of(), "results/model-small.log", true),
                        new TaskSummary("Types", TaskKind.PROOF, TaskStatus.SUCCEEDED, null, 0,
                                1200, List.of(), "results/Types.log", true),
                        new TaskSummary("Utils", TaskKind.PROOF, TaskStatus.FAILED, FailureCause.EXECUTION, 1,
                                800, List.of("Types"), "results/Utils.log", true)),
                4, 3600, false, start, start.plusSeconds(3601), 3_601_000);
    }

    @Test
    @DisplayName("writes summary.json into the session directory")
    void writesSummary() throws Exception {
        Path sessionDir = resultsDir.resolve("PFL-20261019-080000-0001");
        Path file = writer.write(summary(), sessionDir);

        assertEquals(sessionDir.resolve("summary.json"), file);
        String json = Files.readString(file);
        assertTrue(json.contains("\"overallStatus\" : \"FAILURE\""), json);
        assertTrue(json.contains("\"startedAt\" : \"2026-10-19T08:00:00Z\""), json);
        assertTrue(json.contains("\"failureCause\" : \"EXECUTION\""), json);
    }

    @Test
    @DisplayName("reads a summary back from the file or its directory")
    void readsSummaryBack() {
        Path sessionDir = resultsDir.resolve("session");
        writer.write(summary(), sessionDir);

        assertEquals(summary(), writer.read(sessionDir));
        assertEquals(summary(), writer.read(sessionDir.resolve(SummaryWriter.SUMMARY_FILE)));
    }

    @Test
    @DisplayName("missing summary surfaces as UncheckedIOException")
    void missingSummary() {
        assertThrows(UncheckedIOException.class, () -> writer.read(resultsDir.resolve("nope")));
    }
}
