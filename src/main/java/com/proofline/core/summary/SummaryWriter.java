package com.proofline.core.summary;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Persists session summaries as pretty-printed JSON and reads them back.
 */
@Service
public class SummaryWriter {

    private static final Logger log = LoggerFactory.getLogger(SummaryWriter.class);

    public static final String SUMMARY_FILE = "summary.json";

    private final ObjectMapper objectMapper;

    public SummaryWriter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Writes {@code summary} to {@code <sessionDir>/summary.json}, creating the directory if needed.
     *
     * @return the written file
     */
    public Path write(SessionSummary summary, Path sessionDir) {
        Path file = sessionDir.resolve(SUMMARY_FILE);
        try {
            Files.createDirectories(sessionDir);
            objectMapper.writeValue(file.toFile(), summary);
            log.info("Wrote summary for session {} to {}", summary.sessionId(), file);
            return file;
        } catch (IOException e) {
            log.error("Failed to write summary for session {}: {}", summary.sessionId(), e.getMessage());
            throw new UncheckedIOException("Cannot write " + file, e);
        }
    }

    /**
     * Reads a summary from a {@code summary.json} file or from a session directory containing one.
     */
    public SessionSummary read(Path location) {
        Path file = Files.isDirectory(location) ? location.resolve(SUMMARY_FILE) : location;
        try {
            return objectMapper.readValue(file.toFile(), SessionSummary.class);
        } catch (IOException e) {
            log.warn("Failed to read summary {}: {}", file, e.getMessage());
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }
}
