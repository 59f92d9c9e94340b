package com.example.rebus.infrastructure.results;

import com.example.rebus.domain.exception.ResultsNotFoundException;
import com.example.rebus.domain.model.Sample;
import com.example.rebus.infrastructure.config.RebusEvaluationProperties;
import com.example.rebus.infrastructure.exception.ResultsReadException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for loading run results from disk.
 */
class ResultsFileReaderTest {

    @TempDir
    Path logsDir;

    private ResultsFileReader reader;

    @BeforeEach
    void setUp() {
        RebusEvaluationProperties properties = new RebusEvaluationProperties();
        properties.getResults().setLogsDir(logsDir.toString());
        reader = new ResultsFileReader(new ObjectMapper(), properties);
    }

    /**
     * Ensures both identifier spellings are read, unknown fields are ignored and null entries survive.
     *
     * @throws IOException when the fixture cannot be written
     */
    @Test
    void readRunMapsRecordsToSamples() throws IOException {
        try (InputStream fixture = getClass().getResourceAsStream("/fixtures/results.json")) {
            writeResults("20250520_142530", new String(fixture.readAllBytes(), StandardCharsets.UTF_8));
        }

        List<Sample> samples = reader.readRun("20250520_142530");

        assertThat(samples).containsExactly(
                new Sample("001", "piece of cake", "{{{piece of cake}}}"),
                new Sample(null, null, null),
                new Sample("003", "kick the bucket", null));
    }

    @Test
    void readRunFailsWhenResultsAreMissing() {
        assertThrows(ResultsNotFoundException.class, () -> reader.readRun("missing"));
    }

    /**
     * @throws IOException when the fixture cannot be written
     */
    @Test
    void readRunWrapsMalformedJson() throws IOException {
        writeResults("broken", "{not json");

        ResultsReadException ex = assertThrows(ResultsReadException.class, () -> reader.readRun("broken"));
        assertThat(ex.getCause()).isInstanceOf(IOException.class);
    }

    @Test
    void resolveRunDirectoryUsesLogsDir() {
        assertThat(reader.resolveRunDirectory("run1")).isEqualTo(logsDir.resolve("run1"));
    }

    private void writeResults(String timestamp, String json) throws IOException {
        Path runDir = Files.createDirectories(logsDir.resolve(timestamp));
        Files.writeString(runDir.resolve("results.json"), json, StandardCharsets.UTF_8);
    }
}
