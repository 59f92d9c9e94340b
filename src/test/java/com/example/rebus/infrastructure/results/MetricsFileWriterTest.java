package com.example.rebus.infrastructure.results;

import com.example.rebus.domain.model.ExtractionImpact;
import com.example.rebus.domain.model.ExtractionStage;
import com.example.rebus.domain.model.MetricsReport;
import com.example.rebus.infrastructure.config.RebusEvaluationProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for persisting metrics next to a run's results.
 */
class MetricsFileWriterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    /**
     * Ensures the run directory is created and the report is written in snake_case.
     *
     * @throws IOException when the written file cannot be parsed back
     */
    @Test
    void writeCreatesDirectoryAndSnakeCaseJson() throws IOException {
        MetricsFileWriter writer = new MetricsFileWriter(objectMapper, new RebusEvaluationProperties());
        MetricsReport report = new MetricsReport(3, 2, 1, 1, 0.5, 1, 0.5, 0.6667, 0, 0.0,
                ExtractionImpact.of(1, 0), Map.of(ExtractionStage.BRACKET_MARKER, 2));

        Path written = writer.write(tempDir.resolve("20250520_142530"), report);

        assertThat(written).exists().hasFileName("metrics.json");
        JsonNode json = objectMapper.readTree(Files.readString(written));
        assertThat(json.get("total_samples").asInt()).isEqualTo(3);
        assertThat(json.get("exact_match_rate").asDouble()).isEqualTo(0.5);
        assertThat(json.get("macro_f1").asDouble()).isEqualTo(0.6667);
        assertThat(json.get("extraction_impact").get("net").asInt()).isEqualTo(1);
        assertThat(json.get("stage_usage").get("BRACKET_MARKER").asInt()).isEqualTo(2);
    }
}
