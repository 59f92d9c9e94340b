package com.example.rebus.infrastructure.results;

import com.example.rebus.domain.model.MetricsReport;
import com.example.rebus.infrastructure.config.RebusEvaluationProperties;
import com.example.rebus.infrastructure.exception.MetricsWriteException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Persists a {@link MetricsReport} as pretty-printed JSON inside a run directory.
 */
@Component
public class MetricsFileWriter {

    private static final Logger log = LoggerFactory.getLogger(MetricsFileWriter.class);

    private final ObjectMapper objectMapper;
    private final RebusEvaluationProperties properties;

    public MetricsFileWriter(ObjectMapper objectMapper, RebusEvaluationProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Writes {@code metrics.json}, creating the directory if needed.
     *
     * @param runDirectory target directory
     * @param report       metrics to persist
     * @return path of the written file
     * @throws MetricsWriteException when the file cannot be written
     */
    public Path write(Path runDirectory, MetricsReport report) {
        Path target = runDirectory.resolve(properties.getResults().getMetricsFileName());
        try {
            Files.createDirectories(runDirectory);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), report);
        } catch (IOException ex) {
            throw new MetricsWriteException("Failed to write metrics to " + target, ex);
        }
        log.info("Metrics saved to {}", target);
        return target;
    }
}
