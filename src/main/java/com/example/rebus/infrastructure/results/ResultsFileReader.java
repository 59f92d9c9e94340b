package com.example.rebus.infrastructure.results;

import com.example.rebus.domain.exception.ResultsNotFoundException;
import com.example.rebus.domain.model.Sample;
import com.example.rebus.infrastructure.config.RebusEvaluationProperties;
import com.example.rebus.infrastructure.exception.ResultsReadException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Infrastructure helper that loads experiment results from the run directory layout
 * {@code <logs-dir>/<timestamp>/results.json}.
 */
@Component
public class ResultsFileReader {

    private static final Logger log = LoggerFactory.getLogger(ResultsFileReader.class);
    private static final TypeReference<List<ResultRecord>> RECORD_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final RebusEvaluationProperties properties;

    public ResultsFileReader(ObjectMapper objectMapper, RebusEvaluationProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * @param timestamp already validated run folder name
     * @return directory holding the run's files
     */
    public Path resolveRunDirectory(String timestamp) {
        return Paths.get(properties.getResults().getLogsDir()).resolve(timestamp);
    }

    /**
     * Reads the results of the given run.
     *
     * @param timestamp run folder name
     * @return samples in file order; {@code null} entries become empty samples
     */
    public List<Sample> readRun(String timestamp) {
        return readSamples(resolveRunDirectory(timestamp).resolve(properties.getResults().getResultsFileName()));
    }

    /**
     * Reads a results file.
     *
     * @param resultsFile path to a JSON array of result records
     * @return samples in file order
     * @throws ResultsNotFoundException when the file does not exist
     * @throws ResultsReadException     when the file cannot be read or parsed
     */
    public List<Sample> readSamples(Path resultsFile) {
        if (!Files.isRegularFile(resultsFile)) {
            throw new ResultsNotFoundException(resultsFile.toAbsolutePath().toString());
        }
        try {
            List<ResultRecord> records = objectMapper.readValue(resultsFile.toFile(), RECORD_LIST);
            if (records == null) {
                return List.of();
            }
            log.info("Loaded {} result record(s) from {}", records.size(), resultsFile);
            return records.stream()
                    .map(record -> record == null ? new Sample(null, null, null) : record.toSample())
                    .toList();
        } catch (IOException ex) {
            throw new ResultsReadException("Failed to read results from " + resultsFile, ex);
        }
    }
}
