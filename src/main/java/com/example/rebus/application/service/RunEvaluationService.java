package com.example.rebus.application.service;

import com.example.rebus.application.exception.EvaluationRequestValidationException;
import com.example.rebus.domain.exception.InvalidRunTimestampException;
import com.example.rebus.domain.exception.RunTimestampRequiredException;
import com.example.rebus.domain.model.EvaluationResult;
import com.example.rebus.domain.model.Sample;
import com.example.rebus.infrastructure.results.MetricsFileWriter;
import com.example.rebus.infrastructure.results.ResultRecord;
import com.example.rebus.infrastructure.results.ResultsFileReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Application-layer use cases around experiment runs: evaluate a stored run and persist
 * its metrics, or evaluate records posted directly by a client.
 */
@Service
public class RunEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(RunEvaluationService.class);
    private static final Pattern RUN_TIMESTAMP = Pattern.compile("[A-Za-z0-9_\\-]+");

    private final ResultsFileReader resultsFileReader;
    private final MetricsFileWriter metricsFileWriter;
    private final MetricsEvaluator metricsEvaluator;

    public RunEvaluationService(ResultsFileReader resultsFileReader,
                                MetricsFileWriter metricsFileWriter,
                                MetricsEvaluator metricsEvaluator) {
        this.resultsFileReader = resultsFileReader;
        this.metricsFileWriter = metricsFileWriter;
        this.metricsEvaluator = metricsEvaluator;
    }

    /**
     * Evaluates {@code <logs-dir>/<timestamp>/results.json} and writes {@code metrics.json} beside it.
     *
     * @param timestamp run folder name such as {@code 20250520_142530}
     * @return evaluation result whose report was persisted
     */
    public EvaluationResult evaluateRun(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            throw new RunTimestampRequiredException();
        }
        String runId = timestamp.strip();
        if (!RUN_TIMESTAMP.matcher(runId).matches()) {
            throw new InvalidRunTimestampException(runId);
        }
        log.info("Evaluating run {}", runId);
        List<Sample> samples = resultsFileReader.readRun(runId);
        EvaluationResult result = metricsEvaluator.evaluate(samples);
        Path runDirectory = resultsFileReader.resolveRunDirectory(runId);
        metricsFileWriter.write(runDirectory, result.report());
        return result;
    }

    /**
     * Evaluates records supplied in a request body. Nothing is persisted.
     *
     * @param records result records; {@code null} entries are counted as skipped
     * @return evaluation result
     */
    public EvaluationResult evaluateRecords(List<ResultRecord> records) {
        if (records == null) {
            throw new EvaluationRequestValidationException("Request body must be a JSON array of result records.");
        }
        List<Sample> samples = records.stream()
                .map(record -> record == null ? new Sample(null, null, null) : record.toSample())
                .toList();
        return metricsEvaluator.evaluate(samples);
    }
}
