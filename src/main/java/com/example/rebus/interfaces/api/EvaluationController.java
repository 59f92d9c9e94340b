package com.example.rebus.interfaces.api;

import com.example.rebus.application.service.RunEvaluationService;
import com.example.rebus.domain.extraction.IdiomExtractor;
import com.example.rebus.domain.model.EvaluationResult;
import com.example.rebus.domain.model.ExtractionOutcome;
import com.example.rebus.infrastructure.results.ResultRecord;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Interfaces-layer REST controller exposing extraction and evaluation.
 * Failures propagate to {@link com.example.rebus.interfaces.api.error.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api")
public class EvaluationController {

    private final RunEvaluationService runEvaluationService;
    private final IdiomExtractor idiomExtractor;

    /**
     * @param runEvaluationService evaluation use cases
     * @param idiomExtractor       extraction cascade used by the single-response endpoint
     */
    public EvaluationController(RunEvaluationService runEvaluationService, IdiomExtractor idiomExtractor) {
        this.runEvaluationService = runEvaluationService;
        this.idiomExtractor = idiomExtractor;
    }

    /**
     * Extracts the answer phrase of one response.
     *
     * @param request body holding the raw text
     * @return extracted phrase and the stage that produced it
     */
    @PostMapping("/extract")
    public ExtractionOutcome extract(@RequestBody ExtractionRequest request) {
        return idiomExtractor.extract(request.text());
    }

    /**
     * Evaluates the posted records without touching the file system.
     *
     * @param records JSON array of {@code {id|image_id, ground_truth, prediction}}
     * @return metrics, response profile and review examples
     */
    @PostMapping("/evaluate")
    public EvaluationResult evaluate(@RequestBody(required = false) List<ResultRecord> records) {
        return runEvaluationService.evaluateRecords(records);
    }

    /**
     * Evaluates a stored run and writes its {@code metrics.json}.
     *
     * @param timestamp run folder name under the logs directory
     * @return metrics, response profile and review examples
     */
    @PostMapping("/runs/{timestamp}/evaluate")
    public EvaluationResult evaluateRun(@PathVariable("timestamp") String timestamp) {
        return runEvaluationService.evaluateRun(timestamp);
    }
}
