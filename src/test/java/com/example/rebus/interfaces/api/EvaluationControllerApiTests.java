package com.example.rebus.interfaces.api;

import com.example.rebus.application.exception.EvaluationRequestValidationException;
import com.example.rebus.application.service.RunEvaluationService;
import com.example.rebus.domain.exception.InvalidRunTimestampException;
import com.example.rebus.domain.exception.ResultsNotFoundException;
import com.example.rebus.domain.extraction.IdiomExtractor;
import com.example.rebus.domain.model.EvaluationResult;
import com.example.rebus.domain.model.ExtractionImpact;
import com.example.rebus.domain.model.ExtractionOutcome;
import com.example.rebus.domain.model.ExtractionStage;
import com.example.rebus.domain.model.MetricsReport;
import com.example.rebus.domain.model.ResponseProfile;
import com.example.rebus.infrastructure.exception.ResultsReadException;
import com.example.rebus.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyList;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests that validate the controller-to-exception-handler integration.
 */
@WebMvcTest(controllers = EvaluationController.class)
@Import(GlobalExceptionHandler.class)
class EvaluationControllerApiTests {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RunEvaluationService runEvaluationService;

    @MockBean
    private IdiomExtractor idiomExtractor;

    /**
     * Verifies the extraction outcome is serialized in snake_case.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void extractReturnsOutcome() throws Exception {
        BDDMockito.given(idiomExtractor.extract("The idiom is {{{break the ice}}}"))
                .willReturn(new ExtractionOutcome("break the ice", ExtractionStage.BRACKET_MARKER));

        mockMvc.perform(post("/api/extract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"The idiom is {{{break the ice}}}\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.extracted_text").value("break the ice"))
                .andExpect(jsonPath("$.stage_used").value("BRACKET_MARKER"));
    }

    /**
     * Verifies posted records are evaluated and the report is returned.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void evaluateReturnsReport() throws Exception {
        BDDMockito.given(runEvaluationService.evaluateRecords(anyList())).willReturn(sampleResult());

        mockMvc.perform(post("/api/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"image_id\": \"001\", \"ground_truth\": \"piece of cake\", \"prediction\": \"{{{piece of cake}}}\"}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.report.exact_match_rate").value(1.0))
                .andExpect(jsonPath("$.report.extraction_impact.helped").value(1))
                .andExpect(jsonPath("$.report.stage_usage.BRACKET_MARKER").value(1))
                .andExpect(jsonPath("$.response_profile.samples").value(0));
    }

    /**
     * Verifies a missing body translates to HTTP 400.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void evaluateWithoutBodyMappedToBadRequest() throws Exception {
        BDDMockito.given(runEvaluationService.evaluateRecords(null))
                .willThrow(new EvaluationRequestValidationException("Request body must be a JSON array of result records."));

        mockMvc.perform(post("/api/evaluate").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("USE_CASE_VALIDATION_ERROR"));
    }

    /**
     * @throws Exception when the mock request fails
     */
    @Test
    void malformedJsonMappedToBadRequest() throws Exception {
        mockMvc.perform(post("/api/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }

    /**
     * Verifies a missing run translates to HTTP 404.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void missingRunMappedToNotFound() throws Exception {
        BDDMockito.given(runEvaluationService.evaluateRun("20250101_000000"))
                .willThrow(new ResultsNotFoundException("logs/20250101_000000/results.json"));

        mockMvc.perform(post("/api/runs/20250101_000000/evaluate"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.error").value("RESULTS_NOT_FOUND"))
                .andExpect(jsonPath("$.timestamp").exists())
                .andExpect(jsonPath("$.path").value("/api/runs/20250101_000000/evaluate"));
    }

    /**
     * Verifies domain errors translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void invalidTimestampMappedToBadRequest() throws Exception {
        BDDMockito.given(runEvaluationService.evaluateRun("bad.name"))
                .willThrow(new InvalidRunTimestampException("bad.name"));

        mockMvc.perform(post("/api/runs/bad.name/evaluate"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DOMAIN_ERROR"));
    }

    /**
     * Verifies infrastructure errors translate to HTTP 500 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void unreadableResultsMappedToServerError() throws Exception {
        BDDMockito.given(runEvaluationService.evaluateRun("20250520_142530"))
                .willThrow(new ResultsReadException("Failed to read results", new IOException("boom")));

        mockMvc.perform(post("/api/runs/20250520_142530/evaluate"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value(500))
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"))
                .andExpect(jsonPath("$.message").value("Failed to read results"));
    }

    private EvaluationResult sampleResult() {
        MetricsReport report = new MetricsReport(1, 1, 0, 1, 1.0, 1, 1.0, 1.0, 0, 0.0,
                ExtractionImpact.of(1, 0), Map.of(ExtractionStage.BRACKET_MARKER, 1));
        return new EvaluationResult(report, ResponseProfile.empty(), List.of(), List.of());
    }
}
