package com.example.rebus.application.service;

import com.example.rebus.application.exception.EvaluationRequestValidationException;
import com.example.rebus.domain.exception.InvalidRunTimestampException;
import com.example.rebus.domain.exception.RunTimestampRequiredException;
import com.example.rebus.domain.model.EvaluationResult;
import com.example.rebus.domain.model.ExtractionImpact;
import com.example.rebus.domain.model.MetricsReport;
import com.example.rebus.domain.model.ResponseProfile;
import com.example.rebus.domain.model.Sample;
import com.example.rebus.infrastructure.results.MetricsFileWriter;
import com.example.rebus.infrastructure.results.ResultRecord;
import com.example.rebus.infrastructure.results.ResultsFileReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for the run evaluation use cases with mocked file access.
 */
class RunEvaluationServiceTest {

    private ResultsFileReader reader;
    private MetricsFileWriter writer;
    private MetricsEvaluator evaluator;
    private RunEvaluationService service;

    @BeforeEach
    void setUp() {
        reader = mock(ResultsFileReader.class);
        writer = mock(MetricsFileWriter.class);
        evaluator = mock(MetricsEvaluator.class);
        service = new RunEvaluationService(reader, writer, evaluator);
    }

    @Test
    void evaluateRunRequiresTimestamp() {
        assertThrows(RunTimestampRequiredException.class, () -> service.evaluateRun(null));
        assertThrows(RunTimestampRequiredException.class, () -> service.evaluateRun("  "));
    }

    /**
     * Ensures path separators cannot be smuggled into the run folder name.
     */
    @Test
    void evaluateRunRejectsPathTraversal() {
        assertThrows(InvalidRunTimestampException.class, () -> service.evaluateRun("../secrets"));
        verify(reader, never()).readRun(any());
    }

    /**
     * Ensures the report is written into the run directory.
     */
    @Test
    void evaluateRunWritesMetricsNextToResults() {
        List<Sample> samples = List.of(new Sample("001", "kick the bucket", "{{{kick the bucket}}}"));
        EvaluationResult result = sampleResult();
        Path runDirectory = Path.of("logs", "20250520_142530");
        given(reader.readRun("20250520_142530")).willReturn(samples);
        given(reader.resolveRunDirectory("20250520_142530")).willReturn(runDirectory);
        given(evaluator.evaluate(samples)).willReturn(result);

        EvaluationResult returned = service.evaluateRun(" 20250520_142530 ");

        assertThat(returned).isSameAs(result);
        verify(writer).write(runDirectory, result.report());
    }

    @Test
    void evaluateRecordsRequiresBody() {
        assertThrows(EvaluationRequestValidationException.class, () -> service.evaluateRecords(null));
    }

    /**
     * Ensures null entries reach the evaluator as incomplete samples so they are counted as skipped.
     */
    @SuppressWarnings("unchecked")
    @Test
    void evaluateRecordsConvertsRecordsToSamples() {
        given(evaluator.evaluate(any())).willReturn(sampleResult());

        service.evaluateRecords(Arrays.asList(new ResultRecord("001", "kick the bucket", "kick the bucket"), null));

        ArgumentCaptor<List<Sample>> captor = ArgumentCaptor.forClass(List.class);
        verify(evaluator).evaluate(captor.capture());
        assertThat(captor.getValue()).containsExactly(
                new Sample("001", "kick the bucket", "kick the bucket"),
                new Sample(null, null, null));
        verify(writer, never()).write(any(), any());
    }

    private EvaluationResult sampleResult() {
        MetricsReport report = new MetricsReport(1, 1, 0, 1, 1.0, 1, 1.0, 1.0, 0, 0.0,
                ExtractionImpact.of(1, 0), Map.of());
        return new EvaluationResult(report, ResponseProfile.empty(), List.of(), List.of());
    }
}
