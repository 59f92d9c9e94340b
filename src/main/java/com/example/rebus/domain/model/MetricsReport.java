package com.example.rebus.domain.model;

import java.util.Map;

/**
 * Aggregate metrics of one evaluation run, serialized as {@code metrics.json}.
 * Rates are computed over evaluated samples and rounded to four decimals.
 */
public record MetricsReport(
        int totalSamples,
        int evaluatedSamples,
        int skippedSamples,
        int exactMatchCount,
        double exactMatchRate,
        int partialMatchCount,
        double partialMatchRate,
        double macroF1,
        int rawMatchCount,
        double rawMatchRate,
        ExtractionImpact extractionImpact,
        Map<ExtractionStage, Integer> stageUsage
) {
}
