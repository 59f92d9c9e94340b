package com.example.rebus.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-sample scoring record kept for debugging and for the helped/hurt review lists.
 */
public record SampleEvaluation(
        String id,
        String groundTruth,
        String rawPrediction,
        String extractedText,
        ExtractionStage stageUsed,
        String normalizedGroundTruth,
        String normalizedRaw,
        String normalizedExtracted,
        boolean exactMatch,
        boolean partialMatch,
        boolean rawMatch,
        double f1
) {

    @JsonProperty
    public boolean extractionHelped() {
        return exactMatch && !rawMatch;
    }

    @JsonProperty
    public boolean extractionHurt() {
        return rawMatch && !exactMatch;
    }
}
