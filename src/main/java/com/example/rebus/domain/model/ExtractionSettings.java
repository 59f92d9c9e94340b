package com.example.rebus.domain.model;

/**
 * Numeric knobs of the extraction cascade.
 *
 * @param fallbackMaxLength maximum characters kept by the raw fallback stage
 * @param markerBounds      word-count window for bracket-marker answers
 * @param answerBounds      word-count window for heuristic answers
 * @param ngramSpan         span lengths generated by the n-gram scan
 */
public record ExtractionSettings(
        int fallbackMaxLength,
        WordCountBounds markerBounds,
        WordCountBounds answerBounds,
        WordCountBounds ngramSpan
) {

    public static final int DEFAULT_FALLBACK_MAX_LENGTH = 50;

    public ExtractionSettings {
        if (fallbackMaxLength <= 0) {
            throw new IllegalArgumentException("fallbackMaxLength must be positive");
        }
    }

    public static ExtractionSettings defaults() {
        return new ExtractionSettings(
                DEFAULT_FALLBACK_MAX_LENGTH,
                WordCountBounds.MARKER,
                WordCountBounds.ANSWER,
                WordCountBounds.NGRAM_SPAN
        );
    }
}
