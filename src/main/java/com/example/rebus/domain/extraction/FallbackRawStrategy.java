package com.example.rebus.domain.extraction;

import com.example.rebus.domain.model.ExtractionOutcome;
import com.example.rebus.domain.model.ExtractionStage;

import java.util.Locale;

/**
 * Terminal stage of the cascade: the raw response, trimmed, truncated and lower-cased.
 * It never fails, which guarantees the cascade always terminates with an outcome.
 */
public class FallbackRawStrategy {

    private final int maxLength;

    public FallbackRawStrategy(int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive");
        }
        this.maxLength = maxLength;
    }

    public ExtractionOutcome extract(String text) {
        if (text == null || text.isBlank()) {
            return ExtractionOutcome.empty();
        }
        String stripped = text.strip();
        String truncated = stripped.length() > maxLength ? stripped.substring(0, maxLength) : stripped;
        return new ExtractionOutcome(truncated.toLowerCase(Locale.ROOT).strip(), ExtractionStage.FALLBACK_RAW);
    }
}
