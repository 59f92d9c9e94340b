package com.example.rebus.domain.model;

import java.util.Objects;

/**
 * Result of running the extraction cascade over one raw response.
 *
 * @param extractedText best-guess answer phrase, never {@code null}
 * @param stageUsed     stage that produced the phrase, never {@code null}
 */
public record ExtractionOutcome(
        String extractedText,
        ExtractionStage stageUsed
) {

    public ExtractionOutcome {
        extractedText = extractedText == null ? "" : extractedText;
        Objects.requireNonNull(stageUsed, "stageUsed");
    }

	/**
	 * Outcome used for empty or blank responses.
	 *
	 * @return empty fallback outcome
	 */
    public static ExtractionOutcome empty() {
        return new ExtractionOutcome("", ExtractionStage.FALLBACK_RAW);
    }
}
