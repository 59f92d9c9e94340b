package com.example.rebus.domain.model;

/**
 * Descriptive statistics over raw model responses, used to see which answer formats a model favours.
 */
public record ResponseProfile(
        int samples,
        int withBoldText,
        int withQuotes,
        int withBracketMarker,
        int withAnswerKeyword,
        int withIdiomKeyword,
        int withExplanation,
        double averageLength
) {

    public static ResponseProfile empty() {
        return new ResponseProfile(0, 0, 0, 0, 0, 0, 0, 0.0);
    }
}
