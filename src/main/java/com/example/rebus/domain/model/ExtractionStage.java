package com.example.rebus.domain.model;

/**
 * Stages of the answer-extraction cascade, in the order they are attempted.
 */
public enum ExtractionStage {
    BRACKET_MARKER,
    QUOTED,
    KEYWORD_INTRO,
    STANDALONE_LINE,
    FIRST_SENTENCE,
    NGRAM_SCAN,
    FALLBACK_RAW
}
