package com.example.rebus.domain.model;

import java.util.List;

/**
 * Immutable word lists that drive candidate cleaning and classification.
 * Injected into the classifier, cleaner and keyword stage at construction time.
 *
 * @param descriptionMarkers phrases that flag meta-commentary rather than an answer
 * @param leadingFillers     phrases stripped from the start of a candidate, longest first
 * @param trailingFillers    words stripped from the end of a candidate
 * @param introKeywords      phrases after which the model usually states its answer
 */
public record ExtractionLexicon(
        List<String> descriptionMarkers,
        List<String> leadingFillers,
        List<String> trailingFillers,
        List<String> introKeywords
) {

    private static final List<String> DEFAULT_DESCRIPTION_MARKERS = List.of(
            "this idiom", "idiom", "represents", "refers to", "let me think", "i can see",
            "the image", "this image", "the picture", "rebus", "puzzle", "depicts", "shows",
            "is written", "are written", "is drawn", "looking at", "step by step",
            "the word", "the words", "the letter", "the letters", "meaning", "symbolizes",
            "illustrates", "suggests"
    );

    private static final List<String> DEFAULT_LEADING_FILLERS = List.of(
            "the idiom is", "the answer is", "the solution is", "the phrase is",
            "idiom is", "answer is", "solution is", "answer:", "idiom:",
            "i think", "i believe", "this is", "it is", "it's", "likely", "probably",
            "the", "an", "a"
    );

    private static final List<String> DEFAULT_TRAILING_FILLERS = List.of(
            "idiom", "puzzle", "phrase", "expression", "saying"
    );

    private static final List<String> DEFAULT_INTRO_KEYWORDS = List.of(
            "the idiom is", "idiom is", "answer is", "solution is",
            "represents", "suggests", "therefore", "thus", "so"
    );

    public ExtractionLexicon {
        descriptionMarkers = List.copyOf(descriptionMarkers);
        leadingFillers = List.copyOf(leadingFillers);
        trailingFillers = List.copyOf(trailingFillers);
        introKeywords = List.copyOf(introKeywords);
    }

	/**
	 * Lexicon tuned on typical chain-of-thought answers to rebus prompts.
	 *
	 * @return default lexicon
	 */
    public static ExtractionLexicon defaults() {
        return new ExtractionLexicon(
                DEFAULT_DESCRIPTION_MARKERS,
                DEFAULT_LEADING_FILLERS,
                DEFAULT_TRAILING_FILLERS,
                DEFAULT_INTRO_KEYWORDS
        );
    }

	/**
	 * Replaces each non-empty list of the defaults with the supplied override.
	 *
	 * @param descriptionMarkers override or empty/{@code null} to keep the default
	 * @param leadingFillers     override or empty/{@code null} to keep the default
	 * @param trailingFillers    override or empty/{@code null} to keep the default
	 * @param introKeywords      override or empty/{@code null} to keep the default
	 * @return merged lexicon
	 */
    public static ExtractionLexicon withOverrides(List<String> descriptionMarkers,
                                                  List<String> leadingFillers,
                                                  List<String> trailingFillers,
                                                  List<String> introKeywords) {
        return new ExtractionLexicon(
                orDefault(descriptionMarkers, DEFAULT_DESCRIPTION_MARKERS),
                orDefault(leadingFillers, DEFAULT_LEADING_FILLERS),
                orDefault(trailingFillers, DEFAULT_TRAILING_FILLERS),
                orDefault(introKeywords, DEFAULT_INTRO_KEYWORDS)
        );
    }

    private static List<String> orDefault(List<String> values, List<String> fallback) {
        return values == null || values.isEmpty() ? fallback : values;
    }
}
