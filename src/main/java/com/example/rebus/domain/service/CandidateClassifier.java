package com.example.rebus.domain.service;

import com.example.rebus.domain.model.ExtractionLexicon;
import com.example.rebus.domain.model.WordCountBounds;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Stateless predicates deciding whether a string plausibly is an idiom answer
 * or descriptive prose about the puzzle image.
 */
public class CandidateClassifier {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HAS_LETTER = Pattern.compile("\\p{L}");
    private static final int MIN_LENGTH = 3;
    private static final int MAX_LENGTH = 100;
    private static final int MIN_SINGLE_WORD_LENGTH = 8;

    private final Pattern descriptionMarkers;

    /**
     * Creates a classifier backed by the given lexicon's description markers.
     *
     * @param lexicon immutable word lists
     */
    public CandidateClassifier(ExtractionLexicon lexicon) {
        Objects.requireNonNull(lexicon, "lexicon");
        this.descriptionMarkers = phrasePattern(lexicon.descriptionMarkers());
    }

    /**
     * Detects meta-commentary, empty text and bare all-caps labels.
     *
     * @param text candidate text
     * @return {@code true} when the text should not be treated as an answer
     */
    public boolean isDescription(String text) {
        if (text == null || text.isBlank()) {
            return true;
        }
        String stripped = text.strip();
        if (descriptionMarkers.matcher(stripped).find()) {
            return true;
        }
        return countWords(stripped) == 1
                && HAS_LETTER.matcher(stripped).find()
                && stripped.equals(stripped.toUpperCase(Locale.ROOT));
    }

    /**
     * Applies the default answer bounds of one to ten words.
     *
     * @param text candidate text
     * @return {@code true} when the text looks like a complete idiom
     */
    public boolean isPlausibleAnswer(String text) {
        return isPlausibleAnswer(text, WordCountBounds.ANSWER);
    }

    /**
     * Checks length, word count, description status and the single-word rule.
     *
     * @param text   candidate text
     * @param bounds word-count window accepted by the calling stage
     * @return {@code true} when the text looks like a complete idiom
     */
    public boolean isPlausibleAnswer(String text, WordCountBounds bounds) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String stripped = text.strip();
        if (stripped.length() < MIN_LENGTH || stripped.length() > MAX_LENGTH) {
            return false;
        }
        int words = countWords(stripped);
        if (!bounds.contains(words)) {
            return false;
        }
        if (isDescription(stripped)) {
            return false;
        }
        return words != 1 || stripped.length() >= MIN_SINGLE_WORD_LENGTH;
    }

    /**
     * Counts whitespace-separated words.
     *
     * @param text any text
     * @return number of words, zero for {@code null} or blank text
     */
    public static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return WHITESPACE.split(text.strip()).length;
    }

    /**
     * Joins phrases into a regex alternation, longest first, with flexible inner whitespace.
     *
     * @param phrases literal phrases
     * @return alternation without grouping, or an empty string when no phrase is usable
     */
    public static String phraseAlternation(Iterable<String> phrases) {
        List<String> sorted = new ArrayList<>();
        phrases.forEach(phrase -> {
            if (phrase != null && !phrase.isBlank()) {
                sorted.add(phrase.strip());
            }
        });
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        return sorted.stream()
                .map(phrase -> WHITESPACE.splitAsStream(phrase).map(Pattern::quote).collect(Collectors.joining("\\s+")))
                .collect(Collectors.joining("|"));
    }

    private static Pattern phrasePattern(Iterable<String> phrases) {
        String alternation = phraseAlternation(phrases);
        if (alternation.isEmpty()) {
            return Pattern.compile("(?!)");
        }
        return Pattern.compile("(?<![\\p{L}\\p{N}])(?:" + alternation + ")(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
