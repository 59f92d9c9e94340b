package com.example.rebus.domain.extraction;

import com.example.rebus.domain.model.CandidateSet;
import com.example.rebus.domain.model.ExtractionStage;
import com.example.rebus.domain.model.WordCountBounds;
import com.example.rebus.domain.service.CandidateClassifier;
import com.example.rebus.domain.service.CandidateCleaner;
import com.example.rebus.domain.service.CandidateScorer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Last heuristic resort: every contiguous word span of the configured lengths is a candidate.
 * Spans are generated by start position, shortest first, and handed to the rubric.
 */
public class NgramScanStrategy extends AbstractExtractionStrategy {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final WordCountBounds spanLengths;

    public NgramScanStrategy(CandidateClassifier classifier,
                             CandidateCleaner cleaner,
                             CandidateScorer scorer,
                             WordCountBounds bounds,
                             WordCountBounds spanLengths) {
        super(ExtractionStage.NGRAM_SCAN, classifier, cleaner, scorer, bounds);
        this.spanLengths = Objects.requireNonNull(spanLengths, "spanLengths");
    }

    @Override
    public Optional<CandidateSet> tryExtract(String text) {
        List<String> words = Arrays.stream(WHITESPACE.split(text.strip()))
                .map(NgramScanStrategy::trimPunctuation)
                .filter(word -> !word.isEmpty())
                .toList();
        List<String> spans = new ArrayList<>();
        for (int start = 0; start < words.size(); start++) {
            for (int length = spanLengths.min(); length <= spanLengths.max(); length++) {
                if (start + length > words.size()) {
                    break;
                }
                spans.add(String.join(" ", words.subList(start, start + length)));
            }
        }
        return toCandidateSet(acceptPlausible(spans));
    }

    private static String trimPunctuation(String word) {
        int start = 0;
        int end = word.length();
        while (start < end && !isWordPart(word.charAt(start))) {
            start++;
        }
        while (end > start && !isWordPart(word.charAt(end - 1))) {
            end--;
        }
        return word.substring(start, end);
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || Character.getType(c) == Character.LETTER_NUMBER
                || Character.getType(c) == Character.OTHER_NUMBER || c == '\'';
    }
}
