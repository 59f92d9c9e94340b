package com.example.rebus.domain.extraction;

import com.example.rebus.domain.model.CandidateSet;
import com.example.rebus.domain.model.ExtractionStage;
import com.example.rebus.domain.model.WordCountBounds;
import com.example.rebus.domain.service.CandidateClassifier;
import com.example.rebus.domain.service.CandidateCleaner;
import com.example.rebus.domain.service.CandidateScorer;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads answers the prompt asked the model to wrap in {@code {{{...}}}}.
 * Marker contents skip the plausibility predicate; only the word-count window applies.
 */
public class BracketMarkerStrategy extends AbstractExtractionStrategy {

    private static final String OPEN = "{{{";
    private static final String CLOSE = "}}}";

    public BracketMarkerStrategy(CandidateClassifier classifier,
                                 CandidateCleaner cleaner,
                                 CandidateScorer scorer,
                                 WordCountBounds bounds) {
        super(ExtractionStage.BRACKET_MARKER, classifier, cleaner, scorer, bounds);
    }

    @Override
    public Optional<CandidateSet> tryExtract(String text) {
        Set<String> accepted = new LinkedHashSet<>();
        int from = 0;
        while (true) {
            int open = text.indexOf(OPEN, from);
            if (open < 0) {
                break;
            }
            int close = text.indexOf(CLOSE, open + OPEN.length());
            if (close < 0) {
                break;
            }
            String content = cleaner.trimMarker(text.substring(open + OPEN.length(), close));
            if (bounds.contains(CandidateClassifier.countWords(content))) {
                accepted.add(content);
            }
            from = close + CLOSE.length();
        }
        return toCandidateSet(List.copyOf(accepted));
    }
}
