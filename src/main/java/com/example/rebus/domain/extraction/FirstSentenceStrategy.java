package com.example.rebus.domain.extraction;

import com.example.rebus.domain.model.CandidateSet;
import com.example.rebus.domain.model.ExtractionStage;
import com.example.rebus.domain.model.WordCountBounds;
import com.example.rebus.domain.service.CandidateClassifier;
import com.example.rebus.domain.service.CandidateCleaner;
import com.example.rebus.domain.service.CandidateScorer;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Tests the first sentence of the response.
 */
public class FirstSentenceStrategy extends AbstractExtractionStrategy {

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");

    public FirstSentenceStrategy(CandidateClassifier classifier,
                                 CandidateCleaner cleaner,
                                 CandidateScorer scorer,
                                 WordCountBounds bounds) {
        super(ExtractionStage.FIRST_SENTENCE, classifier, cleaner, scorer, bounds);
    }

    @Override
    public Optional<CandidateSet> tryExtract(String text) {
        return Arrays.stream(SENTENCE_END.split(text))
                .filter(sentence -> !sentence.isBlank())
                .findFirst()
                .flatMap(sentence -> toCandidateSet(acceptPlausible(List.of(sentence))));
    }
}
