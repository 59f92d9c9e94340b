package com.example.rebus.domain.extraction;

import com.example.rebus.domain.model.CandidateSet;
import com.example.rebus.domain.model.ExtractionStage;
import com.example.rebus.domain.model.WordCountBounds;
import com.example.rebus.domain.service.CandidateClassifier;
import com.example.rebus.domain.service.CandidateCleaner;
import com.example.rebus.domain.service.CandidateScorer;

import java.util.List;
import java.util.Optional;

/**
 * Accepts the first line that reads like an answer on its own rather than commentary.
 */
public class StandaloneLineStrategy extends AbstractExtractionStrategy {

    public StandaloneLineStrategy(CandidateClassifier classifier,
                                  CandidateCleaner cleaner,
                                  CandidateScorer scorer,
                                  WordCountBounds bounds) {
        super(ExtractionStage.STANDALONE_LINE, classifier, cleaner, scorer, bounds);
    }

    @Override
    public Optional<CandidateSet> tryExtract(String text) {
        return text.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .filter(line -> !classifier.isDescription(line))
                .map(cleaner::clean)
                .filter(cleaned -> classifier.isPlausibleAnswer(cleaned, bounds))
                .findFirst()
                .flatMap(line -> toCandidateSet(List.of(line)));
    }
}
