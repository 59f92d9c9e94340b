package com.example.rebus.domain.extraction;

import com.example.rebus.domain.model.CandidateSet;
import com.example.rebus.domain.model.ExtractionStage;
import com.example.rebus.domain.model.WordCountBounds;
import com.example.rebus.domain.service.CandidateClassifier;
import com.example.rebus.domain.service.CandidateCleaner;
import com.example.rebus.domain.service.CandidateScorer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Shared plumbing for heuristic stages: clean every raw match, keep the plausible ones
 * once each, and score what is left.
 */
abstract class AbstractExtractionStrategy implements ExtractionStrategy {

    private final ExtractionStage stage;
    protected final CandidateClassifier classifier;
    protected final CandidateCleaner cleaner;
    protected final CandidateScorer scorer;
    protected final WordCountBounds bounds;

    protected AbstractExtractionStrategy(ExtractionStage stage,
                                         CandidateClassifier classifier,
                                         CandidateCleaner cleaner,
                                         CandidateScorer scorer,
                                         WordCountBounds bounds) {
        this.stage = Objects.requireNonNull(stage, "stage");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.cleaner = Objects.requireNonNull(cleaner, "cleaner");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.bounds = Objects.requireNonNull(bounds, "bounds");
    }

    @Override
    public ExtractionStage stage() {
        return stage;
    }

    /**
     * Cleans raw matches and keeps the distinct plausible ones in input order.
     */
    protected List<String> acceptPlausible(Collection<String> rawMatches) {
        Set<String> accepted = new LinkedHashSet<>();
        for (String raw : rawMatches) {
            String cleaned = cleaner.clean(raw);
            if (classifier.isPlausibleAnswer(cleaned, bounds)) {
                accepted.add(cleaned);
            }
        }
        return new ArrayList<>(accepted);
    }

    protected Optional<CandidateSet> toCandidateSet(List<String> accepted) {
        if (accepted.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CandidateSet(stage, scorer.scoreAll(accepted)));
    }
}
