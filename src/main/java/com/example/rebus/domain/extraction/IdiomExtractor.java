package com.example.rebus.domain.extraction;

import com.example.rebus.domain.model.CandidateSet;
import com.example.rebus.domain.model.ExtractionLexicon;
import com.example.rebus.domain.model.ExtractionOutcome;
import com.example.rebus.domain.model.ExtractionSettings;
import com.example.rebus.domain.model.ExtractionStage;
import com.example.rebus.domain.model.ScoredCandidate;
import com.example.rebus.domain.service.CandidateClassifier;
import com.example.rebus.domain.service.CandidateCleaner;
import com.example.rebus.domain.service.CandidateScorer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a free-form model response into a single answer phrase.
 * <p>
 * Strategies run in list order and the first one producing an accepted candidate wins.
 * When none does, the raw fallback stage answers, so {@link #extract(String)} always
 * returns an outcome with a stage set.
 */
public class IdiomExtractor {

    private static final Logger log = LoggerFactory.getLogger(IdiomExtractor.class);

    private final List<ExtractionStrategy> strategies;
    private final FallbackRawStrategy fallback;

    /**
     * Creates an extractor over an explicit stage list.
     *
     * @param strategies ordered heuristic stages
     * @param fallback   terminal stage used when every strategy comes back empty
     */
    public IdiomExtractor(List<ExtractionStrategy> strategies, FallbackRawStrategy fallback) {
        this.strategies = List.copyOf(Objects.requireNonNull(strategies, "strategies"));
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    /**
     * Builds the standard seven-stage cascade.
     *
     * @param lexicon  word lists for cleaning, classification and keyword detection
     * @param settings numeric bounds of the stages
     * @return ready-to-use extractor
     */
    public static IdiomExtractor create(ExtractionLexicon lexicon, ExtractionSettings settings) {
        CandidateClassifier classifier = new CandidateClassifier(lexicon);
        CandidateCleaner cleaner = new CandidateCleaner(lexicon);
        CandidateScorer scorer = new CandidateScorer(classifier);
        return new IdiomExtractor(defaultStrategies(lexicon, settings, classifier, cleaner, scorer),
                new FallbackRawStrategy(settings.fallbackMaxLength()));
    }

    public static IdiomExtractor withDefaults() {
        return create(ExtractionLexicon.defaults(), ExtractionSettings.defaults());
    }

    /**
     * Standard stage order: bracket marker, quoted text, keyword intro, standalone line,
     * first sentence, n-gram scan.
     */
    public static List<ExtractionStrategy> defaultStrategies(ExtractionLexicon lexicon,
                                                             ExtractionSettings settings,
                                                             CandidateClassifier classifier,
                                                             CandidateCleaner cleaner,
                                                             CandidateScorer scorer) {
        return List.of(
                new BracketMarkerStrategy(classifier, cleaner, scorer, settings.markerBounds()),
                new QuotedTextStrategy(classifier, cleaner, scorer, settings.answerBounds()),
                new KeywordIntroStrategy(lexicon, classifier, cleaner, scorer, settings.answerBounds()),
                new StandaloneLineStrategy(classifier, cleaner, scorer, settings.answerBounds()),
                new FirstSentenceStrategy(classifier, cleaner, scorer, settings.answerBounds()),
                new NgramScanStrategy(classifier, cleaner, scorer, settings.answerBounds(), settings.ngramSpan())
        );
    }

    /**
     * Extracts the best-guess answer phrase. Never throws.
     *
     * @param raw raw model response, may be {@code null}
     * @return extracted phrase and the stage that produced it
     */
    public ExtractionOutcome extract(String raw) {
        if (raw == null || raw.isBlank()) {
            return ExtractionOutcome.empty();
        }
        for (ExtractionStrategy strategy : strategies) {
            Optional<CandidateSet> candidates = tryStage(strategy, raw);
            Optional<ScoredCandidate> best = candidates.flatMap(CandidateSet::best);
            if (best.isPresent()) {
                if (log.isDebugEnabled()) {
                    log.debug("Stage {} accepted '{}' out of {} candidate(s)",
                            strategy.stage(), best.get().text(), candidates.get().candidates().size());
                }
                return new ExtractionOutcome(best.get().text(), strategy.stage());
            }
        }
        log.debug("No stage accepted a candidate, using raw fallback");
        return fallback.extract(raw);
    }

    /**
     * @return stage order of this extractor, fallback included
     */
    public List<ExtractionStage> stages() {
        List<ExtractionStage> stages = new ArrayList<>(strategies.stream().map(ExtractionStrategy::stage).toList());
        stages.add(ExtractionStage.FALLBACK_RAW);
        return List.copyOf(stages);
    }

    private Optional<CandidateSet> tryStage(ExtractionStrategy strategy, String raw) {
        try {
            return strategy.tryExtract(raw);
        } catch (RuntimeException ex) {
            log.warn("Extraction stage {} failed, moving on to the next stage", strategy.stage(), ex);
            return Optional.empty();
        }
    }
}
