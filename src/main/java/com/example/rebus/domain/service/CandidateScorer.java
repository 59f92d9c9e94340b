package com.example.rebus.domain.service;

import com.example.rebus.domain.model.ScoredCandidate;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Ranks competing answer candidates with an additive rubric.
 * Ties keep the candidate that came first so the choice is deterministic.
 */
public class CandidateScorer {

    private static final Pattern ARTICLE = Pattern.compile("(?<![\\p{L}\\p{N}])(?:a|an|the)(?![\\p{L}\\p{N}])",
            Pattern.CASE_INSENSITIVE);

    private final List<ScoringRule> rules;

    /**
     * Creates a scorer using the default rubric.
     *
     * @param classifier classifier backing the description rule
     */
    public CandidateScorer(CandidateClassifier classifier) {
        this(defaultRules(classifier));
    }

    /**
     * Creates a scorer with a custom rubric.
     *
     * @param rules rubric rows, evaluated in order
     */
    public CandidateScorer(List<ScoringRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    /**
     * Default rubric: idiom-sized phrases, compactness, no meta-commentary, presence of an article.
     *
     * @param classifier classifier backing the description rule
     * @return immutable rubric
     */
    public static List<ScoringRule> defaultRules(CandidateClassifier classifier) {
        Objects.requireNonNull(classifier, "classifier");
        return List.of(
                new ScoringRule("idiom-length", candidate -> wordCountBetween(candidate, 3, 6), 10),
                new ScoringRule("compact", candidate -> CandidateClassifier.countWords(candidate) <= 8, 5),
                new ScoringRule("not-description", candidate -> !classifier.isDescription(candidate), 5),
                new ScoringRule("has-article", candidate -> ARTICLE.matcher(candidate).find(), 2)
        );
    }

    public List<ScoringRule> rules() {
        return rules;
    }

    /**
     * Sums the weights of every rule the candidate satisfies.
     *
     * @param candidate candidate text
     * @return rubric score
     */
    public int score(String candidate) {
        String text = candidate == null ? "" : candidate;
        int total = 0;
        for (ScoringRule rule : rules) {
            total += rule.apply(text);
        }
        return total;
    }

    /**
     * Scores every candidate while keeping input order.
     *
     * @param candidates candidate texts
     * @return scored candidates
     */
    public List<ScoredCandidate> scoreAll(List<String> candidates) {
        return candidates.stream()
                .map(candidate -> new ScoredCandidate(candidate, score(candidate)))
                .toList();
    }

    /**
     * Returns the sole candidate, or the highest scoring one with ties resolved by input order.
     *
     * @param candidates candidate texts
     * @return winner, or an empty string when there are no candidates
     */
    public String selectBest(List<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return "";
        }
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        return ScoredCandidate.highest(scoreAll(candidates))
                .map(ScoredCandidate::text)
                .orElse("");
    }

    private static boolean wordCountBetween(String candidate, int min, int max) {
        int words = CandidateClassifier.countWords(candidate);
        return words >= min && words <= max;
    }
}
