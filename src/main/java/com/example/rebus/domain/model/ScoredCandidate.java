package com.example.rebus.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * Candidate answer phrase paired with its rubric score.
 */
public record ScoredCandidate(String text, int score) {

	/**
	 * Picks the highest scoring candidate, keeping the earliest one on ties.
	 *
	 * @param candidates scored candidates in input order
	 * @return winning candidate or empty when the list is empty
	 */
    public static Optional<ScoredCandidate> highest(List<ScoredCandidate> candidates) {
        ScoredCandidate best = null;
        for (ScoredCandidate candidate : candidates) {
            if (best == null || candidate.score() > best.score()) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }
}
