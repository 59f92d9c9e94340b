package com.example.rebus.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * Ordered candidates accepted by a single extraction stage.
 * Scoped to one extraction call and discarded once the winner is chosen.
 */
public record CandidateSet(
        ExtractionStage stage,
        List<ScoredCandidate> candidates
) {

    public CandidateSet {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

	/**
	 * Resolves the winner of the stage. A lone candidate wins regardless of its score.
	 *
	 * @return best candidate or empty when the set holds nothing
	 */
    public Optional<ScoredCandidate> best() {
        if (candidates.size() == 1) {
            return Optional.of(candidates.get(0));
        }
        return ScoredCandidate.highest(candidates);
    }
}
