package com.example.rebus.domain.service;

import com.example.rebus.domain.model.ExtractionLexicon;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the additive scoring rubric.
 */
class CandidateScorerTest {

    private final CandidateScorer scorer = new CandidateScorer(new CandidateClassifier(ExtractionLexicon.defaults()));

    @Test
    void defaultRubricIsOrderedTable() {
        assertThat(scorer.rules()).extracting(ScoringRule::name)
                .containsExactly("idiom-length", "compact", "not-description", "has-article");
        assertThat(scorer.rules()).extracting(ScoringRule::weight)
                .containsExactly(10, 5, 5, 2);
    }

    /**
     * Ensures the score is the sum of the weights of the satisfied rules.
     */
    @Test
    void scoreSumsSatisfiedRules() {
        assertThat(scorer.score("spill the beans")).isEqualTo(22);
        assertThat(scorer.score("spill beans")).isEqualTo(10);
        assertThat(scorer.score("the image shows a cat")).isEqualTo(17);
        assertThat(scorer.score("one two three four five six seven eight nine")).isEqualTo(5);
    }

    @Test
    void selectBestPrefersHigherScore() {
        assertThat(scorer.selectBest(List.of("spill beans", "spill the beans"))).isEqualTo("spill the beans");
    }

    /**
     * Ensures equal scores keep the candidate that came first.
     */
    @Test
    void selectBestKeepsFirstOnTie() {
        assertThat(scorer.selectBest(List.of("break the ice", "kick the bucket"))).isEqualTo("break the ice");
        assertThat(scorer.selectBest(List.of("kick the bucket", "break the ice"))).isEqualTo("kick the bucket");
    }

    @Test
    void selectBestHandlesEmptyAndSingleCandidate() {
        assertThat(scorer.selectBest(List.of())).isEmpty();
        assertThat(scorer.selectBest(null)).isEmpty();
        assertThat(scorer.selectBest(List.of("x"))).isEqualTo("x");
    }

    @Test
    void customRubricReplacesDefaults() {
        CandidateScorer lengthOnly = new CandidateScorer(List.of(new ScoringRule("long", text -> text.length() > 5, 1)));

        assertThat(lengthOnly.selectBest(List.of("short", "longer one"))).isEqualTo("longer one");
        assertThat(lengthOnly.score(null)).isZero();
    }
}
