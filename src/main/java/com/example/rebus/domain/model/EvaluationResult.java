package com.example.rebus.domain.model;

import java.util.List;

/**
 * Full output of an evaluation: the persisted metrics plus material for human review.
 *
 * @param report          aggregate metrics
 * @param responseProfile format statistics of the raw responses
 * @param helpedExamples  first samples where extraction turned a miss into a match
 * @param hurtExamples    first samples where extraction turned a match into a miss
 */
public record EvaluationResult(
        MetricsReport report,
        ResponseProfile responseProfile,
        List<SampleEvaluation> helpedExamples,
        List<SampleEvaluation> hurtExamples
) {
}
