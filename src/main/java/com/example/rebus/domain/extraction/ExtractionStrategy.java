package com.example.rebus.domain.extraction;

import com.example.rebus.domain.model.CandidateSet;
import com.example.rebus.domain.model.ExtractionStage;

import java.util.Optional;

/**
 * One stage of the answer-extraction cascade.
 * <p>
 * Implementations are stateless after construction and must not throw for any input;
 * an empty result tells the cascade to move on to the next stage.
 */
public interface ExtractionStrategy {

    /**
     * @return stage reported when this strategy produces the answer
     */
    ExtractionStage stage();

    /**
     * Looks for accepted answer candidates in a raw response.
     *
     * @param text raw model response, never {@code null}
     * @return accepted candidates in input order, or empty when the stage found nothing
     */
    Optional<CandidateSet> tryExtract(String text);
}
