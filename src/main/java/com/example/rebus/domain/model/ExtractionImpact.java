package com.example.rebus.domain.model;

/**
 * Tally of samples whose exact-match verdict changed because of extraction.
 *
 * @param helped extracted answer matched while the raw response did not
 * @param hurt   raw response matched while the extracted answer did not
 * @param net    {@code helped - hurt}
 */
public record ExtractionImpact(int helped, int hurt, int net) {

    public static ExtractionImpact of(int helped, int hurt) {
        return new ExtractionImpact(helped, hurt, helped - hurt);
    }
}
