package com.example.rebus.domain.service;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Token-set overlap between two already normalized phrases.
 */
public final class TokenOverlap {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TokenOverlap() {
    }

    /**
     * Computes F1 over whitespace token sets. Duplicate tokens count once.
     * Two empty phrases agree vacuously (1.0); one empty phrase scores 0.0.
     *
     * @param predicted normalized predicted phrase
     * @param truth     normalized ground-truth phrase
     * @return F1 in [0, 1]
     */
    public static double f1(String predicted, String truth) {
        Set<String> predictedTokens = tokens(predicted);
        Set<String> truthTokens = tokens(truth);
        if (predictedTokens.isEmpty() && truthTokens.isEmpty()) {
            return 1.0;
        }
        if (predictedTokens.isEmpty() || truthTokens.isEmpty()) {
            return 0.0;
        }
        Set<String> common = new LinkedHashSet<>(predictedTokens);
        common.retainAll(truthTokens);
        double precision = (double) common.size() / predictedTokens.size();
        double recall = (double) common.size() / truthTokens.size();
        if (precision + recall == 0.0) {
            return 0.0;
        }
        return 2.0 * precision * recall / (precision + recall);
    }

    static Set<String> tokens(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return new LinkedHashSet<>(Arrays.asList(WHITESPACE.split(text.strip())));
    }
}
