package com.example.rebus.domain.service;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One row of the candidate scoring rubric: a named predicate and the weight it adds when it holds.
 */
public record ScoringRule(String name, Predicate<String> predicate, int weight) {

    public ScoringRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(predicate, "predicate");
    }

    public int apply(String candidate) {
        return predicate.test(candidate) ? weight : 0;
    }
}
