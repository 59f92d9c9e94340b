package com.example.rebus.domain.model;

/**
 * Inclusive word-count window an answer candidate has to fall into.
 */
public record WordCountBounds(int min, int max) {

    public static final WordCountBounds ANSWER = new WordCountBounds(1, 10);
    public static final WordCountBounds MARKER = new WordCountBounds(2, 8);
    public static final WordCountBounds NGRAM_SPAN = new WordCountBounds(3, 8);

    public WordCountBounds {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid word count bounds [" + min + ", " + max + "]");
        }
    }

    public boolean contains(int wordCount) {
        return wordCount >= min && wordCount <= max;
    }
}
