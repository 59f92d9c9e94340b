package com.example.rebus.domain.service;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes idiom phrases so that trivial lexical variants compare equal.
 * <p>
 * One pass lower-cases the text, turns dash/underscore runs into spaces, rewrites the
 * whole words {@code and}, {@code u} and {@code r}, collapses whitespace, strips
 * non-word characters at both ends and drops one leading article. Passes repeat until
 * the text stops changing, so {@code normalize(normalize(x)).equals(normalize(x))}.
 */
public class AnswerNormalizer {

    private static final Pattern DASH_RUN = Pattern.compile("[-_\\u2010-\\u2015]+");
    private static final Pattern AND_WORD = Pattern.compile("\\band\\b", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern U_WORD = Pattern.compile("\\bu\\b", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern R_WORD = Pattern.compile("\\br\\b", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern LEADING_ARTICLE = Pattern.compile("^(?:a|an|the)\\s+");

    /**
     * Normalizes a phrase for comparison.
     *
     * @param text raw phrase, may be {@code null}
     * @return canonical phrase, empty for {@code null} or blank input
     */
    public String normalize(String text) {
        if (text == null) {
            return "";
        }
        String current = text;
        String next = normalizeOnce(current);
        while (!next.equals(current)) {
            current = next;
            next = normalizeOnce(current);
        }
        return next;
    }

    private String normalizeOnce(String text) {
        String result = text.toLowerCase(Locale.ROOT);
        result = DASH_RUN.matcher(result).replaceAll(" ");
        result = AND_WORD.matcher(result).replaceAll("&");
        result = U_WORD.matcher(result).replaceAll("you");
        result = R_WORD.matcher(result).replaceAll("are");
        result = WHITESPACE.matcher(result).replaceAll(" ").strip();
        result = stripNonWordEdges(result);
        result = LEADING_ARTICLE.matcher(result).replaceFirst("");
        return result.strip();
    }

    private static String stripNonWordEdges(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && !isWordChar(text.codePointAt(start))) {
            start += Character.charCount(text.codePointAt(start));
        }
        while (end > start && !isWordChar(text.codePointBefore(end))) {
            end -= Character.charCount(text.codePointBefore(end));
        }
        return text.substring(start, end);
    }

    // Unicode \w plus the ampersand that stands in for "and".
    private static boolean isWordChar(int codePoint) {
        if (codePoint == '&' || Character.isLetterOrDigit(codePoint)) {
            return true;
        }
        int type = Character.getType(codePoint);
        return type == Character.CONNECTOR_PUNCTUATION
                || type == Character.NON_SPACING_MARK
                || type == Character.ENCLOSING_MARK
                || type == Character.COMBINING_SPACING_MARK
                || type == Character.LETTER_NUMBER
                || codePoint == '\u200C'
                || codePoint == '\u200D';
    }
}
