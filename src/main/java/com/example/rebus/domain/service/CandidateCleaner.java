package com.example.rebus.domain.service;

import com.example.rebus.domain.model.ExtractionLexicon;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Trims filler and decoration around a raw match before it is tested for plausibility.
 * <p>
 * Strips list markers, a leading bold label such as {@code **Answer**:}, one layer of
 * wrapping quotes, leading filler such as "the idiom is",
 * "I think" or an article, trailing filler such as "idiom" or "phrase" and terminal
 * punctuation. The steps repeat until the text is stable.
 */
public class CandidateCleaner {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LIST_MARKER = Pattern.compile("^(?:[-*\\u2022]\\s+|#+\\s*|>\\s*|\\d+[.)]\\s+)");
    private static final Pattern LEADING_BOLD_LABEL = Pattern.compile("^\\*\\*([^*\\n]{1,40})\\*\\*");
    private static final String DECORATION = "\"\u201C\u201D*`";
    private static final String TERMINAL_PUNCTUATION = ".,!?;:\u2026-\u2013\u2014";
    private static final Pattern LEADING_SEPARATORS = Pattern.compile("^[\\s:,.;\\-\\u2013\\u2014]+");

    private final List<String> leadingFillers;
    private final List<String> trailingFillers;

    /**
     * @param lexicon source of the leading and trailing filler lists
     */
    public CandidateCleaner(ExtractionLexicon lexicon) {
        Objects.requireNonNull(lexicon, "lexicon");
        this.leadingFillers = lowerCased(lexicon.leadingFillers());
        this.trailingFillers = lowerCased(lexicon.trailingFillers());
    }

    /**
     * Cleans a raw match.
     *
     * @param raw matched text, may be {@code null}
     * @return cleaned candidate, possibly empty
     */
    public String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String current = collapse(raw);
        String previous;
        do {
            previous = current;
            current = LIST_MARKER.matcher(current).replaceFirst("");
            current = LEADING_BOLD_LABEL.matcher(current).replaceFirst("$1");
            current = stripDecoration(current);
            current = stripSingleQuotePair(current.strip());
            current = stripTerminalPunctuation(current);
            current = stripLeadingFiller(current);
            current = stripTrailingFiller(current);
            current = current.strip();
        } while (!current.equals(previous));
        return current;
    }

    /**
     * Light trim used for bracket-marker answers: whitespace, one layer of wrapping
     * quotes and terminal punctuation. Articles and filler are kept.
     *
     * @param raw text found between the markers
     * @return trimmed text
     */
    public String trimMarker(String raw) {
        if (raw == null) {
            return "";
        }
        String current = collapse(raw);
        current = stripDecoration(current);
        current = stripSingleQuotePair(current.strip());
        current = stripTerminalPunctuation(current);
        return current.strip();
    }

    private String stripLeadingFiller(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String filler : leadingFillers) {
            if (lower.startsWith(filler) && endsAtBoundary(lower, filler.length())) {
                String rest = text.substring(filler.length());
                return LEADING_SEPARATORS.matcher(rest).replaceFirst("");
            }
        }
        return text;
    }

    private String stripTrailingFiller(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String filler : trailingFillers) {
            if (lower.equals(filler)) {
                return "";
            }
            if (lower.endsWith(" " + filler)) {
                return text.substring(0, text.length() - filler.length()).strip();
            }
        }
        return text;
    }

    private static boolean endsAtBoundary(String text, int index) {
        if (index >= text.length()) {
            return true;
        }
        char next = text.charAt(index);
        return !Character.isLetterOrDigit(next) && next != '\'';
    }

    // Edge scans run in linear time on long runs of decoration or punctuation.
    private static String stripDecoration(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && DECORATION.indexOf(text.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && DECORATION.indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        return text.substring(start, end);
    }

    private static String stripTerminalPunctuation(String text) {
        int end = text.length();
        while (end > 0) {
            char last = text.charAt(end - 1);
            if (!Character.isWhitespace(last) && TERMINAL_PUNCTUATION.indexOf(last) < 0) {
                break;
            }
            end--;
        }
        return text.substring(0, end);
    }

    private static String stripSingleQuotePair(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '\'' && last == '\'') || (first == '\u2018' && last == '\u2019')) {
                return text.substring(1, text.length() - 1).strip();
            }
        }
        return text;
    }

    private static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    private static List<String> lowerCased(List<String> values) {
        return values.stream()
                .filter(value -> value != null && !value.isBlank())
                .map(value -> collapse(value).toLowerCase(Locale.ROOT))
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
    }
}
