package com.example.rebus.domain.extraction;

import com.example.rebus.domain.model.CandidateSet;
import com.example.rebus.domain.model.ExtractionStage;
import com.example.rebus.domain.model.WordCountBounds;
import com.example.rebus.domain.service.CandidateClassifier;
import com.example.rebus.domain.service.CandidateCleaner;
import com.example.rebus.domain.service.CandidateScorer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects phrases wrapped in quotes, backticks or markdown bold, ordered by position.
 */
public class QuotedTextStrategy extends AbstractExtractionStrategy {

    private static final List<Pattern> DELIMITED = List.of(
            Pattern.compile("\"([^\"\\n]{1,200})\""),
            Pattern.compile("\\u201C([^\\u201D\\n]{1,200})\\u201D"),
            // apostrophes inside words ("cat's") are not quote marks
            Pattern.compile("(?<![\\p{L}\\p{N}])'([^'\\n]{1,200})'(?![\\p{L}\\p{N}])"),
            Pattern.compile("\\u2018([^\\u2019\\n]{1,200})\\u2019(?![\\p{L}\\p{N}])"),
            Pattern.compile("`([^`\\n]{1,200})`"),
            Pattern.compile("\\*\\*([^*\\n]{1,200})\\*\\*")
    );

    public QuotedTextStrategy(CandidateClassifier classifier,
                              CandidateCleaner cleaner,
                              CandidateScorer scorer,
                              WordCountBounds bounds) {
        super(ExtractionStage.QUOTED, classifier, cleaner, scorer, bounds);
    }

    @Override
    public Optional<CandidateSet> tryExtract(String text) {
        List<Match> matches = new ArrayList<>();
        for (Pattern pattern : DELIMITED) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                matches.add(new Match(matcher.start(), matcher.group(1)));
            }
        }
        matches.sort(Comparator.comparingInt(Match::position));
        return toCandidateSet(acceptPlausible(matches.stream().map(Match::text).toList()));
    }

    private record Match(int position, String text) {
    }
}
