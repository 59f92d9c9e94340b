package com.example.rebus.domain.extraction;

import com.example.rebus.domain.model.CandidateSet;
import com.example.rebus.domain.model.ExtractionLexicon;
import com.example.rebus.domain.model.ExtractionStage;
import com.example.rebus.domain.model.WordCountBounds;
import com.example.rebus.domain.service.CandidateClassifier;
import com.example.rebus.domain.service.CandidateCleaner;
import com.example.rebus.domain.service.CandidateScorer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Takes the clause that follows an introductory phrase such as "the idiom is" or "represents".
 * <p>
 * The capture runs to the next sentence boundary and is cut at the first comma or semicolon.
 * Searching resumes right after the cut, so a later keyword inside the same sentence yields its
 * own candidate and the rubric decides between them.
 */
public class KeywordIntroStrategy extends AbstractExtractionStrategy {

    private static final Pattern CLAUSE_SEPARATOR = Pattern.compile("[,;]");

    private final Pattern introPattern;

    public KeywordIntroStrategy(ExtractionLexicon lexicon,
                                CandidateClassifier classifier,
                                CandidateCleaner cleaner,
                                CandidateScorer scorer,
                                WordCountBounds bounds) {
        super(ExtractionStage.KEYWORD_INTRO, classifier, cleaner, scorer, bounds);
        String alternation = CandidateClassifier.phraseAlternation(lexicon.introKeywords());
        this.introPattern = alternation.isEmpty()
                ? Pattern.compile("(?!)")
                : Pattern.compile("(?<![\\p{L}\\p{N}])(?:" + alternation + ")(?![\\p{L}\\p{N}])[\\s:.,]*([^.!?\\n]+)",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    @Override
    public Optional<CandidateSet> tryExtract(String text) {
        List<String> clauses = new ArrayList<>();
        Matcher matcher = introPattern.matcher(text);
        int from = 0;
        while (from < text.length() && matcher.find(from)) {
            String capture = matcher.group(1);
            Matcher separator = CLAUSE_SEPARATOR.matcher(capture);
            int cut = separator.find() ? separator.start() : capture.length();
            clauses.add(capture.substring(0, cut));
            from = matcher.start(1) + Math.max(cut, 1);
        }
        return toCandidateSet(acceptPlausible(clauses));
    }
}
