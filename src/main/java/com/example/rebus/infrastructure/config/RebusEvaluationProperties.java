package com.example.rebus.infrastructure.config;

import com.example.rebus.domain.model.ExtractionLexicon;
import com.example.rebus.domain.model.ExtractionSettings;
import com.example.rebus.domain.model.WordCountBounds;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Externalized settings bound from the {@code rebus.*} namespace.
 */
@ConfigurationProperties(prefix = "rebus")
public class RebusEvaluationProperties {

    private final Results results = new Results();
    private final Evaluation evaluation = new Evaluation();
    private final Extraction extraction = new Extraction();

    public Results getResults() {
        return results;
    }

    public Evaluation getEvaluation() {
        return evaluation;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    /**
     * Location of experiment runs: {@code <logs-dir>/<timestamp>/results.json}.
     */
    public static class Results {

        /** Root directory holding one folder per run timestamp. */
        private String logsDir = "logs";

        private String resultsFileName = "results.json";

        private String metricsFileName = "metrics.json";

        public String getLogsDir() {
            return logsDir;
        }

        public void setLogsDir(String logsDir) {
            this.logsDir = logsDir;
        }

        public String getResultsFileName() {
            return resultsFileName;
        }

        public void setResultsFileName(String resultsFileName) {
            this.resultsFileName = resultsFileName;
        }

        public String getMetricsFileName() {
            return metricsFileName;
        }

        public void setMetricsFileName(String metricsFileName) {
            this.metricsFileName = metricsFileName;
        }
    }

    public static class Evaluation {

        /** Map samples on a parallel stream. Aggregates do not depend on the order. */
        private boolean parallel = false;

        /** Number of helped and hurt samples kept for review. */
        private int reviewExampleLimit = 5;

        public boolean isParallel() {
            return parallel;
        }

        public void setParallel(boolean parallel) {
            this.parallel = parallel;
        }

        public int getReviewExampleLimit() {
            return reviewExampleLimit;
        }

        public void setReviewExampleLimit(int reviewExampleLimit) {
            this.reviewExampleLimit = reviewExampleLimit;
        }
    }

    /**
     * Cascade tuning. Empty lexicon lists keep the built-in defaults.
     */
    public static class Extraction {

        private int fallbackMaxLength = ExtractionSettings.DEFAULT_FALLBACK_MAX_LENGTH;
        private int markerMinWords = WordCountBounds.MARKER.min();
        private int markerMaxWords = WordCountBounds.MARKER.max();
        private int answerMinWords = WordCountBounds.ANSWER.min();
        private int answerMaxWords = WordCountBounds.ANSWER.max();
        private int ngramMinWords = WordCountBounds.NGRAM_SPAN.min();
        private int ngramMaxWords = WordCountBounds.NGRAM_SPAN.max();
        private List<String> descriptionMarkers = new ArrayList<>();
        private List<String> leadingFillers = new ArrayList<>();
        private List<String> trailingFillers = new ArrayList<>();
        private List<String> introKeywords = new ArrayList<>();

        public ExtractionSettings toSettings() {
            return new ExtractionSettings(
                    fallbackMaxLength,
                    new WordCountBounds(markerMinWords, markerMaxWords),
                    new WordCountBounds(answerMinWords, answerMaxWords),
                    new WordCountBounds(ngramMinWords, ngramMaxWords)
            );
        }

        public ExtractionLexicon toLexicon() {
            return ExtractionLexicon.withOverrides(descriptionMarkers, leadingFillers, trailingFillers, introKeywords);
        }

        public int getFallbackMaxLength() {
            return fallbackMaxLength;
        }

        public void setFallbackMaxLength(int fallbackMaxLength) {
            this.fallbackMaxLength = fallbackMaxLength;
        }

        public int getMarkerMinWords() {
            return markerMinWords;
        }

        public void setMarkerMinWords(int markerMinWords) {
            this.markerMinWords = markerMinWords;
        }

        public int getMarkerMaxWords() {
            return markerMaxWords;
        }

        public void setMarkerMaxWords(int markerMaxWords) {
            this.markerMaxWords = markerMaxWords;
        }

        public int getAnswerMinWords() {
            return answerMinWords;
        }

        public void setAnswerMinWords(int answerMinWords) {
            this.answerMinWords = answerMinWords;
        }

        public int getAnswerMaxWords() {
            return answerMaxWords;
        }

        public void setAnswerMaxWords(int answerMaxWords) {
            this.answerMaxWords = answerMaxWords;
        }

        public int getNgramMinWords() {
            return ngramMinWords;
        }

        public void setNgramMinWords(int ngramMinWords) {
            this.ngramMinWords = ngramMinWords;
        }

        public int getNgramMaxWords() {
            return ngramMaxWords;
        }

        public void setNgramMaxWords(int ngramMaxWords) {
            this.ngramMaxWords = ngramMaxWords;
        }

        public List<String> getDescriptionMarkers() {
            return descriptionMarkers;
        }

        public void setDescriptionMarkers(List<String> descriptionMarkers) {
            this.descriptionMarkers = descriptionMarkers;
        }

        public List<String> getLeadingFillers() {
            return leadingFillers;
        }

        public void setLeadingFillers(List<String> leadingFillers) {
            this.leadingFillers = leadingFillers;
        }

        public List<String> getTrailingFillers() {
            return trailingFillers;
        }

        public void setTrailingFillers(List<String> trailingFillers) {
            this.trailingFillers = trailingFillers;
        }

        public List<String> getIntroKeywords() {
            return introKeywords;
        }

        public void setIntroKeywords(List<String> introKeywords) {
            this.introKeywords = introKeywords;
        }
    }
}
