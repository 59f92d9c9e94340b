package com.example.rebus.application.service;

import com.example.rebus.domain.model.ResponseProfile;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Counts answer formats found in raw model responses.
 */
@Service
public class ResponseProfiler {

    private static final Pattern ANSWER_KEYWORD = Pattern.compile("answer\\s+is", Pattern.CASE_INSENSITIVE);
    private static final Pattern IDIOM_KEYWORD = Pattern.compile("idiom", Pattern.CASE_INSENSITIVE);
    private static final int EXPLANATION_LENGTH = 50;

    /**
     * Profiles the given responses. {@code null} entries are ignored.
     *
     * @param responses raw predictions
     * @return counts per format and the mean response length
     */
    public ResponseProfile profile(List<String> responses) {
        if (responses == null) {
            return ResponseProfile.empty();
        }
        List<String> present = responses.stream().filter(Objects::nonNull).toList();
        if (present.isEmpty()) {
            return ResponseProfile.empty();
        }
        int bold = 0;
        int quotes = 0;
        int brackets = 0;
        int answerKeyword = 0;
        int idiomKeyword = 0;
        int explanations = 0;
        long totalLength = 0;
        for (String response : present) {
            if (response.contains("**")) {
                bold++;
            }
            if (response.indexOf('"') >= 0 || response.indexOf('\'') >= 0) {
                quotes++;
            }
            if (response.contains("{{{")) {
                brackets++;
            }
            if (ANSWER_KEYWORD.matcher(response).find()) {
                answerKeyword++;
            }
            if (IDIOM_KEYWORD.matcher(response).find()) {
                idiomKeyword++;
            }
            if (response.length() > EXPLANATION_LENGTH) {
                explanations++;
            }
            totalLength += response.length();
        }
        double averageLength = Math.round((double) totalLength / present.size() * 100d) / 100d;
        return new ResponseProfile(present.size(), bold, quotes, brackets, answerKeyword, idiomKeyword,
                explanations, averageLength);
    }
}
