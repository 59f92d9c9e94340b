package com.example.rebus.infrastructure.config;

import com.example.rebus.domain.model.ExtractionLexicon;
import com.example.rebus.domain.model.ExtractionSettings;
import com.example.rebus.domain.model.WordCountBounds;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for turning bound properties into extraction settings.
 */
class RebusEvaluationPropertiesTest {

    @Test
    void defaultsMatchBuiltInSettings() {
        RebusEvaluationProperties properties = new RebusEvaluationProperties();

        assertThat(properties.getExtraction().toSettings()).isEqualTo(ExtractionSettings.defaults());
        assertThat(properties.getExtraction().toLexicon()).isEqualTo(ExtractionLexicon.defaults());
        assertThat(properties.getResults().getLogsDir()).isEqualTo("logs");
        assertThat(properties.getEvaluation().getReviewExampleLimit()).isEqualTo(5);
    }

    /**
     * Ensures a non-empty list replaces only its own default.
     */
    @Test
    void overridesReplaceSingleLists() {
        RebusEvaluationProperties properties = new RebusEvaluationProperties();
        properties.getExtraction().setIntroKeywords(List.of("my answer"));
        properties.getExtraction().setAnswerMaxWords(6);

        ExtractionLexicon lexicon = properties.getExtraction().toLexicon();

        assertThat(lexicon.introKeywords()).containsExactly("my answer");
        assertThat(lexicon.descriptionMarkers()).isEqualTo(ExtractionLexicon.defaults().descriptionMarkers());
        assertThat(properties.getExtraction().toSettings().answerBounds()).isEqualTo(new WordCountBounds(1, 6));
    }
}
