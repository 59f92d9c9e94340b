package com.example.rebus.infrastructure.config;

import com.example.rebus.domain.extraction.FallbackRawStrategy;
import com.example.rebus.domain.extraction.IdiomExtractor;
import com.example.rebus.domain.model.ExtractionLexicon;
import com.example.rebus.domain.model.ExtractionSettings;
import com.example.rebus.domain.service.AnswerNormalizer;
import com.example.rebus.domain.service.CandidateClassifier;
import com.example.rebus.domain.service.CandidateCleaner;
import com.example.rebus.domain.service.CandidateScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free extraction pipeline from {@link RebusEvaluationProperties}.
 */
@Configuration
@EnableConfigurationProperties(RebusEvaluationProperties.class)
public class ExtractionPipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(ExtractionPipelineConfig.class);

    @Bean
    public ExtractionLexicon extractionLexicon(RebusEvaluationProperties properties) {
        return properties.getExtraction().toLexicon();
    }

    @Bean
    public ExtractionSettings extractionSettings(RebusEvaluationProperties properties) {
        return properties.getExtraction().toSettings();
    }

    @Bean
    public AnswerNormalizer answerNormalizer() {
        return new AnswerNormalizer();
    }

    @Bean
    public CandidateClassifier candidateClassifier(ExtractionLexicon lexicon) {
        return new CandidateClassifier(lexicon);
    }

    @Bean
    public CandidateCleaner candidateCleaner(ExtractionLexicon lexicon) {
        return new CandidateCleaner(lexicon);
    }

    @Bean
    public CandidateScorer candidateScorer(CandidateClassifier classifier) {
        return new CandidateScorer(classifier);
    }

    @Bean
    public IdiomExtractor idiomExtractor(ExtractionLexicon lexicon,
                                         ExtractionSettings settings,
                                         CandidateClassifier classifier,
                                         CandidateCleaner cleaner,
                                         CandidateScorer scorer) {
        IdiomExtractor extractor = new IdiomExtractor(
                IdiomExtractor.defaultStrategies(lexicon, settings, classifier, cleaner, scorer),
                new FallbackRawStrategy(settings.fallbackMaxLength()));
        log.info("Extraction cascade ready: stages={}, fallbackMaxLength={}",
                extractor.stages(), settings.fallbackMaxLength());
        return extractor;
    }
}
