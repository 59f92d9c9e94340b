package com.example.rebus.application.service;

import com.example.rebus.domain.extraction.IdiomExtractor;
import com.example.rebus.domain.model.EvaluationResult;
import com.example.rebus.domain.model.ExtractionImpact;
import com.example.rebus.domain.model.ExtractionOutcome;
import com.example.rebus.domain.model.ExtractionStage;
import com.example.rebus.domain.model.MetricsReport;
import com.example.rebus.domain.model.Sample;
import com.example.rebus.domain.model.SampleEvaluation;
import com.example.rebus.domain.service.AnswerNormalizer;
import com.example.rebus.domain.service.TokenOverlap;
import com.example.rebus.infrastructure.config.RebusEvaluationProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Application-layer service that scores extracted answers against ground truth.
 * It runs the extraction cascade per sample, compares normalized phrases and folds the
 * per-sample verdicts into a {@link MetricsReport}.
 */
@Service
public class MetricsEvaluator {

    private static final Logger log = LoggerFactory.getLogger(MetricsEvaluator.class);

    private final IdiomExtractor extractor;
    private final AnswerNormalizer normalizer;
    private final ResponseProfiler profiler;
    private final boolean parallel;
    private final int reviewExampleLimit;

    /**
     * Creates the evaluator with its collaborators.
     *
     * @param extractor  cascade turning raw responses into answer phrases
     * @param normalizer canonicalizer applied to every compared phrase
     * @param profiler   response format statistics
     * @param properties evaluation settings (parallelism, review list size)
     */
    public MetricsEvaluator(IdiomExtractor extractor,
                            AnswerNormalizer normalizer,
                            ResponseProfiler profiler,
                            RebusEvaluationProperties properties) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.profiler = Objects.requireNonNull(profiler, "profiler");
        this.parallel = properties.getEvaluation().isParallel();
        this.reviewExampleLimit = Math.max(0, properties.getEvaluation().getReviewExampleLimit());
    }

    /**
     * Scores a single complete sample.
     *
     * @param sample sample with non-null ground truth and prediction
     * @return per-sample verdicts
     * @throws IllegalArgumentException when the sample is incomplete
     */
    public SampleEvaluation evaluateSample(Sample sample) {
        if (sample == null || !sample.isComplete()) {
            throw new IllegalArgumentException("Sample must carry ground truth and prediction");
        }
        ExtractionOutcome outcome = extractor.extract(sample.rawPrediction());
        String truth = normalizer.normalize(sample.groundTruth());
        String raw = normalizer.normalize(sample.rawPrediction());
        String extracted = normalizer.normalize(outcome.extractedText());

        boolean exact = extracted.equals(truth);
        return new SampleEvaluation(
                sample.id(),
                sample.groundTruth(),
                sample.rawPrediction(),
                outcome.extractedText(),
                outcome.stageUsed(),
                truth,
                raw,
                extracted,
                exact,
                isPartialMatch(extracted, truth),
                raw.equals(truth),
                TokenOverlap.f1(extracted, truth)
        );
    }

    /**
     * Evaluates a batch. Incomplete samples are skipped and counted, never thrown.
     *
     * @param samples batch to evaluate, may be {@code null}
     * @return metrics report, response profile and review examples
     */
    public EvaluationResult evaluate(List<Sample> samples) {
        List<Sample> batch = samples == null ? List.of() : samples;
        List<Sample> complete = batch.stream()
                .filter(sample -> sample != null && sample.isComplete())
                .toList();
        int skipped = batch.size() - complete.size();
        if (skipped > 0) {
            log.warn("Skipped {} sample(s) without ground truth or prediction", skipped);
        }

        Stream<Sample> stream = parallel ? complete.parallelStream() : complete.stream();
        List<SampleEvaluation> evaluations = stream.map(this::evaluateSample).toList();

        MetricsReport report = aggregate(batch.size(), skipped, evaluations);
        log.info("Evaluated {} of {} sample(s): exact={}, partial={}, macroF1={}, raw={}, net={}",
                report.evaluatedSamples(), report.totalSamples(), report.exactMatchRate(),
                report.partialMatchRate(), report.macroF1(), report.rawMatchRate(),
                report.extractionImpact().net());

        return new EvaluationResult(
                report,
                profiler.profile(complete.stream().map(Sample::rawPrediction).toList()),
                evaluations.stream().filter(SampleEvaluation::extractionHelped).limit(reviewExampleLimit).toList(),
                evaluations.stream().filter(SampleEvaluation::extractionHurt).limit(reviewExampleLimit).toList()
        );
    }

    private MetricsReport aggregate(int total, int skipped, List<SampleEvaluation> evaluations) {
        int evaluated = evaluations.size();
        int exact = 0;
        int partial = 0;
        int rawMatches = 0;
        int helped = 0;
        int hurt = 0;
        double f1Sum = 0.0;
        Map<ExtractionStage, Integer> stageUsage = new EnumMap<>(ExtractionStage.class);
        for (ExtractionStage stage : ExtractionStage.values()) {
            stageUsage.put(stage, 0);
        }
        for (SampleEvaluation evaluation : evaluations) {
            exact += evaluation.exactMatch() ? 1 : 0;
            partial += evaluation.partialMatch() ? 1 : 0;
            rawMatches += evaluation.rawMatch() ? 1 : 0;
            helped += evaluation.extractionHelped() ? 1 : 0;
            hurt += evaluation.extractionHurt() ? 1 : 0;
            f1Sum += evaluation.f1();
            stageUsage.merge(evaluation.stageUsed(), 1, Integer::sum);
        }
        return new MetricsReport(
                total,
                evaluated,
                skipped,
                exact,
                rate(exact, evaluated),
                partial,
                rate(partial, evaluated),
                evaluated == 0 ? 0.0 : round4(f1Sum / evaluated),
                rawMatches,
                rate(rawMatches, evaluated),
                ExtractionImpact.of(helped, hurt),
                Collections.unmodifiableMap(stageUsage)
        );
    }

    /**
     * Substring containment either way. An empty phrase is contained in every phrase.
     */
    static boolean isPartialMatch(String extracted, String truth) {
        return extracted.contains(truth) || truth.contains(extracted);
    }

    private static double rate(int count, int evaluated) {
        return evaluated == 0 ? 0.0 : round4((double) count / evaluated);
    }

    private static double round4(double value) {
        return Math.round(value * 10000d) / 10000d;
    }
}
