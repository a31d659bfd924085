package dev.evalforge;

import dev.evalforge.analysis.ErrorAnalysis;
import dev.evalforge.analysis.Example;
import dev.evalforge.analysis.InputSchema;
import dev.evalforge.analysis.OutputSchema;
import dev.evalforge.analysis.PromptAnalysis;
import dev.evalforge.analysis.TaskType;
import dev.evalforge.custom.AggregationType;
import dev.evalforge.custom.ComparisonOperator;
import dev.evalforge.custom.CustomMetric;
import dev.evalforge.custom.CustomMetricRepository;
import dev.evalforge.custom.EvaluationMetricResult;
import dev.evalforge.custom.EvaluationMetricResultRepository;
import dev.evalforge.custom.MetricResult;
import dev.evalforge.custom.MetricThresholds;
import dev.evalforge.custom.MetricType;
import dev.evalforge.evaluation.Evaluation;
import dev.evalforge.evaluation.EvaluationOptions;
import dev.evalforge.evaluation.EvaluationRepository;
import dev.evalforge.evaluation.EvaluationStatus;
import dev.evalforge.metrics.ClassificationMetrics;
import dev.evalforge.metrics.EvaluationMetrics;
import dev.evalforge.metrics.EvaluationMetricsRepository;
import dev.evalforge.pipeline.GeneratorOptions;
import dev.evalforge.suggestion.OptimizationSuggestion;
import dev.evalforge.suggestion.OptimizationSuggestionRepository;
import dev.evalforge.suggestion.SuggestionStatus;
import dev.evalforge.suggestion.SuggestionType;
import dev.evalforge.testcase.TestCase;
import dev.evalforge.testcase.TestCaseCategory;
import dev.evalforge.testcase.TestCaseRepository;
import dev.evalforge.testcase.TestCaseStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Compensates for ddl-auto=none by verifying each JPA entity
 * can be persisted and read back against the Flyway schema.
 * Catches entity ↔ migration drift at test time rather than runtime.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

    private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.MICROS);

    @Autowired
    private EvaluationRepository evaluationRepository;

    @Autowired
    private TestCaseRepository testCaseRepository;

    @Autowired
    private EvaluationMetricsRepository metricsRepository;

    @Autowired
    private OptimizationSuggestionRepository suggestionRepository;

    @Autowired
    private CustomMetricRepository customMetricRepository;

    @Autowired
    private EvaluationMetricResultRepository metricResultRepository;

    private Evaluation savedEvaluation() {
        return evaluationRepository.saveAndFlush(new Evaluation(
                11L, "Classify the sentiment", EvaluationOptions.named("Drift", "schema check")));
    }

    @Test
    void evaluationEntityRoundtripsAgainstFlywaySchema() {
        Evaluation evaluation = new Evaluation(11L, "Classify the sentiment", new EvaluationOptions(
                "Drift", "schema check", new GeneratorOptions(2, 1, 1), null,
                List.of(new Example(Map.of("text", "great"), Map.of("class", "positive"), null))));
        evaluation.setPromptAnalysis(new PromptAnalysis("Classify the sentiment",
                TaskType.CLASSIFICATION, InputSchema.empty(),
                OutputSchema.classification(List.of("positive", "negative")),
                List.of(), List.of(), 0.9));
        evaluation.start(NOW);
        evaluation.setErrorAnalysis(new ErrorAnalysis(List.of("Failed on edge case"),
                Map.of("edge_case_failure", 2), 0.2, 0.0, 0.1, 0.0,
                Map.of("edge_case_errors", 0.2), NOW));

        Evaluation saved = evaluationRepository.saveAndFlush(evaluation);
        Evaluation found = evaluationRepository.findById(saved.getId()).orElseThrow();

        assertThat(found.getName()).isEqualTo("Drift");
        assertThat(found.getStatus()).isEqualTo(EvaluationStatus.RUNNING);
        assertThat(found.getPromptAnalysis().classes()).containsExactly("positive", "negative");
        assertThat(found.getErrorAnalysis().errorPatterns()).containsEntry("edge_case_failure", 2);
        assertThat(found.getOptions().generatorOptions().total()).isEqualTo(4);
        assertThat(found.getOptions().examples()).hasSize(1);
        assertThat(found.getStartedAt()).isEqualTo(NOW);
        assertThat(found.getCreatedAt()).isNotNull();
        assertThat(found.getUpdatedAt()).isNotNull();
    }

    @Test
    void markRunningClaimsPendingEvaluationOnce() {
        Evaluation evaluation = savedEvaluation();

        int first = evaluationRepository.markRunning(
                evaluation.getId(), NOW, EvaluationStatus.PENDING, EvaluationStatus.RUNNING);
        int second = evaluationRepository.markRunning(
                evaluation.getId(), NOW, EvaluationStatus.PENDING, EvaluationStatus.RUNNING);

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        assertThat(evaluationRepository.findById(evaluation.getId()).orElseThrow().getStatus())
                .isEqualTo(EvaluationStatus.RUNNING);
    }

    @Test
    void testCaseEntityRoundtripsAgainstFlywaySchema() {
        Evaluation evaluation = savedEvaluation();
        TestCase testCase = new TestCase("edge_1", TestCaseCategory.EDGE_CASE,
                Map.of("text", ""), Map.of("class", "negative"));
        testCase.setEvaluationId(evaluation.getId());
        testCase.setOrdinal(3);
        testCase.recordResult(Map.of("class", "positive", "confidence", 0.81),
                TestCaseStatus.FAILED, 0.0, NOW);
        testCase.setExecutionTimeMs(420L);
        testCase.setSimulated(true);

        TestCase saved = testCaseRepository.saveAndFlush(testCase);
        TestCase found = testCaseRepository.findById(saved.getId()).orElseThrow();

        assertThat(found.getCategory()).isEqualTo(TestCaseCategory.EDGE_CASE);
        assertThat(found.getStatus()).isEqualTo(TestCaseStatus.FAILED);
        assertThat(found.getExpectedOutput()).containsEntry("class", "negative");
        assertThat(found.getActualOutput()).containsEntry("class", "positive");
        assertThat(found.getExecutionTimeMs()).isEqualTo(420L);
        assertThat(found.isSimulated()).isTrue();
        assertThat(testCaseRepository.findAllByEvaluationIdOrderByOrdinalAsc(evaluation.getId()))
                .extracting(TestCase::getOrdinal).containsExactly(3);
    }

    @Test
    void evaluationMetricsEntityRoundtripsAgainstFlywaySchema() {
        Evaluation evaluation = savedEvaluation();
        EvaluationMetrics metrics = new EvaluationMetrics(0.75, 0.5, 1, 2, NOW);
        metrics.setEvaluationId(evaluation.getId());
        metrics.setClassificationMetrics(new ClassificationMetrics(0.5,
                Map.of("positive", 1.0), Map.of("positive", 0.5), Map.of("positive", 0.667),
                0.667, 0.667, Map.of("positive", Map.of("positive", 1, "negative", 0)),
                Map.of("positive", 2)));
        metrics.putCustomMetrics(Map.of("error_rate", 0.5));
        metrics.setSimulated(true);

        metricsRepository.saveAndFlush(metrics);
        EvaluationMetrics found = metricsRepository.findByEvaluationId(evaluation.getId())
                .orElseThrow();

        assertThat(found.getOverallScore()).isEqualTo(0.75);
        assertThat(found.getClassificationMetrics().confusionMatrix().get("positive"))
                .containsEntry("positive", 1);
        assertThat(found.getCustomMetrics()).containsEntry("error_rate", 0.5);
        assertThat(found.isSimulated()).isTrue();
    }

    @Test
    void optimizationSuggestionEntityRoundtripsAgainstFlywaySchema() {
        Evaluation evaluation = savedEvaluation();
        OptimizationSuggestion suggestion = new OptimizationSuggestion(SuggestionType.EXAMPLES,
                "Add examples", "Classify", "Classify. Example: great -> positive");
        suggestion.setEvaluationId(evaluation.getId());
        suggestion.setExpectedImpact(0.15);
        suggestion.setExamples(List.of(
                new Example(Map.of("text", "great"), Map.of("class", "positive"), "clear case")));
        suggestion.updateStatus(SuggestionStatus.APPLIED, NOW);

        OptimizationSuggestion saved = suggestionRepository.saveAndFlush(suggestion);
        OptimizationSuggestion found = suggestionRepository.findById(saved.getId()).orElseThrow();

        assertThat(found.getType()).isEqualTo(SuggestionType.EXAMPLES);
        assertThat(found.getStatus()).isEqualTo(SuggestionStatus.APPLIED);
        assertThat(found.getAppliedAt()).isEqualTo(NOW);
        assertThat(found.getExamples()).hasSize(1);
        assertThat(found.getExpectedImpact()).isEqualTo(0.15);
    }

    @Test
    void customMetricAndResultRoundtripAgainstFlywaySchema() {
        Evaluation evaluation = savedEvaluation();
        CustomMetric metric = new CustomMetric(11L, "latency_ms", MetricType.NUMERIC,
                AggregationType.P95, MetricThresholds.of(ComparisonOperator.LESS_OR_EQUAL, 1000));
        metric.setWeight(2.0);
        CustomMetric savedMetric = customMetricRepository.saveAndFlush(metric);

        EvaluationMetricResult result =
                new EvaluationMetricResult(evaluation.getId(), savedMetric.getId());
        result.apply(new MetricResult(savedMetric.getId(), "latency_ms", 870.0, true, 0.9, 10,
                Map.of("min", 120.0, "max", 990.0)), NOW);
        metricResultRepository.saveAndFlush(result);

        CustomMetric foundMetric = customMetricRepository
                .findByProjectIdAndName(11L, "latency_ms").orElseThrow();
        EvaluationMetricResult foundResult = metricResultRepository
                .findByEvaluationIdAndMetricId(evaluation.getId(), savedMetric.getId())
                .orElseThrow();

        assertThat(foundMetric.getAggregation()).isEqualTo(AggregationType.P95);
        assertThat(foundMetric.getThresholds().operator())
                .isEqualTo(ComparisonOperator.LESS_OR_EQUAL);
        assertThat(foundMetric.getWeight()).isEqualTo(2.0);
        assertThat(foundResult.getAggregatedValue()).isEqualTo(870.0);
        assertThat(foundResult.getSampleCount()).isEqualTo(10);
        assertThat(foundResult.getDetails()).containsEntry("max", 990.0);
    }
}
