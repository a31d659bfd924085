package dev.evalforge.custom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.evalforge.fixture.CustomMetricBuilder;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class CustomMetricsEvaluatorTest {

  private static final double TOLERANCE = 1e-9;
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Mock CustomMetricRepository customMetricRepository;

  @Mock EvaluationMetricResultRepository metricResultRepository;

  @Captor ArgumentCaptor<EvaluationMetricResult> resultCaptor;

  CustomMetricsEvaluator evaluator;

  @BeforeEach
  void setUp() {
    evaluator =
        new CustomMetricsEvaluator(
            customMetricRepository,
            metricResultRepository,
            new FormulaEvaluator(),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static List<MetricValue> values(CustomMetric metric, double... numbers) {
    List<MetricValue> values = new ArrayList<>();
    for (double number : numbers) {
      values.add(
          new MetricValue(
              metric.getId(),
              null,
              number,
              number,
              metric.getThresholds().passes(number),
              NOW));
    }
    return values;
  }

  @Nested
  class EvaluateMetric {

    @Test
    void numeric_metric_reads_the_field_named_after_it() {
      CustomMetric metric = new CustomMetricBuilder().name("latency").build();

      MetricValue value = evaluator.evaluateMetric(metric, Map.of("latency", 420, "id", "s-1"));

      assertThat(value.numericValue()).isCloseTo(420.0, within(TOLERANCE));
      assertThat(value.rawValue()).isEqualTo(420);
      assertThat(value.sampleId()).isEqualTo("s-1");
      assertThat(value.metricId()).isEqualTo(metric.getId());
      assertThat(value.timestamp()).isEqualTo(NOW);
    }

    @Test
    void non_numeric_value_counts_as_zero() {
      CustomMetric metric =
          new CustomMetricBuilder().name("latency").type(MetricType.SCORE).build();

      assertThat(evaluator.evaluateMetric(metric, Map.of("latency", "slow")).numericValue())
          .isZero();
      assertThat(evaluator.evaluateMetric(metric, null).numericValue()).isZero();
    }

    @Test
    void boolean_metric_maps_to_one_or_zero() {
      CustomMetric metric =
          new CustomMetricBuilder()
              .name("has_citation")
              .type(MetricType.BOOLEAN)
              .threshold(ComparisonOperator.EQUAL, 1.0)
              .build();

      MetricValue yes = evaluator.evaluateMetric(metric, Map.of("has_citation", true));
      MetricValue no = evaluator.evaluateMetric(metric, Map.of());

      assertThat(yes.numericValue()).isEqualTo(1.0);
      assertThat(yes.passed()).isTrue();
      assertThat(no.numericValue()).isEqualTo(0.0);
      assertThat(no.passed()).isFalse();
    }

    @Test
    void string_metric_scores_pattern_match_then_length() {
      CustomMetric pattern =
          new CustomMetricBuilder()
              .name("format")
              .type(MetricType.STRING)
              .formula("^\\{.*\\}$")
              .build();
      CustomMetric length =
          new CustomMetricBuilder().name("response_length").type(MetricType.STRING).build();

      assertThat(evaluator.evaluateMetric(pattern, Map.of("format", "{\"a\":1}")).numericValue())
          .isEqualTo(1.0);
      assertThat(evaluator.evaluateMetric(pattern, Map.of("format", "plain")).numericValue())
          .isEqualTo(0.0);
      assertThat(
              evaluator.evaluateMetric(length, Map.of("response_length", "hello")).numericValue())
          .isEqualTo(5.0);
    }

    @Test
    void invalid_pattern_is_ignored() {
      CustomMetric metric =
          new CustomMetricBuilder().name("broken").type(MetricType.STRING).formula("[a-").build();

      assertThat(evaluator.evaluateMetric(metric, Map.of("broken", "abc")).numericValue())
          .isEqualTo(0.0);
    }

    @Test
    void custom_metric_evaluates_its_formula() {
      CustomMetric metric =
          new CustomMetricBuilder()
              .name("precision")
              .type(MetricType.CUSTOM)
              .formula("tp / (tp + fp)")
              .threshold(ComparisonOperator.GREATER_THAN, 0.7)
              .build();

      MetricValue value = evaluator.evaluateMetric(metric, Map.of("tp", 8, "fp", 2));

      assertThat(value.numericValue()).isCloseTo(0.8, within(TOLERANCE));
      assertThat(value.passed()).isTrue();
    }

    @Test
    void null_metric_is_rejected() {
      assertThatThrownBy(() -> evaluator.evaluateMetric(null, Map.of()))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  class Thresholds {

    @Test
    void null_thresholds_pass_non_negative_values() {
      assertThat(evaluator.checkThreshold(0.0, null)).isTrue();
      assertThat(evaluator.checkThreshold(-0.1, null)).isFalse();
    }

    @Test
    void equality_tolerates_small_differences() {
      MetricThresholds equal = MetricThresholds.of(ComparisonOperator.EQUAL, 0.5);
      MetricThresholds notEqual = MetricThresholds.of(ComparisonOperator.NOT_EQUAL, 0.5);

      assertThat(evaluator.checkThreshold(0.50005, equal)).isTrue();
      assertThat(evaluator.checkThreshold(0.5002, equal)).isFalse();
      assertThat(evaluator.checkThreshold(0.50005, notEqual)).isFalse();
    }

    @Test
    void ordering_operators() {
      assertThat(evaluator.checkThreshold(5, MetricThresholds.of(ComparisonOperator.LESS_THAN, 5)))
          .isFalse();
      assertThat(
              evaluator.checkThreshold(5, MetricThresholds.of(ComparisonOperator.LESS_OR_EQUAL, 5)))
          .isTrue();
      assertThat(
              evaluator.checkThreshold(5, MetricThresholds.of(ComparisonOperator.GREATER_THAN, 5)))
          .isFalse();
    }

    @Test
    void operator_symbols_parse_with_default() {
      assertThat(ComparisonOperator.fromSymbol(null))
          .isEqualTo(ComparisonOperator.GREATER_OR_EQUAL);
      assertThat(ComparisonOperator.fromSymbol(" <= ")).isEqualTo(ComparisonOperator.LESS_OR_EQUAL);
      assertThatThrownBy(() -> ComparisonOperator.fromSymbol("=>"))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  class Aggregate {

    @Test
    void median_of_four_values_is_interpolated() {
      CustomMetric metric =
          new CustomMetricBuilder()
              .aggregation(AggregationType.MEDIAN)
              .threshold(ComparisonOperator.GREATER_OR_EQUAL, 2.0)
              .build();

      MetricResult result = evaluator.aggregate(metric, values(metric, 1, 2, 3, 4));

      assertThat(result.value()).isCloseTo(2.5, within(TOLERANCE));
      assertThat(result.passed()).isTrue();
      assertThat(result.passRate()).isCloseTo(0.75, within(TOLERANCE));
      assertThat(result.sampleCount()).isEqualTo(4);
      assertThat(result.details()).isEmpty();
    }

    @Test
    void tail_percentiles_carry_distribution_details() {
      CustomMetric metric =
          new CustomMetricBuilder()
              .name("latency")
              .aggregation(AggregationType.P95)
              .threshold(ComparisonOperator.LESS_OR_EQUAL, 1000)
              .build();

      MetricResult result = evaluator.aggregate(metric, values(metric, 100, 200, 300, 2000));

      assertThat(result.details()).containsOnlyKeys("min", "max", "median", "avg");
      assertThat(result.details().get("max")).isEqualTo(2000.0);
      assertThat(result.passed()).isFalse();
    }

    @Test
    void empty_values_fail_with_zero() {
      CustomMetric metric = new CustomMetricBuilder().build();

      MetricResult result = evaluator.aggregate(metric, List.of());

      assertThat(result.value()).isZero();
      assertThat(result.passed()).isFalse();
      assertThat(result.passRate()).isZero();
      assertThat(result.sampleCount()).isZero();
    }

    @Test
    void aggregate_results_requires_a_loaded_metric() {
      CustomMetric metric = new CustomMetricBuilder().projectId(7L).build();
      when(customMetricRepository.findAllByProjectIdAndEnabledTrueOrderByNameAsc(7L))
          .thenReturn(List.of(metric));
      evaluator.loadMetrics(7L);

      assertThat(evaluator.aggregateResults(7L, metric.getId(), values(metric, 1, 2, 3)))
          .get()
          .extracting(MetricResult::value)
          .isEqualTo(2.0);
      assertThat(evaluator.aggregateResults(8L, metric.getId(), values(metric, 1))).isEmpty();
    }
  }

  @Nested
  class ProjectCache {

    @Test
    void projects_keep_separate_metric_sets() {
      CustomMetric first = new CustomMetricBuilder().projectId(1L).name("a").build();
      CustomMetric second = new CustomMetricBuilder().projectId(2L).name("b").build();
      when(customMetricRepository.findAllByProjectIdAndEnabledTrueOrderByNameAsc(1L))
          .thenReturn(List.of(first));
      when(customMetricRepository.findAllByProjectIdAndEnabledTrueOrderByNameAsc(2L))
          .thenReturn(List.of(second));

      evaluator.loadMetrics(1L);
      evaluator.loadMetrics(2L);

      assertThat(evaluator.getLoadedMetrics(1L)).containsExactly(first);
      assertThat(evaluator.getLoadedMetrics(2L)).containsExactly(second);
      assertThat(evaluator.getLoadedMetrics(3L)).isEmpty();
    }

    @Test
    void reload_replaces_the_snapshot_and_evict_drops_it() {
      CustomMetric old = new CustomMetricBuilder().name("old").build();
      CustomMetric replacement = new CustomMetricBuilder().name("new").build();
      when(customMetricRepository.findAllByProjectIdAndEnabledTrueOrderByNameAsc(1L))
          .thenReturn(List.of(old))
          .thenReturn(List.of(replacement));

      evaluator.loadMetrics(1L);
      evaluator.loadMetrics(1L);

      assertThat(evaluator.getLoadedMetrics(1L)).containsExactly(replacement);
      evaluator.evict(1L);
      assertThat(evaluator.getLoadedMetrics(1L)).isEmpty();
    }

    @Test
    void loaded_formulas_are_compiled_once_per_snapshot() {
      FormulaEvaluator formulas = spy(new FormulaEvaluator());
      CustomMetricsEvaluator cached =
          new CustomMetricsEvaluator(
              customMetricRepository,
              metricResultRepository,
              formulas,
              Clock.fixed(NOW, ZoneOffset.UTC));
      CustomMetric doubled =
          new CustomMetricBuilder()
              .name("doubled")
              .type(MetricType.CUSTOM)
              .formula("a * 2")
              .build();
      when(customMetricRepository.findAllByProjectIdAndEnabledTrueOrderByNameAsc(1L))
          .thenReturn(List.of(doubled));

      cached.loadMetrics(1L);
      cached.evaluateMetric(doubled, Map.of("a", 1));
      cached.evaluateMetric(doubled, Map.of("a", 2));

      verify(formulas, times(1)).compile("a * 2");
    }

    @Test
    void edited_formula_is_not_served_from_a_stale_snapshot() {
      CustomMetric metric =
          new CustomMetricBuilder().name("scaled").type(MetricType.CUSTOM).formula("a * 2").build();
      when(customMetricRepository.findAllByProjectIdAndEnabledTrueOrderByNameAsc(1L))
          .thenReturn(List.of(metric));
      evaluator.loadMetrics(1L);

      metric.setFormula("a * 3");

      assertThat(evaluator.evaluateMetric(metric, Map.of("a", 2)).numericValue())
          .isCloseTo(6.0, within(TOLERANCE));
    }

    @Test
    void invalid_formula_in_storage_does_not_break_loading() {
      CustomMetric broken =
          new CustomMetricBuilder().name("broken").type(MetricType.CUSTOM).formula("a +").build();
      CustomMetric fine = new CustomMetricBuilder().name("fine").build();
      when(customMetricRepository.findAllByProjectIdAndEnabledTrueOrderByNameAsc(1L))
          .thenReturn(List.of(broken, fine));

      assertThat(evaluator.loadMetrics(1L)).containsExactly(broken, fine);
      assertThatThrownBy(() -> evaluator.evaluateMetric(broken, Map.of()))
          .isInstanceOf(FormulaException.class);
    }
  }

  @Nested
  class EvaluateSamples {

    @Test
    void persists_one_result_per_metric_and_weights_the_composite() {
      UUID evaluationId = UUID.randomUUID();
      CustomMetric accuracy = new CustomMetricBuilder().name("accuracy").weight(3.0).build();
      CustomMetric fluency = new CustomMetricBuilder().name("fluency").weight(1.0).build();
      CustomMetric ignored = new CustomMetricBuilder().name("ignored").weight(0.0).build();
      when(customMetricRepository.findAllByProjectIdAndEnabledTrueOrderByNameAsc(1L))
          .thenReturn(List.of(accuracy, fluency, ignored));
      when(metricResultRepository.findByEvaluationIdAndMetricId(any(), any()))
          .thenReturn(Optional.empty());

      CustomMetricsReport report =
          evaluator.evaluateSamples(
              1L,
              evaluationId,
              List.of(
                  Map.of("accuracy", 1.0, "fluency", 0.0, "ignored", 100),
                  Map.of("accuracy", 0.5, "fluency", 0.0, "ignored", 100)));

      assertThat(report.results()).hasSize(3);
      // (0.75 * 3 + 0.0 * 1) / 4
      assertThat(report.compositeScore()).isCloseTo(0.5625, within(TOLERANCE));
      verify(metricResultRepository, times(3)).save(resultCaptor.capture());
      assertThat(resultCaptor.getAllValues())
          .allSatisfy(row -> assertThat(row.getEvaluationId()).isEqualTo(evaluationId));
    }

    @Test
    void existing_results_are_updated_in_place() {
      UUID evaluationId = UUID.randomUUID();
      CustomMetric metric = new CustomMetricBuilder().name("accuracy").build();
      EvaluationMetricResult existing = new EvaluationMetricResult(evaluationId, metric.getId());
      when(customMetricRepository.findAllByProjectIdAndEnabledTrueOrderByNameAsc(1L))
          .thenReturn(List.of(metric));
      when(metricResultRepository.findByEvaluationIdAndMetricId(evaluationId, metric.getId()))
          .thenReturn(Optional.of(existing));

      evaluator.evaluateSamples(1L, evaluationId, List.of(Map.of("accuracy", 0.9)));

      verify(metricResultRepository).save(existing);
      assertThat(existing.getAggregatedValue()).isCloseTo(0.9, within(TOLERANCE));
      assertThat(existing.getSampleCount()).isEqualTo(1);
    }

    @Test
    void no_metrics_gives_empty_report() {
      when(customMetricRepository.findAllByProjectIdAndEnabledTrueOrderByNameAsc(5L))
          .thenReturn(List.of());

      CustomMetricsReport report =
          evaluator.evaluateSamples(5L, UUID.randomUUID(), List.of(Map.of("x", 1)));

      assertThat(report.results()).isEmpty();
      assertThat(report.compositeScore()).isZero();
      verify(metricResultRepository, never()).save(any());
    }
  }
}
