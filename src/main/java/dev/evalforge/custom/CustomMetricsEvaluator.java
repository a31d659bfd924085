package dev.evalforge.custom;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Scores samples against user-defined {@link CustomMetric}s and aggregates the results.
 *
 * <p>Enabled metric definitions are cached per project. Each {@link #loadMetrics(long)} call
 * replaces that project's snapshot wholesale with an immutable map, so concurrent loads for
 * different projects never see each other's metrics and readers never observe a half-built cache.
 * A snapshot also holds the compiled formulas and patterns of its metrics, keyed by metric id, so
 * they are dropped with it.
 *
 * <p>Per-sample evaluation and aggregation are pure; only {@link #evaluateSamples} writes to the
 * database.
 */
@Service
public class CustomMetricsEvaluator {

  private static final Logger log = LoggerFactory.getLogger(CustomMetricsEvaluator.class);

  private final CustomMetricRepository customMetricRepository;
  private final EvaluationMetricResultRepository metricResultRepository;
  private final FormulaEvaluator formulaEvaluator;
  private final Clock clock;

  private final ConcurrentHashMap<Long, ProjectMetrics> metricsByProject =
      new ConcurrentHashMap<>();

  private record ProjectMetrics(
      Map<UUID, CustomMetric> metrics,
      Map<UUID, FormulaEvaluator.CompiledFormula> formulas,
      Map<UUID, Pattern> patterns) {

    static final ProjectMetrics EMPTY = new ProjectMetrics(Map.of(), Map.of(), Map.of());
  }

  public CustomMetricsEvaluator(
      CustomMetricRepository customMetricRepository,
      EvaluationMetricResultRepository metricResultRepository,
      FormulaEvaluator formulaEvaluator,
      Clock clock) {
    this.customMetricRepository = customMetricRepository;
    this.metricResultRepository = metricResultRepository;
    this.formulaEvaluator = formulaEvaluator;
    this.clock = clock;
  }

  /**
   * Replaces the cached metric set of {@code projectId} with its currently enabled metrics.
   *
   * @return the loaded metrics, ordered by name
   */
  public List<CustomMetric> loadMetrics(long projectId) {
    List<CustomMetric> enabled =
        customMetricRepository.findAllByProjectIdAndEnabledTrueOrderByNameAsc(projectId);
    Map<UUID, CustomMetric> snapshot = new LinkedHashMap<>();
    Map<UUID, FormulaEvaluator.CompiledFormula> formulas = new HashMap<>();
    Map<UUID, Pattern> patterns = new HashMap<>();
    for (CustomMetric metric : enabled) {
      snapshot.put(metric.getId(), metric);
      String formula = metric.getFormula();
      if (metric.getType() == MetricType.CUSTOM) {
        try {
          formulas.put(metric.getId(), formulaEvaluator.compile(formula));
        } catch (FormulaException e) {
          log.warn("Custom metric '{}' has an invalid formula: {}", metric.getName(),
              e.getMessage());
        }
      } else if (metric.getType() == MetricType.STRING && formula != null && !formula.isEmpty()) {
        Optional<Pattern> pattern = compilePattern(formula);
        if (pattern.isPresent()) {
          patterns.put(metric.getId(), pattern.get());
        } else {
          log.warn("Ignoring invalid pattern '{}' of metric '{}'", formula, metric.getName());
        }
      }
    }
    metricsByProject.put(
        projectId,
        new ProjectMetrics(
            Collections.unmodifiableMap(snapshot),
            Collections.unmodifiableMap(formulas),
            Collections.unmodifiableMap(patterns)));
    log.info("Loaded {} custom metrics for project {}", snapshot.size(), projectId);
    return List.copyOf(snapshot.values());
  }

  /** Cached metrics of a project, empty if none were loaded. */
  public List<CustomMetric> getLoadedMetrics(long projectId) {
    return List.copyOf(loaded(projectId).metrics().values());
  }

  /** Drops the cached metric set of a project. */
  public void evict(long projectId) {
    metricsByProject.remove(projectId);
  }

  /**
   * Measures one metric against one sample.
   *
   * <p>The raw value is the sample field named after the metric. Numeric, percentage and score
   * metrics use numbers as-is; boolean metrics map to 1.0/0.0; string metrics score 1.0 when the
   * formula regex is found in the value, otherwise the value's length when the metric name
   * contains {@code length}, otherwise 0.0; custom metrics evaluate their formula. Anything
   * unreadable counts as 0.0.
   *
   * @throws IllegalArgumentException if {@code metric} is null
   * @throws FormulaException if a custom metric's formula is malformed
   */
  public MetricValue evaluateMetric(CustomMetric metric, @Nullable Map<String, Object> sample) {
    if (metric == null) {
      throw new IllegalArgumentException("metric must not be null");
    }
    Map<String, Object> fields = sample == null ? Map.of() : sample;

    Object rawValue;
    double numericValue;
    switch (metric.getType()) {
      case BOOLEAN:
        rawValue = fields.getOrDefault(metric.getName(), Boolean.FALSE);
        numericValue = Boolean.TRUE.equals(rawValue) ? 1.0 : 0.0;
        break;
      case STRING:
        rawValue = fields.getOrDefault(metric.getName(), "");
        numericValue = scoreString(rawValue, metric);
        break;
      case CUSTOM:
        numericValue = formulaFor(metric).evaluate(fields);
        rawValue = numericValue;
        break;
      case NUMERIC:
      case PERCENTAGE:
      case SCORE:
      default:
        rawValue = fields.getOrDefault(metric.getName(), 0.0);
        numericValue = rawValue instanceof Number number ? number.doubleValue() : 0.0;
        break;
    }
    if (!Double.isFinite(numericValue)) {
      numericValue = 0.0;
    }

    boolean passed = checkThreshold(numericValue, metric.getThresholds());
    return new MetricValue(
        metric.getId(), sampleId(fields), rawValue, numericValue, passed, clock.instant());
  }

  /**
   * Applies the thresholds' operator to {@code value}. Null thresholds pass any value {@code >=
   * 0}.
   */
  public boolean checkThreshold(double value, @Nullable MetricThresholds thresholds) {
    return (thresholds == null ? MetricThresholds.none() : thresholds).passes(value);
  }

  /**
   * Aggregates values of a metric cached for {@code projectId}.
   *
   * @return the aggregate, or empty when the metric is not in the project's cache
   */
  public Optional<MetricResult> aggregateResults(
      long projectId, UUID metricId, List<MetricValue> values) {
    CustomMetric metric = loaded(projectId).metrics().get(metricId);
    if (metric == null) {
      return Optional.empty();
    }
    return Optional.of(aggregate(metric, values));
  }

  /**
   * Aggregates values of {@code metric} with its configured aggregation.
   *
   * <p>The pass flag is the threshold check on the aggregate; the pass rate counts individual
   * values. An empty input yields value 0.0, pass rate 0.0 and {@code passed = false}.
   */
  public MetricResult aggregate(CustomMetric metric, List<MetricValue> values) {
    if (values == null || values.isEmpty()) {
      return new MetricResult(metric.getId(), metric.getName(), 0.0, false, 0.0, 0, Map.of());
    }

    List<Double> numbers = new ArrayList<>(values.size());
    int passCount = 0;
    for (MetricValue value : values) {
      numbers.add(value.numericValue());
      if (value.passed()) {
        passCount++;
      }
    }

    double aggregated = Aggregations.aggregate(numbers, metric.getAggregation());
    Map<String, Double> details = Map.of();
    if (metric.getAggregation().isTailPercentile()) {
      details = new LinkedHashMap<>();
      details.put("min", Aggregations.aggregate(numbers, AggregationType.MIN));
      details.put("max", Aggregations.aggregate(numbers, AggregationType.MAX));
      details.put("median", Aggregations.aggregate(numbers, AggregationType.MEDIAN));
      details.put("avg", Aggregations.aggregate(numbers, AggregationType.AVERAGE));
    }

    return new MetricResult(
        metric.getId(),
        metric.getName(),
        aggregated,
        checkThreshold(aggregated, metric.getThresholds()),
        (double) passCount / values.size(),
        values.size(),
        details);
  }

  /**
   * Evaluates every cached metric of a project over {@code samples}, persists one result per
   * metric for the evaluation and returns them with a weighted composite score.
   *
   * <p>Loads the project's metrics first if they are not cached yet.
   */
  @Transactional
  public CustomMetricsReport evaluateSamples(
      long projectId, UUID evaluationId, List<Map<String, Object>> samples) {
    if (!metricsByProject.containsKey(projectId)) {
      loadMetrics(projectId);
    }
    Map<UUID, CustomMetric> metrics = loaded(projectId).metrics();

    Instant now = clock.instant();
    List<MetricResult> results = new ArrayList<>(metrics.size());
    double weightedSum = 0.0;
    double totalWeight = 0.0;

    for (CustomMetric metric : metrics.values()) {
      List<MetricValue> values = new ArrayList<>(samples.size());
      for (Map<String, Object> sample : samples) {
        MetricValue value = evaluateMetric(metric, sample);
        log.debug(
            "Metric '{}' sample {}: raw={}, value={}, passed={}",
            metric.getName(),
            value.sampleId(),
            value.rawValue(),
            value.numericValue(),
            value.passed());
        values.add(value);
      }

      MetricResult result = aggregate(metric, values);
      results.add(result);
      persist(evaluationId, metric.getId(), result, now);

      if (metric.getWeight() > 0) {
        weightedSum += result.value() * metric.getWeight();
        totalWeight += metric.getWeight();
      }
    }

    double composite = totalWeight > 0 ? weightedSum / totalWeight : 0.0;
    log.info(
        "Evaluated {} custom metrics over {} samples for evaluation {} (composite={})",
        results.size(),
        samples.size(),
        evaluationId,
        composite);
    return new CustomMetricsReport(projectId, evaluationId, results, composite);
  }

  // --- Internal helpers ---

  private ProjectMetrics loaded(long projectId) {
    return metricsByProject.getOrDefault(projectId, ProjectMetrics.EMPTY);
  }

  /** The snapshot's compiled formula while it still matches the metric, otherwise a fresh one. */
  private FormulaEvaluator.CompiledFormula formulaFor(CustomMetric metric) {
    FormulaEvaluator.CompiledFormula cached =
        loaded(metric.getProjectId()).formulas().get(metric.getId());
    if (cached != null && cached.source().equals(metric.getFormula())) {
      return cached;
    }
    return formulaEvaluator.compile(metric.getFormula());
  }

  private Optional<Pattern> patternFor(CustomMetric metric, String regex) {
    Pattern cached = loaded(metric.getProjectId()).patterns().get(metric.getId());
    if (cached != null && cached.pattern().equals(regex)) {
      return Optional.of(cached);
    }
    return compilePattern(regex);
  }

  private void persist(UUID evaluationId, UUID metricId, MetricResult result, Instant now) {
    EvaluationMetricResult row =
        metricResultRepository
            .findByEvaluationIdAndMetricId(evaluationId, metricId)
            .orElseGet(() -> new EvaluationMetricResult(evaluationId, metricId));
    row.apply(result, now);
    metricResultRepository.save(row);
  }

  private double scoreString(Object rawValue, CustomMetric metric) {
    if (!(rawValue instanceof String text)) {
      return 0.0;
    }
    String formula = metric.getFormula();
    if (formula != null && !formula.isEmpty()) {
      Optional<Pattern> pattern = patternFor(metric, formula);
      if (pattern.isPresent() && pattern.get().matcher(text).find()) {
        return 1.0;
      }
    }
    if (metric.getName().contains("length")) {
      return text.length();
    }
    return 0.0;
  }

  private Optional<Pattern> compilePattern(String regex) {
    try {
      return Optional.of(Pattern.compile(regex));
    } catch (PatternSyntaxException e) {
      log.debug("Invalid metric pattern '{}': {}", regex, e.getDescription());
      return Optional.empty();
    }
  }

  private static @Nullable String sampleId(Map<String, Object> sample) {
    Object id = sample.get("sample_id");
    if (id == null) {
      id = sample.get("id");
    }
    return id == null ? null : String.valueOf(id);
  }
}
