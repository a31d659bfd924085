package dev.evalforge.custom;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Manages custom metric definitions and keeps {@link CustomMetricsEvaluator}'s per-project cache
 * in step with every change.
 */
@Service
public class CustomMetricService {

  private static final Logger log = LoggerFactory.getLogger(CustomMetricService.class);

  private final CustomMetricRepository customMetricRepository;
  private final EvaluationMetricResultRepository metricResultRepository;
  private final CustomMetricsEvaluator evaluator;
  private final FormulaEvaluator formulaEvaluator;

  public CustomMetricService(
      CustomMetricRepository customMetricRepository,
      EvaluationMetricResultRepository metricResultRepository,
      CustomMetricsEvaluator evaluator,
      FormulaEvaluator formulaEvaluator) {
    this.customMetricRepository = customMetricRepository;
    this.metricResultRepository = metricResultRepository;
    this.evaluator = evaluator;
    this.formulaEvaluator = formulaEvaluator;
  }

  public List<CustomMetric> listMetrics(long projectId) {
    return customMetricRepository.findAllByProjectIdOrderByNameAsc(projectId);
  }

  public Optional<CustomMetric> getMetric(UUID metricId) {
    return customMetricRepository.findById(metricId);
  }

  /**
   * Inserts or updates a metric definition and reloads the project's cached metrics.
   *
   * @throws IllegalArgumentException if the name is blank or already used by another metric of
   *     the project, a custom metric has no formula, or a formula does not parse
   */
  @Transactional
  public CustomMetric saveMetric(CustomMetric metric) {
    validate(metric);
    customMetricRepository
        .findByProjectIdAndName(metric.getProjectId(), metric.getName())
        .filter(existing -> !existing.getId().equals(metric.getId()))
        .ifPresent(
            existing -> {
              throw new IllegalArgumentException(
                  "Metric '"
                      + metric.getName()
                      + "' already exists in project "
                      + metric.getProjectId());
            });

    CustomMetric saved = customMetricRepository.save(metric);
    log.info(
        "Saved custom metric '{}' ({}) for project {}",
        saved.getName(),
        saved.getId(),
        saved.getProjectId());
    evaluator.loadMetrics(saved.getProjectId());
    return saved;
  }

  /**
   * Deletes a metric with its stored results and reloads the project's cached metrics.
   *
   * @throws IllegalArgumentException if no metric has this id
   */
  @Transactional
  public void deleteMetric(UUID metricId) {
    CustomMetric metric =
        customMetricRepository
            .findById(metricId)
            .orElseThrow(
                () -> new IllegalArgumentException("Custom metric not found: " + metricId));
    metricResultRepository.deleteAllByMetricId(metricId);
    customMetricRepository.delete(metric);
    log.info("Deleted custom metric '{}' from project {}", metric.getName(), metric.getProjectId());
    evaluator.loadMetrics(metric.getProjectId());
  }

  /**
   * Creates a metric from a built-in template.
   *
   * @param name optional override of the template's display name
   */
  @Transactional
  public CustomMetric createFromTemplate(
      long projectId, MetricTemplate template, @Nullable String name) {
    return saveMetric(template.instantiate(projectId, name));
  }

  private void validate(CustomMetric metric) {
    if (metric.getName() == null || metric.getName().isBlank()) {
      throw new IllegalArgumentException("Metric name must not be blank");
    }
    if (metric.getType() == null) {
      throw new IllegalArgumentException("Metric type is required");
    }
    String formula = metric.getFormula();
    if (metric.getType() == MetricType.CUSTOM) {
      try {
        formulaEvaluator.compile(formula);
      } catch (FormulaException e) {
        throw new IllegalArgumentException(
            "Invalid formula for metric '" + metric.getName() + "': " + e.getMessage(), e);
      }
    } else if (metric.getType() == MetricType.STRING && formula != null && !formula.isEmpty()) {
      try {
        Pattern.compile(formula);
      } catch (PatternSyntaxException e) {
        throw new IllegalArgumentException(
            "Invalid pattern for metric '" + metric.getName() + "': " + e.getDescription(), e);
      }
    }
  }
}
