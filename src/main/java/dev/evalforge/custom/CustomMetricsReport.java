package dev.evalforge.custom;

import java.util.List;
import java.util.UUID;

/**
 * All custom-metric results of one evaluation.
 *
 * @param projectId project whose metrics were evaluated
 * @param evaluationId the evaluation the samples belong to
 * @param results one aggregate per enabled metric
 * @param compositeScore weight-averaged aggregate value over metrics with a positive weight
 */
public record CustomMetricsReport(
    long projectId, UUID evaluationId, List<MetricResult> results, double compositeScore) {

  public CustomMetricsReport {
    results = List.copyOf(results);
  }

  /** True when every metric's aggregate met its thresholds. */
  public boolean allPassed() {
    return results.stream().allMatch(MetricResult::passed);
  }
}
