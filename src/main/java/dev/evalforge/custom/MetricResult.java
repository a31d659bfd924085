package dev.evalforge.custom;

import java.util.Map;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Aggregation of many {@link MetricValue}s of one metric.
 *
 * @param metricId the aggregated metric
 * @param metricName its display name
 * @param value the aggregated value
 * @param passed threshold check applied to {@code value}, not to individual samples
 * @param passRate fraction of individual samples that passed
 * @param sampleCount number of aggregated samples
 * @param details min, max, median and avg of the same values, for p95/p99 only
 */
public record MetricResult(
    @Nullable UUID metricId,
    String metricName,
    double value,
    boolean passed,
    double passRate,
    int sampleCount,
    Map<String, Double> details) {

  public MetricResult {
    details = details == null ? Map.of() : Map.copyOf(details);
  }
}
