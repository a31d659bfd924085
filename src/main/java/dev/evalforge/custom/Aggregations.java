package dev.evalforge.custom;

import java.util.Arrays;
import java.util.List;

/**
 * Summary statistics over metric values.
 *
 * <p>All methods return 0.0 for an empty input.
 */
public final class Aggregations {

  private Aggregations() {}

  /** Applies {@code type} to {@code values}; a null type means average. */
  public static double aggregate(List<Double> values, AggregationType type) {
    if (values.isEmpty()) {
      return 0.0;
    }
    if (type == null) {
      return average(values);
    }
    switch (type) {
      case SUM:
        return values.stream().mapToDouble(Double::doubleValue).sum();
      case MIN:
        return values.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
      case MAX:
        return values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
      case MEDIAN:
        return percentile(values, 50);
      case P95:
        return percentile(values, 95);
      case P99:
        return percentile(values, 99);
      case COUNT:
        return values.size();
      case AVERAGE:
      default:
        return average(values);
    }
  }

  public static double average(List<Double> values) {
    return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
  }

  /**
   * Percentile with linear interpolation between the two bracketing sorted values, at index
   * {@code p / 100 * (n - 1)}.
   *
   * @param p percentile in [0, 100]
   * @throws IllegalArgumentException if {@code p} is outside [0, 100]
   */
  public static double percentile(List<Double> values, double p) {
    if (p < 0 || p > 100) {
      throw new IllegalArgumentException("Percentile must be within [0, 100], got " + p);
    }
    if (values.isEmpty()) {
      return 0.0;
    }
    double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
    Arrays.sort(sorted);

    double index = (p / 100.0) * (sorted.length - 1);
    int lower = (int) Math.floor(index);
    int upper = (int) Math.ceil(index);
    if (lower == upper) {
      return sorted[lower];
    }
    double weight = index - lower;
    return sorted[lower] * (1 - weight) + sorted[upper] * weight;
  }
}
