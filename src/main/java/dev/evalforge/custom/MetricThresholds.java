package dev.evalforge.custom;

import org.jspecify.annotations.Nullable;

/**
 * Pass/fail thresholds for a custom metric.
 *
 * <p>Only {@code passValue} and {@code operator} decide pass or fail; the warning and fail values
 * are informational bands for consumers. A missing operator means {@code >=}.
 *
 * @param passValue value compared against with {@code operator}
 * @param warningValue optional warning band
 * @param failValue optional hard-fail band
 * @param operator comparison operator, defaults to {@link ComparisonOperator#GREATER_OR_EQUAL}
 */
public record MetricThresholds(
    double passValue,
    @Nullable Double warningValue,
    @Nullable Double failValue,
    ComparisonOperator operator) {

  public MetricThresholds {
    if (Double.isNaN(passValue) || Double.isInfinite(passValue)) {
      throw new IllegalArgumentException("passValue must be finite, got " + passValue);
    }
    if (operator == null) {
      operator = ComparisonOperator.GREATER_OR_EQUAL;
    }
  }

  public static MetricThresholds of(ComparisonOperator operator, double passValue) {
    return new MetricThresholds(passValue, null, null, operator);
  }

  /** Thresholds that pass every non-negative value. */
  public static MetricThresholds none() {
    return of(ComparisonOperator.GREATER_OR_EQUAL, 0.0);
  }

  public boolean passes(double value) {
    return operator.test(value, passValue);
  }
}
