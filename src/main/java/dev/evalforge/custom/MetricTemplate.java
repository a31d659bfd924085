package dev.evalforge.custom;

import org.jspecify.annotations.Nullable;

/** Built-in metric definitions a project can instantiate as {@link CustomMetric}s. */
public enum MetricTemplate {
  RESPONSE_RELEVANCE(
      "Response Relevance",
      "Quality",
      "Measures how relevant the response is to the input query",
      MetricType.SCORE,
      AggregationType.AVERAGE,
      new MetricThresholds(0.7, 0.5, 0.3, ComparisonOperator.GREATER_OR_EQUAL)),
  TOKEN_EFFICIENCY(
      "Token Efficiency",
      "Performance",
      "Ratio of meaningful tokens to total tokens",
      MetricType.PERCENTAGE,
      AggregationType.AVERAGE,
      new MetricThresholds(0.8, 0.6, 0.4, ComparisonOperator.GREATER_OR_EQUAL)),
  HALLUCINATION_DETECTION(
      "Hallucination Detection",
      "Safety",
      "Detects factual inconsistencies in responses",
      MetricType.BOOLEAN,
      AggregationType.AVERAGE,
      MetricThresholds.of(ComparisonOperator.GREATER_OR_EQUAL, 0.95)),
  RESPONSE_TIME_SLA(
      "Response Time SLA",
      "Performance",
      "Checks if response time meets SLA requirements",
      MetricType.NUMERIC,
      AggregationType.P95,
      MetricThresholds.of(ComparisonOperator.LESS_OR_EQUAL, 1000)),
  SENTIMENT_CONSISTENCY(
      "Sentiment Consistency",
      "Quality",
      "Ensures consistent sentiment in responses",
      MetricType.SCORE,
      AggregationType.AVERAGE,
      MetricThresholds.of(ComparisonOperator.GREATER_OR_EQUAL, 0.85)),
  PII_DETECTION(
      "PII Detection",
      "Safety",
      "Detects personally identifiable information in outputs",
      MetricType.BOOLEAN,
      AggregationType.SUM,
      MetricThresholds.of(ComparisonOperator.EQUAL, 0)),
  CODE_SYNTAX_VALIDITY(
      "Code Syntax Validity",
      "Quality",
      "Validates generated code syntax",
      MetricType.BOOLEAN,
      AggregationType.AVERAGE,
      MetricThresholds.of(ComparisonOperator.EQUAL, 1.0)),
  CITATION_ACCURACY(
      "Citation Accuracy",
      "Quality",
      "Verifies accuracy of citations and references",
      MetricType.PERCENTAGE,
      AggregationType.AVERAGE,
      MetricThresholds.of(ComparisonOperator.GREATER_OR_EQUAL, 0.95));

  private final String displayName;
  private final String category;
  private final String description;
  private final MetricType type;
  private final AggregationType aggregation;
  private final MetricThresholds thresholds;

  MetricTemplate(
      String displayName,
      String category,
      String description,
      MetricType type,
      AggregationType aggregation,
      MetricThresholds thresholds) {
    this.displayName = displayName;
    this.category = category;
    this.description = description;
    this.type = type;
    this.aggregation = aggregation;
    this.thresholds = thresholds;
  }

  public String displayName() {
    return displayName;
  }

  public String category() {
    return category;
  }

  public String description() {
    return description;
  }

  public MetricType type() {
    return type;
  }

  public AggregationType aggregation() {
    return aggregation;
  }

  public MetricThresholds thresholds() {
    return thresholds;
  }

  /**
   * A new, unsaved metric for {@code projectId} with this template's definition, weight 1.0 and
   * enabled.
   *
   * @param name overrides the template's display name when not blank
   */
  public CustomMetric instantiate(long projectId, @Nullable String name) {
    String metricName = name == null || name.isBlank() ? displayName : name;
    CustomMetric metric = new CustomMetric(projectId, metricName, type, aggregation, thresholds);
    metric.setDescription(description);
    return metric;
  }
}
