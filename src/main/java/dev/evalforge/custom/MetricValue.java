package dev.evalforge.custom;

import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * One measurement of one custom metric against one sample.
 *
 * @param metricId the measured metric
 * @param sampleId identifier of the sample, if the sample carried one
 * @param rawValue the value as read from the sample (number, boolean or string)
 * @param numericValue the numeric representative used for thresholds and aggregation
 * @param passed whether {@code numericValue} met the metric's thresholds
 * @param timestamp when the measurement was taken
 */
public record MetricValue(
    @Nullable UUID metricId,
    @Nullable String sampleId,
    @Nullable Object rawValue,
    double numericValue,
    boolean passed,
    Instant timestamp) {}
