package dev.evalforge.custom;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Persisted {@link MetricResult}: one row per (evaluation, metric), overwritten when the metric is
 * re-aggregated for the same evaluation.
 *
 * <p>Maps to the {@code metric_results} table managed by Flyway migrations.
 */
@Entity
@Table(name = "metric_results",
        uniqueConstraints = @UniqueConstraint(columnNames = {"evaluation_id", "metric_id"}))
public class EvaluationMetricResult {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "evaluation_id", nullable = false)
    private UUID evaluationId;

    @Column(name = "metric_id", nullable = false)
    private UUID metricId;

    @Column(name = "aggregated_value", nullable = false)
    private double aggregatedValue;

    @Column(nullable = false)
    private boolean passed;

    @Column(name = "pass_rate", nullable = false)
    private double passRate;

    @Column(name = "sample_count", nullable = false)
    private int sampleCount;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "JSONB")
    private Map<String, Double> details = new LinkedHashMap<>();

    @Column(name = "calculated_at", nullable = false)
    private Instant calculatedAt;

    protected EvaluationMetricResult() {
        // JPA requires no-arg constructor
    }

    public EvaluationMetricResult(UUID evaluationId, UUID metricId) {
        this.evaluationId = evaluationId;
        this.metricId = metricId;
    }

    /** Copies the aggregate values of {@code result} into this row. */
    public void apply(MetricResult result, Instant calculatedAt) {
        this.aggregatedValue = result.value();
        this.passed = result.passed();
        this.passRate = result.passRate();
        this.sampleCount = result.sampleCount();
        this.details = new LinkedHashMap<>(result.details());
        this.calculatedAt = calculatedAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getEvaluationId() {
        return evaluationId;
    }

    public UUID getMetricId() {
        return metricId;
    }

    public double getAggregatedValue() {
        return aggregatedValue;
    }

    public boolean isPassed() {
        return passed;
    }

    public double getPassRate() {
        return passRate;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public Map<String, Double> getDetails() {
        return details;
    }

    public Instant getCalculatedAt() {
        return calculatedAt;
    }
}
