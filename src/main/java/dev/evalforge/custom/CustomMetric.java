package dev.evalforge.custom;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.UUID;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jspecify.annotations.Nullable;

/**
 * A user-defined metric scored per sample and aggregated per evaluation.
 *
 * <p>The metric reads its raw value from the sample field named after the metric
 * ({@link #getName()}), except for {@link MetricType#CUSTOM} metrics, which compute it from
 * {@link #getFormula()}. For {@link MetricType#STRING} metrics the formula, when present, is a
 * regular expression.
 *
 * <p>Names are unique within a project. Maps to the {@code custom_metrics} table managed by
 * Flyway migrations.
 *
 * @see CustomMetricRepository
 * @see CustomMetricsEvaluator
 */
@Entity
@Table(name = "custom_metrics",
        uniqueConstraints = @UniqueConstraint(columnNames = {"project_id", "name"}))
public class CustomMetric {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "project_id", nullable = false)
    private long projectId;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MetricType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AggregationType aggregation = AggregationType.AVERAGE;

    @Column(columnDefinition = "TEXT")
    private String formula;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "JSONB")
    private MetricThresholds thresholds = MetricThresholds.none();

    @Column(nullable = false)
    private double weight = 1.0;

    @Column(nullable = false)
    private boolean enabled = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected CustomMetric() {
        // JPA requires no-arg constructor
    }

    /**
     * Creates an enabled metric with weight 1.0.
     *
     * @param projectId   owning project
     * @param name        metric name, also the sample field it reads
     * @param type        how the raw value is read
     * @param aggregation how values are summarized, {@code null} for average
     * @param thresholds  pass/fail thresholds, {@code null} for "any value >= 0 passes"
     */
    public CustomMetric(long projectId, String name, MetricType type,
                        @Nullable AggregationType aggregation, @Nullable MetricThresholds thresholds) {
        this.projectId = projectId;
        this.name = name;
        this.type = type;
        this.aggregation = aggregation == null ? AggregationType.AVERAGE : aggregation;
        this.thresholds = thresholds == null ? MetricThresholds.none() : thresholds;
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public long getProjectId() {
        return projectId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public @Nullable String getDescription() {
        return description;
    }

    public void setDescription(@Nullable String description) {
        this.description = description;
    }

    public MetricType getType() {
        return type;
    }

    public void setType(MetricType type) {
        this.type = type;
    }

    public AggregationType getAggregation() {
        return aggregation;
    }

    public void setAggregation(AggregationType aggregation) {
        this.aggregation = aggregation == null ? AggregationType.AVERAGE : aggregation;
    }

    public @Nullable String getFormula() {
        return formula;
    }

    public void setFormula(@Nullable String formula) {
        this.formula = formula;
    }

    public MetricThresholds getThresholds() {
        return thresholds;
    }

    public void setThresholds(MetricThresholds thresholds) {
        this.thresholds = thresholds == null ? MetricThresholds.none() : thresholds;
    }

    public double getWeight() {
        return weight;
    }

    /**
     * @throws IllegalArgumentException if the weight is negative or not a number
     */
    public void setWeight(double weight) {
        if (Double.isNaN(weight) || weight < 0) {
            throw new IllegalArgumentException("weight must be >= 0, got " + weight);
        }
        this.weight = weight;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
