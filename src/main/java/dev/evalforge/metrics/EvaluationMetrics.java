package dev.evalforge.metrics;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jspecify.annotations.Nullable;

/**
 * Aggregate result of one evaluation run.
 *
 * <p>Holds the weighted overall score, pass rate and counts, and at most one of
 * {@link ClassificationMetrics} or {@link GenerationMetrics} depending on the task type. The
 * free-form {@code customMetrics} map carries the generic and task-specific scalar metrics.
 *
 * <p>There is at most one row per evaluation ({@code evaluation_id} is unique); recalculation
 * overwrites the existing row through {@link #replaceResults(EvaluationMetrics)}.
 *
 * @see EvaluationMetricsRepository
 */
@Entity
@Table(name = "evaluation_metrics")
public class EvaluationMetrics {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "evaluation_id", nullable = false, unique = true)
    private UUID evaluationId;

    @Column(name = "overall_score", nullable = false)
    private double overallScore;

    @Column(name = "pass_rate", nullable = false)
    private double passRate;

    @Column(name = "test_cases_passed", nullable = false)
    private int testCasesPassed;

    @Column(name = "test_cases_total", nullable = false)
    private int testCasesTotal;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "classification_metrics", columnDefinition = "JSONB")
    private ClassificationMetrics classificationMetrics;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "generation_metrics", columnDefinition = "JSONB")
    private GenerationMetrics generationMetrics;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "custom_metrics", nullable = false, columnDefinition = "JSONB")
    private Map<String, Double> customMetrics = new LinkedHashMap<>();

    @Column(nullable = false)
    private boolean simulated;

    @Column(name = "calculated_at", nullable = false)
    private Instant calculatedAt;

    protected EvaluationMetrics() {
        // JPA requires no-arg constructor
    }

    public EvaluationMetrics(double overallScore, double passRate, int testCasesPassed,
                             int testCasesTotal, Instant calculatedAt) {
        this.overallScore = overallScore;
        this.passRate = passRate;
        this.testCasesPassed = testCasesPassed;
        this.testCasesTotal = testCasesTotal;
        this.calculatedAt = calculatedAt;
    }

    /**
     * Overwrites every computed field with those of {@code other}, keeping this row's identity
     * and evaluation id.
     */
    public void replaceResults(EvaluationMetrics other) {
        this.overallScore = other.overallScore;
        this.passRate = other.passRate;
        this.testCasesPassed = other.testCasesPassed;
        this.testCasesTotal = other.testCasesTotal;
        this.classificationMetrics = other.classificationMetrics;
        this.generationMetrics = other.generationMetrics;
        this.customMetrics = new LinkedHashMap<>(other.customMetrics);
        this.simulated = other.simulated;
        this.calculatedAt = other.calculatedAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getEvaluationId() {
        return evaluationId;
    }

    public void setEvaluationId(UUID evaluationId) {
        this.evaluationId = evaluationId;
    }

    public double getOverallScore() {
        return overallScore;
    }

    public double getPassRate() {
        return passRate;
    }

    public int getTestCasesPassed() {
        return testCasesPassed;
    }

    public int getTestCasesTotal() {
        return testCasesTotal;
    }

    public @Nullable ClassificationMetrics getClassificationMetrics() {
        return classificationMetrics;
    }

    public void setClassificationMetrics(@Nullable ClassificationMetrics classificationMetrics) {
        this.classificationMetrics = classificationMetrics;
    }

    public @Nullable GenerationMetrics getGenerationMetrics() {
        return generationMetrics;
    }

    public void setGenerationMetrics(@Nullable GenerationMetrics generationMetrics) {
        this.generationMetrics = generationMetrics;
    }

    public Map<String, Double> getCustomMetrics() {
        return customMetrics;
    }

    public void putCustomMetrics(Map<String, Double> values) {
        this.customMetrics.putAll(values);
    }

    public boolean isSimulated() {
        return simulated;
    }

    public void setSimulated(boolean simulated) {
        this.simulated = simulated;
    }

    public Instant getCalculatedAt() {
        return calculatedAt;
    }
}
