package dev.evalforge.testcase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jspecify.annotations.Nullable;

/**
 * One generated input/expected-output pair belonging to an evaluation, plus its execution result.
 *
 * <p>Test cases are produced by the generator stage, persisted in generation order
 * ({@code ordinal}) and mutated once results arrive from the executor or the simulation fallback.
 * The score is always kept within [0, 1] and the weight is never negative.
 *
 * <p>Maps to the {@code test_cases} table managed by Flyway migrations.
 *
 * @see TestCaseRepository
 */
@Entity
@Table(name = "test_cases")
public class TestCase {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "evaluation_id", nullable = false)
    private UUID evaluationId;

    @Column(nullable = false)
    private int ordinal;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "JSONB")
    private Map<String, Object> input = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "expected_output", nullable = false, columnDefinition = "JSONB")
    private Map<String, Object> expectedOutput = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "actual_output", columnDefinition = "JSONB")
    private Map<String, Object> actualOutput;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TestCaseCategory category = TestCaseCategory.NORMAL;

    @Column(nullable = false)
    private double weight = 1.0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TestCaseStatus status = TestCaseStatus.PENDING;

    @Column(nullable = false)
    private double score;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(nullable = false)
    private boolean simulated;

    @Column(name = "executed_at")
    private Instant executedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected TestCase() {
        // JPA requires no-arg constructor
    }

    /**
     * Creates a pending test case with weight 1.0.
     *
     * @param name           short identifier, e.g. {@code normal_3}
     * @param category       which kind of input this case probes
     * @param input          the input handed to the prompt
     * @param expectedOutput the output the prompt should produce
     */
    public TestCase(String name, TestCaseCategory category,
                    Map<String, Object> input, Map<String, Object> expectedOutput) {
        this.name = name;
        this.category = category;
        this.input = input == null ? new LinkedHashMap<>() : new LinkedHashMap<>(input);
        this.expectedOutput = expectedOutput == null
                ? new LinkedHashMap<>() : new LinkedHashMap<>(expectedOutput);
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    /**
     * Records the outcome of executing this case. The score is clamped into [0, 1].
     *
     * @param actualOutput what the prompt produced
     * @param status       the execution outcome
     * @param score        quality score, clamped
     * @param executedAt   when the result was produced
     */
    public void recordResult(Map<String, Object> actualOutput, TestCaseStatus status,
                             double score, Instant executedAt) {
        this.actualOutput = actualOutput == null ? null : new LinkedHashMap<>(actualOutput);
        this.status = status;
        setScore(score);
        this.executedAt = executedAt;
    }

    /**
     * Returns an unmanaged copy carrying the same identity, inputs and current result. Writes to
     * the copy, or to its maps, never reach this instance.
     */
    public TestCase detachedCopy() {
        TestCase copy = new TestCase(name, category, input, expectedOutput);
        copy.id = id;
        copy.evaluationId = evaluationId;
        copy.ordinal = ordinal;
        copy.description = description;
        copy.weight = weight;
        copy.status = status;
        copy.score = score;
        copy.actualOutput = actualOutput == null ? null : new LinkedHashMap<>(actualOutput);
        copy.executionTimeMs = executionTimeMs;
        copy.errorMessage = errorMessage;
        copy.simulated = simulated;
        copy.executedAt = executedAt;
        copy.createdAt = createdAt;
        return copy;
    }

    /** True when the case executed and met its expectations. */
    public boolean isPassed() {
        return status == TestCaseStatus.PASSED;
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

    public int getOrdinal() {
        return ordinal;
    }

    public void setOrdinal(int ordinal) {
        this.ordinal = ordinal;
    }

    public String getName() {
        return name;
    }

    public @Nullable String getDescription() {
        return description;
    }

    public void setDescription(@Nullable String description) {
        this.description = description;
    }

    public Map<String, Object> getInput() {
        return input;
    }

    public Map<String, Object> getExpectedOutput() {
        return expectedOutput;
    }

    public @Nullable Map<String, Object> getActualOutput() {
        return actualOutput;
    }

    public TestCaseCategory getCategory() {
        return category;
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

    public TestCaseStatus getStatus() {
        return status;
    }

    public void setStatus(TestCaseStatus status) {
        this.status = status;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = Double.isNaN(score) ? 0.0 : Math.max(0.0, Math.min(1.0, score));
    }

    public @Nullable Long getExecutionTimeMs() {
        return executionTimeMs;
    }

    public void setExecutionTimeMs(@Nullable Long executionTimeMs) {
        this.executionTimeMs = executionTimeMs;
    }

    public @Nullable String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(@Nullable String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public boolean isSimulated() {
        return simulated;
    }

    public void setSimulated(boolean simulated) {
        this.simulated = simulated;
    }

    public @Nullable Instant getExecutedAt() {
        return executedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
