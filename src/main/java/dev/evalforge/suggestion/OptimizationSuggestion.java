package dev.evalforge.suggestion;

import dev.evalforge.analysis.Example;
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

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jspecify.annotations.Nullable;

/**
 * A proposed prompt rewrite produced by the optimizer stage of an evaluation.
 *
 * <p>Maps to the {@code optimization_suggestions} table managed by Flyway migrations.
 *
 * @see OptimizationSuggestionRepository
 */
@Entity
@Table(name = "optimization_suggestions")
public class OptimizationSuggestion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "evaluation_id", nullable = false)
    private UUID evaluationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SuggestionType type;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "old_prompt", columnDefinition = "TEXT")
    private String oldPrompt;

    @Column(name = "new_prompt", columnDefinition = "TEXT")
    private String newPrompt;

    @Column(name = "expected_impact", nullable = false)
    private double expectedImpact;

    @Column(nullable = false)
    private double confidence;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SuggestionPriority priority = SuggestionPriority.MEDIUM;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SuggestionStatus status = SuggestionStatus.PENDING;

    @Column(columnDefinition = "TEXT")
    private String reasoning;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "JSONB")
    private List<Example> examples = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "JSONB")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(name = "applied_at")
    private Instant appliedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected OptimizationSuggestion() {
        // JPA requires no-arg constructor
    }

    /**
     * Creates a pending suggestion.
     *
     * @param type      which aspect of the prompt it improves
     * @param title     short summary
     * @param oldPrompt the prompt text being improved
     * @param newPrompt the proposed replacement
     */
    public OptimizationSuggestion(SuggestionType type, String title, String oldPrompt, String newPrompt) {
        this.type = type;
        this.title = title;
        this.oldPrompt = oldPrompt;
        this.newPrompt = newPrompt;
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

    public UUID getEvaluationId() {
        return evaluationId;
    }

    public void setEvaluationId(UUID evaluationId) {
        this.evaluationId = evaluationId;
    }

    public SuggestionType getType() {
        return type;
    }

    public String getTitle() {
        return title;
    }

    public @Nullable String getDescription() {
        return description;
    }

    public void setDescription(@Nullable String description) {
        this.description = description;
    }

    public String getOldPrompt() {
        return oldPrompt;
    }

    public String getNewPrompt() {
        return newPrompt;
    }

    public double getExpectedImpact() {
        return expectedImpact;
    }

    public void setExpectedImpact(double expectedImpact) {
        this.expectedImpact = expectedImpact;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public SuggestionPriority getPriority() {
        return priority;
    }

    public void setPriority(SuggestionPriority priority) {
        this.priority = priority;
    }

    public SuggestionStatus getStatus() {
        return status;
    }

    /**
     * Moves the suggestion to {@code status}, stamping {@code appliedAt} when it becomes
     * {@link SuggestionStatus#APPLIED}.
     */
    public void updateStatus(SuggestionStatus status, Instant now) {
        this.status = status;
        if (status == SuggestionStatus.APPLIED) {
            this.appliedAt = now;
        }
    }

    public @Nullable String getReasoning() {
        return reasoning;
    }

    public void setReasoning(@Nullable String reasoning) {
        this.reasoning = reasoning;
    }

    public List<Example> getExamples() {
        return examples;
    }

    public void setExamples(List<Example> examples) {
        this.examples = examples == null ? new ArrayList<>() : new ArrayList<>(examples);
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public @Nullable Instant getAppliedAt() {
        return appliedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
