package dev.evalforge.evaluation;

import dev.evalforge.analysis.ErrorAnalysis;
import dev.evalforge.analysis.PromptAnalysis;
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
import java.util.UUID;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jspecify.annotations.Nullable;

/**
 * One run of the evaluation pipeline against a prompt.
 *
 * <p>The lifecycle follows {@link EvaluationStatus}: PENDING → RUNNING → COMPLETED or FAILED.
 * Progress only moves forward and reaches 100 on completion. A failed evaluation keeps the
 * progress of the last stage it finished and records the reason.
 *
 * <p>Maps to the {@code evaluations} table managed by Flyway migrations.
 *
 * @see EvaluationRepository
 * @see EvaluationOrchestrator
 */
@Entity
@Table(name = "evaluations")
public class Evaluation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "project_id", nullable = false)
    private long projectId;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "prompt_text", nullable = false, columnDefinition = "TEXT")
    private String promptText;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EvaluationStatus status = EvaluationStatus.PENDING;

    @Column(nullable = false)
    private double progress;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "prompt_analysis", columnDefinition = "JSONB")
    private PromptAnalysis promptAnalysis;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "error_analysis", columnDefinition = "JSONB")
    private ErrorAnalysis errorAnalysis;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "JSONB")
    private EvaluationOptions options;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Evaluation() {
        // JPA requires no-arg constructor
    }

    /**
     * Creates a new evaluation in {@link EvaluationStatus#PENDING} state with zero progress and an
     * unanalyzed {@link PromptAnalysis} holding only the prompt text.
     *
     * @param projectId  the owning project
     * @param promptText the prompt under evaluation
     * @param options    per-run settings; name and description are taken from here
     */
    public Evaluation(long projectId, String promptText, EvaluationOptions options) {
        this.projectId = projectId;
        this.promptText = promptText;
        this.options = options;
        this.name = options.name() == null || options.name().isBlank()
                ? "Evaluation" : options.name();
        this.description = options.description();
        this.promptAnalysis = PromptAnalysis.unanalyzed(promptText);
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /** PENDING → RUNNING, progress reset to 0. */
    public void start(Instant now) {
        transitionTo(EvaluationStatus.RUNNING);
        this.progress = 0;
        this.startedAt = now;
    }

    /**
     * Records that {@code stage} finished. Progress never moves backwards.
     *
     * @throws EvaluationStateException if the evaluation is not running
     */
    public void advanceTo(PipelineStage stage) {
        if (status != EvaluationStatus.RUNNING) {
            throw new EvaluationStateException(
                    "Evaluation " + id + " is " + status.wireName()
                            + ", cannot advance to " + stage);
        }
        this.progress = Math.max(this.progress, stage.progress());
    }

    /** RUNNING → COMPLETED, progress set to 100. */
    public void complete(Instant now) {
        transitionTo(EvaluationStatus.COMPLETED);
        this.progress = 100;
        this.completedAt = now;
    }

    /** RUNNING → FAILED. Progress stays at the last finished stage. */
    public void fail(String reason, Instant now) {
        transitionTo(EvaluationStatus.FAILED);
        this.failureReason = reason;
        this.completedAt = now;
    }

    private void transitionTo(EvaluationStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new EvaluationStateException(
                    "Evaluation " + id + " cannot move from " + status.wireName()
                            + " to " + target.wireName());
        }
        this.status = target;
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

    public @Nullable String getDescription() {
        return description;
    }

    public String getPromptText() {
        return promptText;
    }

    public EvaluationStatus getStatus() {
        return status;
    }

    public double getProgress() {
        return progress;
    }

    public @Nullable PromptAnalysis getPromptAnalysis() {
        return promptAnalysis;
    }

    public void setPromptAnalysis(PromptAnalysis promptAnalysis) {
        this.promptAnalysis = promptAnalysis;
    }

    public @Nullable ErrorAnalysis getErrorAnalysis() {
        return errorAnalysis;
    }

    public void setErrorAnalysis(ErrorAnalysis errorAnalysis) {
        this.errorAnalysis = errorAnalysis;
    }

    public EvaluationOptions getOptions() {
        return options == null ? EvaluationOptions.defaults() : options;
    }

    public @Nullable String getFailureReason() {
        return failureReason;
    }

    public @Nullable Instant getStartedAt() {
        return startedAt;
    }

    public @Nullable Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
