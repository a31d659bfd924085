package dev.evalforge.evaluation;

import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** Status snapshot of an evaluation, progress in [0, 100]. */
public record EvaluationProgress(
    UUID evaluationId,
    EvaluationStatus status,
    double progress,
    @Nullable String failureReason) {}
