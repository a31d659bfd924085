package dev.evalforge.evaluation;

import java.util.UUID;

/**
 * Thrown by a run that ended in {@link EvaluationStatus#FAILED}. The failed status and reason are
 * already persisted when this is thrown.
 */
public class EvaluationFailedException extends RuntimeException {

  private final UUID evaluationId;
  private final PipelineStage stage;

  public EvaluationFailedException(
      UUID evaluationId, PipelineStage stage, String reason, Throwable cause) {
    super("Evaluation " + evaluationId + " failed during " + stage.description() + ": " + reason,
        cause);
    this.evaluationId = evaluationId;
    this.stage = stage;
  }

  public UUID getEvaluationId() {
    return evaluationId;
  }

  /** The stage that was running when the evaluation failed. */
  public PipelineStage getStage() {
    return stage;
  }
}
