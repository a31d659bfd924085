package dev.evalforge.evaluation;

import java.util.UUID;

/** Thrown when no evaluation exists with the requested id. */
public class EvaluationNotFoundException extends RuntimeException {

  private final UUID evaluationId;

  public EvaluationNotFoundException(UUID evaluationId) {
    super("Evaluation not found: " + evaluationId);
    this.evaluationId = evaluationId;
  }

  public UUID getEvaluationId() {
    return evaluationId;
  }
}
