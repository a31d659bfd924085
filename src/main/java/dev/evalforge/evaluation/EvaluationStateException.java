package dev.evalforge.evaluation;

/**
 * Thrown when an operation is not allowed in the evaluation's current status, such as running an
 * evaluation twice or cancelling one that is not running.
 */
public class EvaluationStateException extends RuntimeException {

  public EvaluationStateException(String message) {
    super(message);
  }
}
