package dev.evalforge.metrics;

/** Thrown when metrics cannot be derived from a batch of test cases. */
public class MetricsCalculationException extends RuntimeException {

  public MetricsCalculationException(String message) {
    super(message);
  }
}
