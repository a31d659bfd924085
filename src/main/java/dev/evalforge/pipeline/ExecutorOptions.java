package dev.evalforge.pipeline;

/**
 * Limits for running test cases against a model.
 *
 * @param maxConcurrency maximum test cases in flight at once
 * @param timeoutSeconds wall-time bound per test case
 * @param retryCount retries per test case after the first attempt
 */
public record ExecutorOptions(int maxConcurrency, int timeoutSeconds, int retryCount) {

  public ExecutorOptions {
    if (maxConcurrency < 1) {
      throw new IllegalArgumentException("maxConcurrency must be >= 1, got " + maxConcurrency);
    }
    if (timeoutSeconds < 1) {
      throw new IllegalArgumentException("timeoutSeconds must be >= 1, got " + timeoutSeconds);
    }
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0, got " + retryCount);
    }
  }
}
