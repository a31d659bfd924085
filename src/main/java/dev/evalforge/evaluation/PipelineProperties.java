package dev.evalforge.evaluation;

import dev.evalforge.pipeline.ExecutorOptions;
import dev.evalforge.pipeline.GeneratorOptions;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the evaluation pipeline.
 *
 * <p>Properties are bound from {@code evalforge.pipeline.*} in application.yml.
 *
 * <ul>
 *   <li>{@code normal-cases}, {@code edge-cases}, {@code adversarial-cases} - default number of
 *       generated test cases per category (15, 8, 5)
 *   <li>{@code max-concurrency}, {@code test-timeout-seconds}, {@code retry-count} - default
 *       executor limits (3, 30, 1)
 *   <li>{@code *-timeout} - upper bound for each collaborator call
 *   <li>{@code simulation-seed} - fixed seed for simulated execution; unset means random
 *   <li>{@code async-pool-size} - threads available to background evaluation runs (default 4)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "evalforge.pipeline")
public class PipelineProperties {

  private int normalCases = 15;
  private int edgeCases = 8;
  private int adversarialCases = 5;
  private int maxConcurrency = 3;
  private int testTimeoutSeconds = 30;
  private int retryCount = 1;
  private Duration analysisTimeout = Duration.ofSeconds(60);
  private Duration generationTimeout = Duration.ofSeconds(120);
  private Duration executionTimeout = Duration.ofMinutes(10);
  private Duration errorAnalysisTimeout = Duration.ofSeconds(60);
  private Duration optimizationTimeout = Duration.ofSeconds(120);
  private Long simulationSeed;
  private int asyncPoolSize = 4;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (normalCases < 0 || edgeCases < 0 || adversarialCases < 0) {
      throw new IllegalStateException(
          "evalforge.pipeline test case counts must be >= 0, got: "
              + normalCases + "/" + edgeCases + "/" + adversarialCases);
    }
    if (normalCases + edgeCases + adversarialCases == 0) {
      throw new IllegalStateException("evalforge.pipeline must generate at least one test case");
    }
    if (maxConcurrency < 1) {
      throw new IllegalStateException(
          "evalforge.pipeline.max-concurrency must be >= 1, got: " + maxConcurrency);
    }
    if (testTimeoutSeconds < 1) {
      throw new IllegalStateException(
          "evalforge.pipeline.test-timeout-seconds must be >= 1, got: " + testTimeoutSeconds);
    }
    if (retryCount < 0) {
      throw new IllegalStateException(
          "evalforge.pipeline.retry-count must be >= 0, got: " + retryCount);
    }
    requirePositive("analysis-timeout", analysisTimeout);
    requirePositive("generation-timeout", generationTimeout);
    requirePositive("execution-timeout", executionTimeout);
    requirePositive("error-analysis-timeout", errorAnalysisTimeout);
    requirePositive("optimization-timeout", optimizationTimeout);
    if (asyncPoolSize < 1) {
      throw new IllegalStateException(
          "evalforge.pipeline.async-pool-size must be >= 1, got: " + asyncPoolSize);
    }
  }

  private static void requirePositive(String name, Duration value) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalStateException(
          "evalforge.pipeline." + name + " must be positive, got: " + value);
    }
  }

  public GeneratorOptions defaultGeneratorOptions() {
    return new GeneratorOptions(normalCases, edgeCases, adversarialCases);
  }

  public ExecutorOptions defaultExecutorOptions() {
    return new ExecutorOptions(maxConcurrency, testTimeoutSeconds, retryCount);
  }

  /** The call timeout of a stage's collaborator. Metrics are computed in-process. */
  public Duration timeoutFor(PipelineStage stage) {
    if (stage == PipelineStage.ANALYZE_PROMPT) {
      return analysisTimeout;
    }
    if (stage == PipelineStage.GENERATE_TEST_CASES) {
      return generationTimeout;
    }
    if (stage == PipelineStage.EXECUTE_TEST_CASES) {
      return executionTimeout;
    }
    if (stage == PipelineStage.ANALYZE_ERRORS) {
      return errorAnalysisTimeout;
    }
    if (stage == PipelineStage.SUGGEST_IMPROVEMENTS) {
      return optimizationTimeout;
    }
    throw new IllegalArgumentException("Stage " + stage + " has no collaborator timeout");
  }

  public int getNormalCases() {
    return normalCases;
  }

  public void setNormalCases(int normalCases) {
    this.normalCases = normalCases;
  }

  public int getEdgeCases() {
    return edgeCases;
  }

  public void setEdgeCases(int edgeCases) {
    this.edgeCases = edgeCases;
  }

  public int getAdversarialCases() {
    return adversarialCases;
  }

  public void setAdversarialCases(int adversarialCases) {
    this.adversarialCases = adversarialCases;
  }

  public int getMaxConcurrency() {
    return maxConcurrency;
  }

  public void setMaxConcurrency(int maxConcurrency) {
    this.maxConcurrency = maxConcurrency;
  }

  public int getTestTimeoutSeconds() {
    return testTimeoutSeconds;
  }

  public void setTestTimeoutSeconds(int testTimeoutSeconds) {
    this.testTimeoutSeconds = testTimeoutSeconds;
  }

  public int getRetryCount() {
    return retryCount;
  }

  public void setRetryCount(int retryCount) {
    this.retryCount = retryCount;
  }

  public Duration getAnalysisTimeout() {
    return analysisTimeout;
  }

  public void setAnalysisTimeout(Duration analysisTimeout) {
    this.analysisTimeout = analysisTimeout;
  }

  public Duration getGenerationTimeout() {
    return generationTimeout;
  }

  public void setGenerationTimeout(Duration generationTimeout) {
    this.generationTimeout = generationTimeout;
  }

  public Duration getExecutionTimeout() {
    return executionTimeout;
  }

  public void setExecutionTimeout(Duration executionTimeout) {
    this.executionTimeout = executionTimeout;
  }

  public Duration getErrorAnalysisTimeout() {
    return errorAnalysisTimeout;
  }

  public void setErrorAnalysisTimeout(Duration errorAnalysisTimeout) {
    this.errorAnalysisTimeout = errorAnalysisTimeout;
  }

  public Duration getOptimizationTimeout() {
    return optimizationTimeout;
  }

  public void setOptimizationTimeout(Duration optimizationTimeout) {
    this.optimizationTimeout = optimizationTimeout;
  }

  public Long getSimulationSeed() {
    return simulationSeed;
  }

  public void setSimulationSeed(Long simulationSeed) {
    this.simulationSeed = simulationSeed;
  }

  public int getAsyncPoolSize() {
    return asyncPoolSize;
  }

  public void setAsyncPoolSize(int asyncPoolSize) {
    this.asyncPoolSize = asyncPoolSize;
  }
}
