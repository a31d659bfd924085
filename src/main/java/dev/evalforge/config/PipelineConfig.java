package dev.evalforge.config;

import dev.evalforge.evaluation.EvaluationOrchestrator;
import dev.evalforge.evaluation.PipelineCollaborators;
import dev.evalforge.evaluation.PipelineProperties;
import dev.evalforge.evaluation.SimulatedExecutionPolicy;
import dev.evalforge.pipeline.ErrorAnalyzer;
import dev.evalforge.pipeline.PromptAnalyzer;
import dev.evalforge.pipeline.PromptOptimizer;
import dev.evalforge.pipeline.TestCaseGenerator;
import dev.evalforge.pipeline.TestExecutor;
import java.time.Clock;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the evaluation pipeline: the executors it runs on, the simulation fallback, and whichever
 * stage implementations are present in the context.
 *
 * <p>The stage executor runs collaborator calls so they can be abandoned on timeout. The run
 * executor runs background evaluations, at most {@code evalforge.pipeline.async-pool-size} at a
 * time. Both interrupt their threads on shutdown.
 */
@Configuration
public class PipelineConfig {

  private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

  @Bean(name = EvaluationOrchestrator.STAGE_EXECUTOR)
  public ThreadPoolTaskExecutor evaluationStageExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.getAsyncPoolSize());
    executor.setMaxPoolSize(properties.getAsyncPoolSize() * 4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("eval-stage-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }

  @Bean(name = EvaluationOrchestrator.RUN_EXECUTOR)
  public ThreadPoolTaskExecutor evaluationRunExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.getAsyncPoolSize());
    executor.setMaxPoolSize(properties.getAsyncPoolSize());
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("eval-run-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }

  @Bean
  public SimulatedExecutionPolicy simulatedExecutionPolicy(
      PipelineProperties properties, Clock clock) {
    return new SimulatedExecutionPolicy(properties.getSimulationSeed(), clock);
  }

  @Bean
  public PipelineCollaborators pipelineCollaborators(
      ObjectProvider<PromptAnalyzer> promptAnalyzer,
      ObjectProvider<TestCaseGenerator> testCaseGenerator,
      ObjectProvider<TestExecutor> testExecutor,
      ObjectProvider<ErrorAnalyzer> errorAnalyzer,
      ObjectProvider<PromptOptimizer> promptOptimizer) {
    PipelineCollaborators collaborators =
        new PipelineCollaborators(
            promptAnalyzer.getIfAvailable(),
            testCaseGenerator.getIfAvailable(),
            testExecutor.getIfAvailable(),
            errorAnalyzer.getIfAvailable(),
            promptOptimizer.getIfAvailable());
    log.info(
        "Pipeline collaborators: analyzer={}, generator={}, executor={}, errorAnalyzer={},"
            + " optimizer={}",
        describe(collaborators.promptAnalyzer()),
        describe(collaborators.testCaseGenerator()),
        describe(collaborators.testExecutor()),
        describe(collaborators.errorAnalyzer()),
        describe(collaborators.promptOptimizer()));
    return collaborators;
  }

  private static String describe(@Nullable Object collaborator) {
    return collaborator == null ? "none" : collaborator.getClass().getSimpleName();
  }
}
