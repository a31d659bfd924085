package dev.evalforge.evaluation;

import dev.evalforge.analysis.ErrorAnalysis;
import dev.evalforge.analysis.Example;
import dev.evalforge.analysis.PromptAnalysis;
import dev.evalforge.analysis.TaskType;
import dev.evalforge.metrics.EvaluationMetrics;
import dev.evalforge.metrics.MetricsCalculator;
import dev.evalforge.pipeline.ErrorAnalyzer;
import dev.evalforge.pipeline.ExecutorOptions;
import dev.evalforge.pipeline.GeneratorOptions;
import dev.evalforge.pipeline.PromptAnalyzer;
import dev.evalforge.pipeline.PromptOptimizer;
import dev.evalforge.pipeline.TestCaseGenerator;
import dev.evalforge.pipeline.TestExecutor;
import dev.evalforge.suggestion.OptimizationSuggestion;
import dev.evalforge.testcase.TestCase;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Drives an evaluation through its six stages: prompt analysis, test case generation, test
 * execution, metrics calculation, error analysis and optimization suggestions.
 *
 * <p>Pipeline stages:
 *
 * <ol>
 *   <li>Claim the evaluation (PENDING → RUNNING) with a conditional update, so concurrent callers
 *       cannot both run it
 *   <li>Call each collaborator on the stage executor with its configured timeout
 *   <li>Persist the evaluation after every stage; progress moves 20, 40, 60, 80, 90, then 100
 *   <li>Fail the run on any error in analysis, generation or metrics; substitute simulated
 *       results, heuristic error analysis or no suggestions for the degradable stages
 * </ol>
 *
 * <p>Background runs are tracked so they can be cancelled. Cancelling interrupts the run; it
 * stops at the next stage boundary or collaborator call and ends as FAILED with reason
 * {@code cancelled}.
 */
@Service
public class EvaluationOrchestrator {

  /** Bean name of the executor that runs collaborator calls under a timeout. */
  public static final String STAGE_EXECUTOR = "evaluationStageExecutor";

  /** Bean name of the executor that runs background evaluations. */
  public static final String RUN_EXECUTOR = "evaluationRunExecutor";

  private static final Logger log = LoggerFactory.getLogger(EvaluationOrchestrator.class);

  private final EvaluationStore store;
  private final MetricsCalculator metricsCalculator;
  private final PipelineCollaborators collaborators;
  private final SimulatedExecutionPolicy simulation;
  private final PipelineProperties properties;
  private final AsyncTaskExecutor stageExecutor;
  private final AsyncTaskExecutor runExecutor;
  private final Clock clock;
  private final Map<UUID, Future<?>> activeRuns = new ConcurrentHashMap<>();

  public EvaluationOrchestrator(
      EvaluationStore store,
      MetricsCalculator metricsCalculator,
      PipelineCollaborators collaborators,
      SimulatedExecutionPolicy simulation,
      PipelineProperties properties,
      @Qualifier(STAGE_EXECUTOR) AsyncTaskExecutor stageExecutor,
      @Qualifier(RUN_EXECUTOR) AsyncTaskExecutor runExecutor,
      Clock clock) {
    this.store = store;
    this.metricsCalculator = metricsCalculator;
    this.collaborators = collaborators;
    this.simulation = simulation;
    this.properties = properties;
    this.stageExecutor = stageExecutor;
    this.runExecutor = runExecutor;
    this.clock = clock;
  }

  /**
   * Creates a pending evaluation. Nothing runs until {@link #runEvaluation} or {@link
   * #runEvaluationAsync} is called.
   *
   * @throws IllegalArgumentException if the prompt is empty
   */
  public Evaluation createEvaluation(
      long projectId, String promptText, @Nullable EvaluationOptions options) {
    if (promptText == null || promptText.isBlank()) {
      throw new IllegalArgumentException("Prompt text must not be empty");
    }
    Evaluation evaluation =
        store.createEvaluation(
            new Evaluation(
                projectId, promptText, options == null ? EvaluationOptions.defaults() : options));
    log.info("Created evaluation {} for project {}", evaluation.getId(), projectId);
    return evaluation;
  }

  /**
   * Runs every stage of a pending evaluation on the calling thread.
   *
   * @return the completed evaluation with its artifacts
   * @throws EvaluationNotFoundException if the evaluation does not exist
   * @throws EvaluationStateException if the evaluation is not pending or another caller claimed it
   * @throws EvaluationFailedException if a mandatory stage failed; the failure is already persisted
   */
  public EvaluationDetails runEvaluation(UUID evaluationId) {
    Evaluation evaluation =
        store
            .findEvaluation(evaluationId)
            .orElseThrow(() -> new EvaluationNotFoundException(evaluationId));
    if (evaluation.getStatus() != EvaluationStatus.PENDING) {
      throw new EvaluationStateException(
          "Evaluation " + evaluationId + " is " + evaluation.getStatus().wireName()
              + ", only pending evaluations can be run");
    }
    Instant startedAt = clock.instant();
    if (!store.markRunning(evaluationId, startedAt)) {
      throw new EvaluationStateException(
          "Evaluation " + evaluationId + " was started by another caller");
    }
    evaluation.start(startedAt);
    log.info("Starting evaluation {} of project {}", evaluationId, evaluation.getProjectId());

    PipelineStage stage = PipelineStage.ANALYZE_PROMPT;
    try {
      PromptAnalysis analysis = analyzePrompt(evaluation);
      evaluation.setPromptAnalysis(analysis);
      finishStage(evaluation, stage);

      stage = PipelineStage.GENERATE_TEST_CASES;
      List<TestCase> testCases = generateTestCases(evaluation, analysis);
      store.saveTestCases(testCases);
      finishStage(evaluation, stage);

      stage = PipelineStage.EXECUTE_TEST_CASES;
      boolean simulated = executeTestCases(evaluation, testCases, analysis);
      store.updateTestCases(testCases);
      finishStage(evaluation, stage);

      stage = PipelineStage.CALCULATE_METRICS;
      EvaluationMetrics metrics = calculateMetrics(testCases, analysis);
      metrics.setEvaluationId(evaluationId);
      metrics.setSimulated(simulated);
      store.saveMetrics(metrics);
      finishStage(evaluation, stage);

      stage = PipelineStage.ANALYZE_ERRORS;
      ErrorAnalysis errorAnalysis = analyzeErrors(evaluationId, testCases, analysis);
      evaluation.setErrorAnalysis(errorAnalysis);
      finishStage(evaluation, stage);

      stage = PipelineStage.SUGGEST_IMPROVEMENTS;
      List<OptimizationSuggestion> suggestions =
          suggestImprovements(evaluation, metrics, errorAnalysis);
      store.saveSuggestions(suggestions);
      checkNotCancelled(stage);
      evaluation.complete(clock.instant());
      store.updateEvaluation(evaluation);

      log.info(
          "Evaluation {} completed: {} test cases, pass rate {}, overall score {}{}",
          evaluationId,
          testCases.size(),
          String.format("%.3f", metrics.getPassRate()),
          String.format("%.3f", metrics.getOverallScore()),
          simulated ? " (simulated)" : "");
      return new EvaluationDetails(evaluation, testCases, metrics, suggestions);
    } catch (StageException e) {
      throw failRun(evaluation, e.stage(), e.getMessage(), e);
    } catch (RuntimeException e) {
      throw failRun(evaluation, stage, "storage error: " + e.getMessage(), e);
    }
  }

  /**
   * Schedules a pending evaluation on the background executor and returns immediately. Failures
   * are logged and persisted, never thrown to the caller.
   *
   * @throws EvaluationNotFoundException if the evaluation does not exist
   * @throws EvaluationStateException if it is not pending or already scheduled
   */
  public void runEvaluationAsync(UUID evaluationId) {
    Evaluation evaluation =
        store
            .findEvaluation(evaluationId)
            .orElseThrow(() -> new EvaluationNotFoundException(evaluationId));
    if (evaluation.getStatus() != EvaluationStatus.PENDING) {
      throw new EvaluationStateException(
          "Evaluation " + evaluationId + " is " + evaluation.getStatus().wireName()
              + ", only pending evaluations can be run");
    }
    FutureTask<Void> run =
        new FutureTask<>(() -> runDetached(evaluationId), null) {
          @Override
          protected void done() {
            activeRuns.remove(evaluationId, this);
          }
        };
    if (activeRuns.putIfAbsent(evaluationId, run) != null) {
      throw new EvaluationStateException("Evaluation " + evaluationId + " is already scheduled");
    }
    try {
      runExecutor.execute(run);
    } catch (TaskRejectedException e) {
      activeRuns.remove(evaluationId, run);
      throw e;
    }
    log.info("Scheduled evaluation {} for background execution", evaluationId);
  }

  private void runDetached(UUID evaluationId) {
    try {
      runEvaluation(evaluationId);
    } catch (EvaluationFailedException e) {
      log.warn("Background evaluation {} failed: {}", evaluationId, e.getMessage());
    } catch (RuntimeException e) {
      log.error("Background evaluation {} aborted", evaluationId, e);
    }
  }

  /**
   * Cancels a background run. A run that has not started yet is dropped and the evaluation stays
   * pending; a running one is interrupted and ends as FAILED with reason {@code cancelled}.
   *
   * @throws EvaluationStateException if the evaluation has no scheduled or running background run
   */
  public void cancelEvaluation(UUID evaluationId) {
    Future<?> run = activeRuns.get(evaluationId);
    if (run == null) {
      throw new EvaluationStateException(
          "Evaluation " + evaluationId + " has no background run to cancel");
    }
    run.cancel(true);
    log.info("Cancellation requested for evaluation {}", evaluationId);
  }

  /** Whether a background run of the evaluation is scheduled or in progress. */
  public boolean isRunActive(UUID evaluationId) {
    return activeRuns.containsKey(evaluationId);
  }

  public EvaluationProgress getEvaluationStatus(UUID evaluationId) {
    Evaluation evaluation =
        store
            .findEvaluation(evaluationId)
            .orElseThrow(() -> new EvaluationNotFoundException(evaluationId));
    return new EvaluationProgress(
        evaluationId,
        evaluation.getStatus(),
        evaluation.getProgress(),
        evaluation.getFailureReason());
  }

  public EvaluationDetails getEvaluation(UUID evaluationId) {
    Evaluation evaluation =
        store
            .findEvaluation(evaluationId)
            .orElseThrow(() -> new EvaluationNotFoundException(evaluationId));
    return new EvaluationDetails(
        evaluation,
        store.findTestCases(evaluationId),
        store.findMetrics(evaluationId).orElse(null),
        store.findSuggestions(evaluationId));
  }

  public List<Evaluation> listEvaluations(long projectId, ListOptions options) {
    return store.listEvaluations(projectId, options);
  }

  /**
   * Deletes an evaluation and every artifact it produced.
   *
   * @throws EvaluationStateException if the evaluation is running or scheduled
   */
  public void deleteEvaluation(UUID evaluationId) {
    Evaluation evaluation =
        store
            .findEvaluation(evaluationId)
            .orElseThrow(() -> new EvaluationNotFoundException(evaluationId));
    if (evaluation.getStatus() == EvaluationStatus.RUNNING || isRunActive(evaluationId)) {
      throw new EvaluationStateException(
          "Evaluation " + evaluationId + " is running; cancel it before deleting");
    }
    store.deleteEvaluation(evaluationId);
    log.info("Deleted evaluation {}", evaluationId);
  }

  // -- stages --

  private PromptAnalysis analyzePrompt(Evaluation evaluation) throws StageException {
    PipelineStage stage = PipelineStage.ANALYZE_PROMPT;
    String promptText = evaluation.getPromptText();
    if (promptText == null || promptText.isBlank()) {
      throw new StageException(stage, "no prompt text to analyze", null);
    }
    PromptAnalyzer analyzer = collaborators.promptAnalyzer();
    if (analyzer == null) {
      throw new StageException(stage, "no prompt analyzer configured", null);
    }
    List<Example> examples = evaluation.getOptions().examples();
    PromptAnalysis analysis = invoke(stage, () -> analyzer.analyzePrompt(promptText, examples));
    if (analysis == null || analysis.taskType() == null) {
      throw new StageException(stage, "prompt analyzer returned no task type", null);
    }
    if (analysis.taskType() == TaskType.CLASSIFICATION && analysis.classes().isEmpty()) {
      throw new StageException(
          stage, "classification prompt analyzed without output classes", null);
    }
    log.debug(
        "Prompt of evaluation {} analyzed as {} (confidence {})",
        evaluation.getId(),
        analysis.taskType().wireName(),
        analysis.confidence());
    return analysis;
  }

  private List<TestCase> generateTestCases(Evaluation evaluation, PromptAnalysis analysis)
      throws StageException {
    PipelineStage stage = PipelineStage.GENERATE_TEST_CASES;
    TestCaseGenerator generator = collaborators.testCaseGenerator();
    if (generator == null) {
      throw new StageException(stage, "no test case generator configured", null);
    }
    GeneratorOptions options = evaluation.getOptions().generatorOptions();
    GeneratorOptions effective =
        options == null ? properties.defaultGeneratorOptions() : options;
    List<TestCase> generated =
        invoke(stage, () -> generator.generateTestCases(analysis, effective));
    if (generated == null || generated.isEmpty()) {
      throw new StageException(stage, "test case generator produced no test cases", null);
    }
    List<TestCase> testCases = new ArrayList<>(generated.size());
    for (TestCase testCase : generated) {
      if (testCase != null) {
        testCase.setEvaluationId(evaluation.getId());
        testCase.setOrdinal(testCases.size());
        testCases.add(testCase);
      }
    }
    log.debug("Generated {} test cases for evaluation {}", testCases.size(), evaluation.getId());
    return testCases;
  }

  /** Runs the test executor, or simulates results. Returns whether results were simulated. */
  private boolean executeTestCases(
      Evaluation evaluation, List<TestCase> testCases, PromptAnalysis analysis)
      throws StageException {
    PipelineStage stage = PipelineStage.EXECUTE_TEST_CASES;
    UUID evaluationId = evaluation.getId();
    TestExecutor executor = collaborators.testExecutor();
    if (executor == null) {
      log.warn(
          "No test executor configured, simulating {} test cases of evaluation {}",
          testCases.size(),
          evaluationId);
    } else {
      ExecutorOptions options = evaluation.getOptions().executorOptions();
      ExecutorOptions effective = options == null ? properties.defaultExecutorOptions() : options;
      String promptText = evaluation.getPromptText();
      List<TestCase> input = detachedCopies(testCases);
      try {
        List<TestCase> executed =
            invoke(stage, () -> executor.executeTestCases(input, promptText, effective));
        if (mergeResults(testCases, executed)) {
          return false;
        }
        log.warn(
            "Test executor returned {} results for {} test cases of evaluation {}, simulating",
            executed == null ? 0 : executed.size(),
            testCases.size(),
            evaluationId);
      } catch (StageException e) {
        if (e.isCancelled()) {
          throw e;
        }
        log.warn("{} for evaluation {}, simulating results", e.getMessage(), evaluationId);
      }
    }
    simulation.simulate(evaluationId, testCases, analysis);
    return true;
  }

  private boolean mergeResults(List<TestCase> targets, @Nullable List<TestCase> executed) {
    if (executed == null || executed.isEmpty() || executed.size() != targets.size()) {
      return false;
    }
    for (TestCase source : executed) {
      if (source == null) {
        return false;
      }
    }
    for (int i = 0; i < targets.size(); i++) {
      TestCase target = targets.get(i);
      TestCase source = executed.get(i);
      target.recordResult(
          source.getActualOutput(),
          source.getStatus(),
          source.getScore(),
          source.getExecutedAt() == null ? clock.instant() : source.getExecutedAt());
      target.setExecutionTimeMs(source.getExecutionTimeMs());
      target.setErrorMessage(source.getErrorMessage());
    }
    return true;
  }

  /** Collaborators only ever see copies; a call abandoned after a timeout cannot touch the run. */
  private static List<TestCase> detachedCopies(List<TestCase> testCases) {
    List<TestCase> copies = new ArrayList<>(testCases.size());
    for (TestCase testCase : testCases) {
      copies.add(testCase.detachedCopy());
    }
    return copies;
  }

  private EvaluationMetrics calculateMetrics(List<TestCase> testCases, PromptAnalysis analysis)
      throws StageException {
    PipelineStage stage = PipelineStage.CALCULATE_METRICS;
    checkNotCancelled(stage);
    try {
      return metricsCalculator.calculateMetrics(testCases, analysis);
    } catch (RuntimeException e) {
      throw new StageException(stage, stage.description() + " failed: " + e.getMessage(), e);
    }
  }

  private ErrorAnalysis analyzeErrors(
      UUID evaluationId, List<TestCase> testCases, PromptAnalysis analysis)
      throws StageException {
    ErrorAnalyzer analyzer = collaborators.errorAnalyzer();
    if (analyzer == null) {
      log.warn("No error analyzer configured, using heuristic analysis for {}", evaluationId);
    } else {
      List<TestCase> input = detachedCopies(testCases);
      try {
        ErrorAnalysis result =
            invoke(PipelineStage.ANALYZE_ERRORS, () -> analyzer.analyzeErrors(input, analysis));
        if (result != null) {
          return result;
        }
        log.warn(
            "Error analyzer returned nothing for evaluation {}, using heuristics", evaluationId);
      } catch (StageException e) {
        if (e.isCancelled()) {
          throw e;
        }
        log.warn("{} for evaluation {}, using heuristic analysis", e.getMessage(), evaluationId);
      }
    }
    return HeuristicErrorAnalysis.analyze(testCases, clock.instant());
  }

  private List<OptimizationSuggestion> suggestImprovements(
      Evaluation evaluation, EvaluationMetrics metrics, ErrorAnalysis errorAnalysis)
      throws StageException {
    UUID evaluationId = evaluation.getId();
    PromptOptimizer optimizer = collaborators.promptOptimizer();
    if (optimizer == null) {
      log.warn("No prompt optimizer configured, evaluation {} gets no suggestions", evaluationId);
      return List.of();
    }
    String promptText = evaluation.getPromptText();
    List<OptimizationSuggestion> suggestions;
    try {
      suggestions =
          invoke(
              PipelineStage.SUGGEST_IMPROVEMENTS,
              () -> optimizer.suggestImprovements(promptText, metrics, errorAnalysis));
    } catch (StageException e) {
      if (e.isCancelled()) {
        throw e;
      }
      log.warn(
          "{} for evaluation {}, continuing without suggestions", e.getMessage(), evaluationId);
      return List.of();
    }
    List<OptimizationSuggestion> result = new ArrayList<>();
    if (suggestions != null) {
      for (OptimizationSuggestion suggestion : suggestions) {
        if (suggestion != null) {
          suggestion.setEvaluationId(evaluationId);
          result.add(suggestion);
        }
      }
    }
    return result;
  }

  // -- plumbing --

  private <T> T invoke(PipelineStage stage, Callable<T> call) throws StageException {
    checkNotCancelled(stage);
    Duration timeout = properties.timeoutFor(stage);
    Future<T> future;
    try {
      future = stageExecutor.submit(call);
    } catch (TaskRejectedException e) {
      throw new StageException(
          stage, stage.description() + " could not be scheduled: " + e.getMessage(), e);
    }
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new StageException(
          stage, stage.description() + " timed out after " + timeout.toMillis() + "ms", e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw StageException.cancelled(stage, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      throw new StageException(
          stage, stage.description() + " failed: " + cause.getMessage(), cause);
    }
  }

  private static void checkNotCancelled(PipelineStage stage) throws StageException {
    if (Thread.currentThread().isInterrupted()) {
      throw StageException.cancelled(stage, null);
    }
  }

  private void finishStage(Evaluation evaluation, PipelineStage stage) throws StageException {
    evaluation.advanceTo(stage);
    store.updateEvaluation(evaluation);
    log.info(
        "Evaluation {} finished {} ({}%)",
        evaluation.getId(), stage.description(), (int) evaluation.getProgress());
    checkNotCancelled(stage);
  }

  /** Persists the failure and builds the exception to throw. Keeps the thread's interrupt flag. */
  private EvaluationFailedException failRun(
      Evaluation evaluation, PipelineStage stage, String reason, Throwable cause) {
    boolean interrupted = Thread.interrupted();
    try {
      if (evaluation.getStatus() == EvaluationStatus.RUNNING) {
        evaluation.fail(reason, clock.instant());
      }
      store.updateEvaluation(evaluation);
    } catch (RuntimeException persistError) {
      log.error(
          "Could not record failure of evaluation {}: {}",
          evaluation.getId(),
          persistError.getMessage());
      cause.addSuppressed(persistError);
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
    log.error(
        "Evaluation {} failed during {}: {}", evaluation.getId(), stage.description(), reason);
    return new EvaluationFailedException(evaluation.getId(), stage, reason, cause);
  }
}
