package dev.evalforge.evaluation;

import dev.evalforge.metrics.EvaluationMetrics;
import dev.evalforge.suggestion.OptimizationSuggestion;
import dev.evalforge.testcase.TestCase;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence boundary of the evaluation pipeline.
 *
 * <p>Every method either completes or throws; the orchestrator treats a thrown exception as a
 * failed run.
 */
public interface EvaluationStore {

  Evaluation createEvaluation(Evaluation evaluation);

  Optional<Evaluation> findEvaluation(UUID evaluationId);

  Evaluation updateEvaluation(Evaluation evaluation);

  /**
   * Atomically moves a pending evaluation to running.
   *
   * @return false if the evaluation was no longer pending
   */
  boolean markRunning(UUID evaluationId, Instant startedAt);

  List<Evaluation> listEvaluations(long projectId, ListOptions options);

  /**
   * Deletes an evaluation with its test cases, metrics, suggestions and custom metric results.
   *
   * @throws EvaluationNotFoundException if no such evaluation exists
   */
  void deleteEvaluation(UUID evaluationId);

  List<TestCase> saveTestCases(List<TestCase> testCases);

  List<TestCase> updateTestCases(List<TestCase> testCases);

  List<TestCase> findTestCases(UUID evaluationId);

  /** Inserts the metrics document or replaces the one already stored for the evaluation. */
  EvaluationMetrics saveMetrics(EvaluationMetrics metrics);

  Optional<EvaluationMetrics> findMetrics(UUID evaluationId);

  List<OptimizationSuggestion> saveSuggestions(List<OptimizationSuggestion> suggestions);

  List<OptimizationSuggestion> findSuggestions(UUID evaluationId);
}
