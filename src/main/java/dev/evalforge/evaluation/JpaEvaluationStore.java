package dev.evalforge.evaluation;

import dev.evalforge.metrics.EvaluationMetrics;
import dev.evalforge.metrics.EvaluationMetricsRepository;
import dev.evalforge.suggestion.OptimizationSuggestion;
import dev.evalforge.suggestion.OptimizationSuggestionRepository;
import dev.evalforge.testcase.TestCase;
import dev.evalforge.testcase.TestCaseRepository;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link EvaluationStore} backed by the Spring Data repositories of each artifact.
 *
 * <p>Custom metric results are removed by the {@code ON DELETE CASCADE} foreign key when their
 * evaluation is deleted.
 */
@Repository
@Transactional
public class JpaEvaluationStore implements EvaluationStore {

  private static final Logger log = LoggerFactory.getLogger(JpaEvaluationStore.class);

  private final EvaluationRepository evaluationRepository;
  private final TestCaseRepository testCaseRepository;
  private final EvaluationMetricsRepository metricsRepository;
  private final OptimizationSuggestionRepository suggestionRepository;

  public JpaEvaluationStore(
      EvaluationRepository evaluationRepository,
      TestCaseRepository testCaseRepository,
      EvaluationMetricsRepository metricsRepository,
      OptimizationSuggestionRepository suggestionRepository) {
    this.evaluationRepository = evaluationRepository;
    this.testCaseRepository = testCaseRepository;
    this.metricsRepository = metricsRepository;
    this.suggestionRepository = suggestionRepository;
  }

  @Override
  public Evaluation createEvaluation(Evaluation evaluation) {
    return evaluationRepository.save(evaluation);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Evaluation> findEvaluation(UUID evaluationId) {
    return evaluationRepository.findById(evaluationId);
  }

  @Override
  public Evaluation updateEvaluation(Evaluation evaluation) {
    return evaluationRepository.save(evaluation);
  }

  @Override
  public boolean markRunning(UUID evaluationId, Instant startedAt) {
    return evaluationRepository.markRunning(
            evaluationId, startedAt, EvaluationStatus.PENDING, EvaluationStatus.RUNNING)
        == 1;
  }

  @Override
  @Transactional(readOnly = true)
  public List<Evaluation> listEvaluations(long projectId, ListOptions options) {
    int limit = options.limit() == 0 ? Integer.MAX_VALUE : options.limit();
    String status = options.status() == null ? null : options.status().name();
    if (options.newestFirst()) {
      return evaluationRepository.findPageNewestFirst(projectId, status, limit, options.offset());
    }
    return evaluationRepository.findPageOldestFirst(projectId, status, limit, options.offset());
  }

  @Override
  public void deleteEvaluation(UUID evaluationId) {
    if (!evaluationRepository.existsById(evaluationId)) {
      throw new EvaluationNotFoundException(evaluationId);
    }
    suggestionRepository.deleteAllByEvaluationId(evaluationId);
    metricsRepository.deleteByEvaluationId(evaluationId);
    long testCases = testCaseRepository.countByEvaluationId(evaluationId);
    testCaseRepository.deleteAllByEvaluationId(evaluationId);
    evaluationRepository.deleteById(evaluationId);
    log.debug("Deleted evaluation {} with {} test cases", evaluationId, testCases);
  }

  @Override
  public List<TestCase> saveTestCases(List<TestCase> testCases) {
    return testCaseRepository.saveAll(testCases);
  }

  @Override
  public List<TestCase> updateTestCases(List<TestCase> testCases) {
    return testCaseRepository.saveAll(testCases);
  }

  @Override
  @Transactional(readOnly = true)
  public List<TestCase> findTestCases(UUID evaluationId) {
    return testCaseRepository.findAllByEvaluationIdOrderByOrdinalAsc(evaluationId);
  }

  @Override
  public EvaluationMetrics saveMetrics(EvaluationMetrics metrics) {
    Optional<EvaluationMetrics> existing =
        metricsRepository.findByEvaluationId(metrics.getEvaluationId());
    if (existing.isPresent() && existing.get() != metrics) {
      existing.get().replaceResults(metrics);
      return metricsRepository.save(existing.get());
    }
    return metricsRepository.save(metrics);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<EvaluationMetrics> findMetrics(UUID evaluationId) {
    return metricsRepository.findByEvaluationId(evaluationId);
  }

  @Override
  public List<OptimizationSuggestion> saveSuggestions(List<OptimizationSuggestion> suggestions) {
    return suggestionRepository.saveAll(suggestions);
  }

  @Override
  @Transactional(readOnly = true)
  public List<OptimizationSuggestion> findSuggestions(UUID evaluationId) {
    return suggestionRepository.findAllByEvaluationIdOrderByCreatedAtAsc(evaluationId);
  }
}
