package dev.evalforge.metrics;

import dev.evalforge.analysis.PromptAnalysis;
import dev.evalforge.analysis.TaskType;
import dev.evalforge.testcase.TestCase;
import dev.evalforge.testcase.TestCaseCategory;
import dev.evalforge.testcase.TestCaseStatus;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Derives {@link EvaluationMetrics} from a batch of executed test cases.
 *
 * <p>Classification prompts get a confusion matrix with per-class precision, recall and F1;
 * generation and summarization prompts get BLEU/ROUGE-style overlap statistics (see {@link
 * TextStatistics}). Extraction, question answering and transformation prompts get category-based
 * pass-rate proxies, which approximate rather than measure the named quantity. Every result also
 * carries the generic custom metrics from {@link #calculateCustomMetrics(List)}.
 *
 * <p>Stateless apart from the clock; safe to call concurrently.
 */
@Service
public class MetricsCalculator {

  private static final Logger log = LoggerFactory.getLogger(MetricsCalculator.class);

  static final String OTHER_CLASS = "other";

  private final Clock clock;

  public MetricsCalculator(Clock clock) {
    this.clock = clock;
  }

  /**
   * Computes overall score, pass rate and task-specific metrics.
   *
   * @param testCases executed test cases of one evaluation
   * @param analysis the prompt analysis supplying task type and class labels
   * @return unsaved metrics; the caller assigns the evaluation id
   * @throws IllegalArgumentException if {@code testCases} is empty
   * @throws MetricsCalculationException if the task path finds nothing to score
   */
  public EvaluationMetrics calculateMetrics(List<TestCase> testCases, PromptAnalysis analysis) {
    if (testCases == null || testCases.isEmpty()) {
      throw new IllegalArgumentException("No test cases provided for metrics calculation");
    }

    int passed = 0;
    for (TestCase testCase : testCases) {
      if (testCase.isPassed()) {
        passed++;
      }
    }
    double passRate = (double) passed / testCases.size();

    EvaluationMetrics metrics =
        new EvaluationMetrics(
            weightedScore(testCases), passRate, passed, testCases.size(), clock.instant());

    TaskType taskType = analysis == null ? null : analysis.taskType();
    if (taskType == TaskType.CLASSIFICATION) {
      metrics.setClassificationMetrics(classificationFromTestCases(testCases, analysis.classes()));
    } else if (taskType == TaskType.GENERATION || taskType == TaskType.SUMMARIZATION) {
      metrics.setGenerationMetrics(generationFromTestCases(testCases));
    } else if (taskType != null) {
      metrics.putCustomMetrics(taskSpecificMetrics(testCases, taskType));
    }
    metrics.putCustomMetrics(calculateCustomMetrics(testCases));

    log.debug(
        "Calculated metrics for {} test cases (task={}, passRate={}, overallScore={})",
        testCases.size(),
        taskType,
        passRate,
        metrics.getOverallScore());
    return metrics;
  }

  /**
   * Builds a confusion matrix and per-class statistics from parallel label lists.
   *
   * <p>When {@code classes} is empty the class set is inferred from both lists and sorted.
   * Labels outside a supplied class set are counted under {@value #OTHER_CLASS}, which is then
   * part of the class set, so every pair lands in exactly one cell.
   *
   * @throws IllegalArgumentException if the lists differ in length or are empty
   */
  public ClassificationMetrics calculateClassificationMetrics(
      List<String> predictions, List<String> groundTruth, List<String> classes) {
    if (predictions.size() != groundTruth.size()) {
      throw new IllegalArgumentException("Predictions and ground truth must have same length");
    }
    if (predictions.isEmpty()) {
      throw new IllegalArgumentException("No predictions provided");
    }

    Set<String> classSet = new LinkedHashSet<>();
    if (classes == null || classes.isEmpty()) {
      TreeSet<String> inferred = new TreeSet<>(predictions);
      inferred.addAll(groundTruth);
      classSet.addAll(inferred);
    } else {
      classSet.addAll(classes);
    }

    List<String> truths = new ArrayList<>(groundTruth.size());
    List<String> preds = new ArrayList<>(predictions.size());
    for (int i = 0; i < predictions.size(); i++) {
      truths.add(classSet.contains(groundTruth.get(i)) ? groundTruth.get(i) : OTHER_CLASS);
      preds.add(classSet.contains(predictions.get(i)) ? predictions.get(i) : OTHER_CLASS);
    }
    if (truths.contains(OTHER_CLASS) || preds.contains(OTHER_CLASS)) {
      classSet.add(OTHER_CLASS);
    }

    Map<String, Map<String, Integer>> matrix = new LinkedHashMap<>();
    Map<String, Integer> support = new LinkedHashMap<>();
    for (String trueClass : classSet) {
      Map<String, Integer> row = new LinkedHashMap<>();
      for (String predictedClass : classSet) {
        row.put(predictedClass, 0);
      }
      matrix.put(trueClass, row);
      support.put(trueClass, 0);
    }

    int correct = 0;
    for (int i = 0; i < preds.size(); i++) {
      String truth = truths.get(i);
      String pred = preds.get(i);
      matrix.get(truth).merge(pred, 1, Integer::sum);
      support.merge(truth, 1, Integer::sum);
      if (truth.equals(pred)) {
        correct++;
      }
    }

    Map<String, Double> precision = new LinkedHashMap<>();
    Map<String, Double> recall = new LinkedHashMap<>();
    Map<String, Double> f1 = new LinkedHashMap<>();
    double f1Sum = 0.0;
    double weightedF1Sum = 0.0;
    int totalSupport = 0;

    for (String cls : classSet) {
      int tp = matrix.get(cls).get(cls);
      int fp = 0;
      int fn = 0;
      for (String other : classSet) {
        if (!other.equals(cls)) {
          fp += matrix.get(other).get(cls);
          fn += matrix.get(cls).get(other);
        }
      }

      double p = safeRatio(tp, tp + fp);
      double r = safeRatio(tp, tp + fn);
      double f = p + r > 0 ? 2 * p * r / (p + r) : 0.0;
      precision.put(cls, p);
      recall.put(cls, r);
      f1.put(cls, f);

      f1Sum += f;
      weightedF1Sum += f * support.get(cls);
      totalSupport += support.get(cls);
    }

    double macroF1 = classSet.isEmpty() ? 0.0 : f1Sum / classSet.size();
    double weightedF1 = totalSupport > 0 ? weightedF1Sum / totalSupport : 0.0;

    return new ClassificationMetrics(
        (double) correct / preds.size(),
        precision,
        recall,
        f1,
        macroF1,
        weightedF1,
        matrix,
        support);
  }

  /**
   * Averages the per-pair overlap statistics over all prediction/reference pairs.
   *
   * @throws IllegalArgumentException if the lists differ in length or are empty
   */
  public GenerationMetrics calculateGenerationMetrics(
      List<String> predictions, List<String> references) {
    if (predictions.size() != references.size()) {
      throw new IllegalArgumentException("Predictions and references must have same length");
    }
    if (predictions.isEmpty()) {
      throw new IllegalArgumentException("No predictions provided");
    }

    double bleu = 0.0;
    double rouge1 = 0.0;
    double rouge2 = 0.0;
    double rougeL = 0.0;
    double relevance = 0.0;
    double diversity = 0.0;
    double coherence = 0.0;
    for (int i = 0; i < predictions.size(); i++) {
      TextStatistics.PairScores scores =
          TextStatistics.score(predictions.get(i), references.get(i));
      bleu += scores.bleu();
      rouge1 += scores.rouge1();
      rouge2 += scores.rouge2();
      rougeL += scores.rougeL();
      relevance += scores.relevance();
      diversity += TextStatistics.lexicalDiversity(predictions.get(i));
      coherence += TextStatistics.coherence(predictions.get(i));
    }

    int n = predictions.size();
    double meanRouge1 = rouge1 / n;
    return new GenerationMetrics(
        bleu / n,
        meanRouge1,
        rouge2 / n,
        rougeL / n,
        meanRouge1,
        Math.max(1.0, 100.0 - meanRouge1 * 100.0),
        diversity / n,
        coherence / n,
        relevance / n);
  }

  /**
   * Generic scalar metrics available for every task type.
   *
   * <ul>
   *   <li>{@code error_rate}: failed or errored cases over all cases
   *   <li>{@code edge_case_performance} and {@code adversarial_performance}: category pass rates
   *   <li>{@code weighted_score}: weight-averaged score
   *   <li>{@code avg_execution_time_ms}: mean recorded execution time, 0 when none is recorded
   * </ul>
   */
  public Map<String, Double> calculateCustomMetrics(List<TestCase> testCases) {
    Map<String, Double> custom = new LinkedHashMap<>();
    custom.put("error_rate", errorRate(testCases));
    custom.put(
        "edge_case_performance", categoryPassRate(testCases, TestCaseCategory.EDGE_CASE));
    custom.put(
        "adversarial_performance", categoryPassRate(testCases, TestCaseCategory.ADVERSARIAL));
    custom.put("weighted_score", weightedScore(testCases));
    custom.put("avg_execution_time_ms", averageExecutionTime(testCases));
    return custom;
  }

  // --- Task paths ---

  private ClassificationMetrics classificationFromTestCases(
      List<TestCase> testCases, List<String> classes) {
    List<String> predictions = new ArrayList<>();
    List<String> groundTruth = new ArrayList<>();
    for (TestCase testCase : testCases) {
      if (testCase.getActualOutput() == null) {
        continue;
      }
      String predicted = OutputFields.extractClass(testCase.getActualOutput());
      String expected = OutputFields.extractClass(testCase.getExpectedOutput());
      if (!predicted.isEmpty() && !expected.isEmpty()) {
        predictions.add(predicted);
        groundTruth.add(expected);
      }
    }
    if (predictions.isEmpty()) {
      throw new MetricsCalculationException(
          "No valid classification pairs found in " + testCases.size() + " test cases");
    }
    return calculateClassificationMetrics(predictions, groundTruth, classes);
  }

  private GenerationMetrics generationFromTestCases(List<TestCase> testCases) {
    List<String> predictions = new ArrayList<>();
    List<String> references = new ArrayList<>();
    for (TestCase testCase : testCases) {
      if (testCase.getActualOutput() == null) {
        continue;
      }
      String predicted = OutputFields.extractText(testCase.getActualOutput());
      String reference = OutputFields.extractText(testCase.getExpectedOutput());
      if (!predicted.isEmpty() && !reference.isEmpty()) {
        predictions.add(predicted);
        references.add(reference);
      }
    }
    if (predictions.isEmpty()) {
      throw new MetricsCalculationException(
          "No valid generation pairs found in " + testCases.size() + " test cases");
    }
    return calculateGenerationMetrics(predictions, references);
  }

  /** Pass-rate proxies; no entity or answer matching is performed. */
  private Map<String, Double> taskSpecificMetrics(List<TestCase> testCases, TaskType taskType) {
    Map<String, Double> metrics = new LinkedHashMap<>();
    if (taskType == TaskType.EXTRACTION) {
      double precision = categoryPassRate(testCases, TestCaseCategory.NORMAL);
      double recall = categoryPassRate(testCases, TestCaseCategory.EDGE_CASE);
      metrics.put("extraction_precision", precision);
      metrics.put("extraction_recall", recall);
      metrics.put(
          "extraction_f1",
          precision + recall > 0 ? 2 * precision * recall / (precision + recall) : 0.0);
    } else if (taskType == TaskType.QUESTION_ANSWERING) {
      metrics.put("answer_accuracy", categoryPassRate(testCases, TestCaseCategory.NORMAL));
      metrics.put("answer_completeness", passRate(testCases));
    } else if (taskType == TaskType.TRANSFORMATION) {
      metrics.put("format_compliance", 1.0 - statusRatio(testCases, TestCaseStatus.ERROR));
      metrics.put("content_preservation", weightedScore(testCases));
    }
    // completion: generic metrics only
    return metrics;
  }

  // --- Helpers ---

  private static double weightedScore(List<TestCase> testCases) {
    double totalScore = 0.0;
    double totalWeight = 0.0;
    for (TestCase testCase : testCases) {
      totalScore += testCase.getScore() * testCase.getWeight();
      totalWeight += testCase.getWeight();
    }
    return totalWeight > 0 ? totalScore / totalWeight : 0.0;
  }

  private static double errorRate(List<TestCase> testCases) {
    long errors =
        testCases.stream()
            .filter(
                t ->
                    t.getStatus() == TestCaseStatus.ERROR || t.getStatus() == TestCaseStatus.FAILED)
            .count();
    return safeRatio(errors, testCases.size());
  }

  private static double passRate(List<TestCase> testCases) {
    return statusRatio(testCases, TestCaseStatus.PASSED);
  }

  private static double statusRatio(List<TestCase> testCases, TestCaseStatus status) {
    long matching = testCases.stream().filter(t -> t.getStatus() == status).count();
    return safeRatio(matching, testCases.size());
  }

  private static double categoryPassRate(List<TestCase> testCases, TestCaseCategory category) {
    int total = 0;
    int passed = 0;
    for (TestCase testCase : testCases) {
      if (testCase.getCategory() == category) {
        total++;
        if (testCase.isPassed()) {
          passed++;
        }
      }
    }
    return safeRatio(passed, total);
  }

  private static double averageExecutionTime(List<TestCase> testCases) {
    return testCases.stream()
        .map(TestCase::getExecutionTimeMs)
        .filter(Objects::nonNull)
        .mapToLong(Long::longValue)
        .average()
        .orElse(0.0);
  }

  private static double safeRatio(long numerator, long denominator) {
    return denominator == 0 ? 0.0 : (double) numerator / denominator;
  }
}
