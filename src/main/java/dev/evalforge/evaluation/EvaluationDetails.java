package dev.evalforge.evaluation;

import dev.evalforge.metrics.EvaluationMetrics;
import dev.evalforge.suggestion.OptimizationSuggestion;
import dev.evalforge.testcase.TestCase;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * An evaluation with every artifact its pipeline produced so far.
 *
 * @param evaluation the evaluation record, including prompt and error analysis
 * @param testCases test cases in generation order
 * @param metrics the metrics document, {@code null} until the metrics stage succeeded
 * @param suggestions optimization suggestions, possibly empty
 */
public record EvaluationDetails(
    Evaluation evaluation,
    List<TestCase> testCases,
    @Nullable EvaluationMetrics metrics,
    List<OptimizationSuggestion> suggestions) {

  public EvaluationDetails {
    testCases = List.copyOf(testCases);
    suggestions = List.copyOf(suggestions);
  }

  public Optional<EvaluationMetrics> findMetrics() {
    return Optional.ofNullable(metrics);
  }
}
