package dev.evalforge.analysis;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Summary of failure patterns across the test cases of one evaluation.
 *
 * <p>Ratios ({@code ambiguousCases}, {@code formatErrors}, {@code logicErrors}, {@code
 * inconsistentCases} and the values of {@code errorCategories}) are fractions of the total number
 * of test cases, in [0, 1].
 *
 * @param commonErrors distinct human-readable error descriptions, most frequent first when known
 * @param errorPatterns occurrence count per error pattern key
 * @param ambiguousCases fraction of cases judged ambiguous
 * @param formatErrors fraction of cases with format or execution errors
 * @param logicErrors fraction of cases with logic errors
 * @param inconsistentCases fraction of cases answered inconsistently
 * @param errorCategories fraction per error category
 * @param createdAt when the analysis was produced
 */
public record ErrorAnalysis(
    List<String> commonErrors,
    Map<String, Integer> errorPatterns,
    double ambiguousCases,
    double formatErrors,
    double logicErrors,
    double inconsistentCases,
    Map<String, Double> errorCategories,
    @Nullable Instant createdAt) {

  public ErrorAnalysis {
    commonErrors = commonErrors == null ? List.of() : List.copyOf(commonErrors);
    errorPatterns = errorPatterns == null ? Map.of() : Map.copyOf(errorPatterns);
    errorCategories = errorCategories == null ? Map.of() : Map.copyOf(errorCategories);
  }
}
