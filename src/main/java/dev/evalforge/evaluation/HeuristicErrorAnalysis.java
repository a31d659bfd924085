package dev.evalforge.evaluation;

import dev.evalforge.analysis.ErrorAnalysis;
import dev.evalforge.testcase.TestCase;
import dev.evalforge.testcase.TestCaseCategory;
import dev.evalforge.testcase.TestCaseStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Error analysis derived from test case outcomes alone. Used when no error analyzer is configured
 * or the configured one fails.
 */
public final class HeuristicErrorAnalysis {

  static final String ADVERSARIAL_FAILURE = "adversarial_failure";
  static final String EDGE_CASE_FAILURE = "edge_case_failure";
  static final String FORMAT_ERROR = "format_error";

  private HeuristicErrorAnalysis() {}

  /** Summarizes failures by category; ratios are fractions of all cases, 0 when there are none. */
  public static ErrorAnalysis analyze(List<TestCase> testCases, Instant createdAt) {
    int total = testCases.size();
    int failed = 0;
    int formatErrors = 0;
    int logicErrors = 0;
    Set<String> commonErrors = new LinkedHashSet<>();
    Map<String, Integer> patterns = new LinkedHashMap<>();

    for (TestCase testCase : testCases) {
      if (testCase.getStatus() == TestCaseStatus.FAILED) {
        failed++;
        if (testCase.getCategory() == TestCaseCategory.ADVERSARIAL) {
          logicErrors++;
          patterns.merge(ADVERSARIAL_FAILURE, 1, Integer::sum);
          commonErrors.add("Failed on adversarial input");
        } else if (testCase.getCategory() == TestCaseCategory.EDGE_CASE) {
          patterns.merge(EDGE_CASE_FAILURE, 1, Integer::sum);
          commonErrors.add("Failed on edge case");
        }
      } else if (testCase.getStatus() == TestCaseStatus.ERROR) {
        formatErrors++;
        patterns.merge(FORMAT_ERROR, 1, Integer::sum);
        commonErrors.add("Format or execution error");
      }
    }

    Map<String, Double> categories = new LinkedHashMap<>();
    categories.put("classification_errors", ratio(logicErrors, total));
    categories.put("format_errors", ratio(formatErrors, total));
    categories.put("edge_case_errors", ratio(failed, total));

    return new ErrorAnalysis(
        new ArrayList<>(commonErrors),
        patterns,
        ratio(failed, total),
        ratio(formatErrors, total),
        ratio(logicErrors, total),
        0.0,
        categories,
        createdAt);
  }

  private static double ratio(int count, int total) {
    return total == 0 ? 0.0 : (double) count / total;
  }
}
