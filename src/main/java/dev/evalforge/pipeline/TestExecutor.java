package dev.evalforge.pipeline;

import dev.evalforge.testcase.TestCase;
import java.util.List;

/**
 * Runs test cases against a prompt.
 *
 * <p>Each returned test case carries its actual output, status, score and execution time. The
 * usual implementation records results on the given instances and returns them.
 */
public interface TestExecutor {

  List<TestCase> executeTestCases(
      List<TestCase> testCases, String promptText, ExecutorOptions options);
}
