package dev.evalforge.pipeline;

import dev.evalforge.analysis.PromptAnalysis;
import dev.evalforge.testcase.TestCase;
import java.util.List;

/** Produces categorized test cases for an analyzed prompt. */
public interface TestCaseGenerator {

  /**
   * @return new, unsaved test cases; the caller assigns evaluation id and order
   */
  List<TestCase> generateTestCases(PromptAnalysis analysis, GeneratorOptions options);
}
