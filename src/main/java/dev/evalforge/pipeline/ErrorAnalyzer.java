package dev.evalforge.pipeline;

import dev.evalforge.analysis.ErrorAnalysis;
import dev.evalforge.analysis.PromptAnalysis;
import dev.evalforge.testcase.TestCase;
import java.util.List;

/** Summarizes failure patterns across executed test cases. */
public interface ErrorAnalyzer {

  ErrorAnalysis analyzeErrors(List<TestCase> testCases, PromptAnalysis analysis);
}
