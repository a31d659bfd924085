package dev.evalforge.evaluation;

import dev.evalforge.pipeline.ErrorAnalyzer;
import dev.evalforge.pipeline.PromptAnalyzer;
import dev.evalforge.pipeline.PromptOptimizer;
import dev.evalforge.pipeline.TestCaseGenerator;
import dev.evalforge.pipeline.TestExecutor;
import org.jspecify.annotations.Nullable;

/**
 * The pluggable stage implementations available to the orchestrator. Any of them may be absent:
 * a missing analyzer or generator fails a run, the others fall back to built-in substitutes.
 */
public record PipelineCollaborators(
    @Nullable PromptAnalyzer promptAnalyzer,
    @Nullable TestCaseGenerator testCaseGenerator,
    @Nullable TestExecutor testExecutor,
    @Nullable ErrorAnalyzer errorAnalyzer,
    @Nullable PromptOptimizer promptOptimizer) {

  public static PipelineCollaborators none() {
    return new PipelineCollaborators(null, null, null, null, null);
  }
}
