package dev.evalforge.pipeline;

import dev.evalforge.analysis.ErrorAnalysis;
import dev.evalforge.metrics.EvaluationMetrics;
import dev.evalforge.suggestion.OptimizationSuggestion;
import java.util.List;

/** Drafts prompt improvements from an evaluation's metrics and error analysis. */
public interface PromptOptimizer {

  /**
   * @return new, unsaved suggestions; the caller assigns the evaluation id
   */
  List<OptimizationSuggestion> suggestImprovements(
      String promptText, EvaluationMetrics metrics, ErrorAnalysis errorAnalysis);
}
