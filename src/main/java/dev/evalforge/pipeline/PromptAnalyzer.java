package dev.evalforge.pipeline;

import dev.evalforge.analysis.Example;
import dev.evalforge.analysis.PromptAnalysis;
import java.util.List;

/**
 * Classifies a prompt's task type and infers its input/output schema.
 *
 * <p>Implementations must return a task type and, for classification prompts, a non-empty class
 * list. Calls may block on a model; they should stop promptly when the calling thread is
 * interrupted.
 */
public interface PromptAnalyzer {

  PromptAnalysis analyzePrompt(String promptText, List<Example> examples);
}
