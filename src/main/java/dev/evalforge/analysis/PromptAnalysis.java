package dev.evalforge.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Result of classifying a prompt: its task type, input/output schemas, constraints and examples.
 *
 * <p>An evaluation is created with an unanalyzed instance that carries only the raw prompt text
 * ({@link #unanalyzed(String)}); the analyzer stage replaces it with a populated one.
 *
 * @param promptText the raw prompt under evaluation
 * @param taskType the classified task type, {@code null} until analyzed
 * @param inputSchema expected input format
 * @param outputSchema expected output format (classes for classification tasks)
 * @param constraints rules the output should follow
 * @param examples few-shot examples found in or supplied with the prompt
 * @param confidence analyzer confidence in [0, 1]
 */
public record PromptAnalysis(
    String promptText,
    @Nullable TaskType taskType,
    InputSchema inputSchema,
    OutputSchema outputSchema,
    List<Constraint> constraints,
    List<Example> examples,
    double confidence) {

  public PromptAnalysis {
    promptText = promptText == null ? "" : promptText;
    inputSchema = inputSchema == null ? InputSchema.empty() : inputSchema;
    outputSchema = outputSchema == null ? OutputSchema.empty() : outputSchema;
    constraints = constraints == null ? List.of() : List.copyOf(constraints);
    examples = examples == null ? List.of() : List.copyOf(examples);
  }

  /** An analysis placeholder holding only the prompt text. */
  public static PromptAnalysis unanalyzed(String promptText) {
    return new PromptAnalysis(
        promptText, null, InputSchema.empty(), OutputSchema.empty(), List.of(), List.of(), 0.0);
  }

  /** Output class labels, empty for non-classification prompts. */
  @JsonIgnore
  public List<String> classes() {
    return outputSchema.classes();
  }

  @JsonIgnore
  public boolean isAnalyzed() {
    return taskType != null;
  }
}
