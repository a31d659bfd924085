package dev.evalforge.evaluation;

import dev.evalforge.analysis.Example;
import dev.evalforge.pipeline.ExecutorOptions;
import dev.evalforge.pipeline.GeneratorOptions;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Per-evaluation settings, persisted with the evaluation.
 *
 * @param name display name
 * @param description free-form description
 * @param generatorOptions test case counts, {@code null} for the configured defaults
 * @param executorOptions execution limits, {@code null} for the configured defaults
 * @param examples few-shot examples handed to the prompt analyzer
 */
public record EvaluationOptions(
    @Nullable String name,
    @Nullable String description,
    @Nullable GeneratorOptions generatorOptions,
    @Nullable ExecutorOptions executorOptions,
    List<Example> examples) {

  public EvaluationOptions {
    examples = examples == null ? List.of() : List.copyOf(examples);
  }

  public static EvaluationOptions defaults() {
    return new EvaluationOptions(null, null, null, null, List.of());
  }

  public static EvaluationOptions named(String name, @Nullable String description) {
    return new EvaluationOptions(name, description, null, null, List.of());
  }
}
