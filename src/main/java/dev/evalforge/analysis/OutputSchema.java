package dev.evalforge.analysis;

import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Expected output format of a prompt.
 *
 * @param type text, json, classification or structured
 * @param format free-form format requirement
 * @param classes the output class labels, non-empty for classification prompts
 * @param fields field definitions for structured output
 * @param constraints validation constraints keyed by field
 */
public record OutputSchema(
    @Nullable String type,
    @Nullable String format,
    List<String> classes,
    Map<String, Object> fields,
    Map<String, Object> constraints) {

  public OutputSchema {
    classes = classes == null ? List.of() : List.copyOf(classes);
    fields = fields == null ? Map.of() : Map.copyOf(fields);
    constraints = constraints == null ? Map.of() : Map.copyOf(constraints);
  }

  public static OutputSchema empty() {
    return new OutputSchema(null, null, List.of(), Map.of(), Map.of());
  }

  /** Schema for a classification prompt with the given labels. */
  public static OutputSchema classification(List<String> classes) {
    return new OutputSchema("classification", null, classes, Map.of(), Map.of());
  }
}
