package dev.evalforge.analysis;

import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Expected input format of a prompt.
 *
 * @param type text, json or structured
 * @param fields field definitions for structured input
 * @param required names of required fields
 * @param constraints validation constraints keyed by field
 */
public record InputSchema(
    @Nullable String type,
    Map<String, Object> fields,
    List<String> required,
    Map<String, Object> constraints) {

  public InputSchema {
    fields = fields == null ? Map.of() : Map.copyOf(fields);
    required = required == null ? List.of() : List.copyOf(required);
    constraints = constraints == null ? Map.of() : Map.copyOf(constraints);
  }

  public static InputSchema empty() {
    return new InputSchema(null, Map.of(), List.of(), Map.of());
  }
}
