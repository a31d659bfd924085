package dev.evalforge.analysis;

import java.util.Map;
import org.jspecify.annotations.Nullable;

/** A few-shot example: an input, the output it should produce, and an optional explanation. */
public record Example(
    Map<String, Object> input, Map<String, Object> output, @Nullable String explanation) {

  public Example {
    input = input == null ? Map.of() : Map.copyOf(input);
    output = output == null ? Map.of() : Map.copyOf(output);
  }
}
