package dev.evalforge.metrics;

import java.util.List;
import java.util.Map;

/**
 * Pulls the class label or free text out of a test-case output document by probing well-known
 * field names in priority order.
 */
public final class OutputFields {

  public static final List<String> CLASS_FIELDS =
      List.of("class", "label", "sentiment", "category", "prediction", "result");

  public static final List<String> TEXT_FIELDS =
      List.of("text", "result", "output", "response", "summary", "answer", "generated");

  private OutputFields() {}

  /** The first present class field rendered as a string, or empty when none is present. */
  public static String extractClass(Map<String, Object> output) {
    return firstPresent(output, CLASS_FIELDS);
  }

  /** The first present text field rendered as a string, or empty when none is present. */
  public static String extractText(Map<String, Object> output) {
    return firstPresent(output, TEXT_FIELDS);
  }

  private static String firstPresent(Map<String, Object> output, List<String> fields) {
    if (output == null) {
      return "";
    }
    for (String field : fields) {
      Object value = output.get(field);
      if (value != null) {
        return String.valueOf(value);
      }
    }
    return "";
  }
}
