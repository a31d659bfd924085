package dev.evalforge.suggestion;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Which aspect of the prompt a suggestion improves. */
public enum SuggestionType {
  CLARITY("clarity"),
  SPECIFICITY("specificity"),
  EXAMPLES("examples"),
  FORMAT("format"),
  CONSTRAINTS("constraints");

  private final String wireName;

  SuggestionType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static SuggestionType fromWireName(String value) {
    for (SuggestionType type : values()) {
      if (type.wireName.equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown suggestion type: " + value);
  }
}
