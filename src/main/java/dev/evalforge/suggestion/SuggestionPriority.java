package dev.evalforge.suggestion;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SuggestionPriority {
  HIGH("high"),
  MEDIUM("medium"),
  LOW("low");

  private final String wireName;

  SuggestionPriority(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static SuggestionPriority fromWireName(String value) {
    for (SuggestionPriority priority : values()) {
      if (priority.wireName.equalsIgnoreCase(value)) {
        return priority;
      }
    }
    throw new IllegalArgumentException("Unknown suggestion priority: " + value);
  }
}
