package dev.evalforge.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** The category of NLP task a prompt performs, as classified by the prompt analyzer. */
public enum TaskType {
  CLASSIFICATION("classification"),
  GENERATION("generation"),
  EXTRACTION("extraction"),
  SUMMARIZATION("summarization"),
  QUESTION_ANSWERING("question_answering"),
  TRANSFORMATION("transformation"),
  COMPLETION("completion");

  private final String wireName;

  TaskType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /**
   * Parses a lowercase wire name such as {@code question_answering}.
   *
   * @throws IllegalArgumentException if the value names no known task type
   */
  @JsonCreator
  public static TaskType fromWireName(String value) {
    for (TaskType type : values()) {
      if (type.wireName.equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown task type: " + value);
  }
}
