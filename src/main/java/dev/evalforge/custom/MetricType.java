package dev.evalforge.custom;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** How a custom metric reads its raw value from a sample. */
public enum MetricType {
  NUMERIC("numeric"),
  BOOLEAN("boolean"),
  STRING("string"),
  PERCENTAGE("percentage"),
  SCORE("score"),
  /** Computed from an arithmetic formula over sample fields. */
  CUSTOM("custom");

  private final String wireName;

  MetricType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static MetricType fromWireName(String value) {
    for (MetricType type : values()) {
      if (type.wireName.equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown metric type: " + value);
  }
}
