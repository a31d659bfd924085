package dev.evalforge.custom;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** How per-sample metric values are summarized into one number. */
public enum AggregationType {
  AVERAGE("average"),
  SUM("sum"),
  MIN("min"),
  MAX("max"),
  MEDIAN("median"),
  P95("p95"),
  P99("p99"),
  COUNT("count");

  private final String wireName;

  AggregationType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /** True for the tail percentiles that get a min/max/median/avg details bag. */
  public boolean isTailPercentile() {
    return this == P95 || this == P99;
  }

  @JsonCreator
  public static AggregationType fromWireName(String value) {
    for (AggregationType type : values()) {
      if (type.wireName.equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown aggregation: " + value);
  }
}
