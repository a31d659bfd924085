package dev.evalforge.custom;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Threshold comparison applied to a metric value. Equality operators tolerate a difference of up
 * to {@link #EQUALITY_TOLERANCE}.
 */
public enum ComparisonOperator {
  GREATER_THAN(">"),
  GREATER_OR_EQUAL(">="),
  LESS_THAN("<"),
  LESS_OR_EQUAL("<="),
  EQUAL("=="),
  NOT_EQUAL("!=");

  public static final double EQUALITY_TOLERANCE = 1e-4;

  private final String symbol;

  ComparisonOperator(String symbol) {
    this.symbol = symbol;
  }

  @JsonValue
  public String symbol() {
    return symbol;
  }

  /** Whether {@code value} satisfies this operator against {@code threshold}. */
  public boolean test(double value, double threshold) {
    switch (this) {
      case GREATER_THAN:
        return value > threshold;
      case LESS_THAN:
        return value < threshold;
      case LESS_OR_EQUAL:
        return value <= threshold;
      case EQUAL:
        return Math.abs(value - threshold) < EQUALITY_TOLERANCE;
      case NOT_EQUAL:
        return Math.abs(value - threshold) >= EQUALITY_TOLERANCE;
      case GREATER_OR_EQUAL:
      default:
        return value >= threshold;
    }
  }

  /**
   * Parses an operator symbol. A null or blank symbol means {@link #GREATER_OR_EQUAL}.
   *
   * @throws IllegalArgumentException for any other unknown symbol
   */
  @JsonCreator
  public static ComparisonOperator fromSymbol(String symbol) {
    if (symbol == null || symbol.isBlank()) {
      return GREATER_OR_EQUAL;
    }
    for (ComparisonOperator operator : values()) {
      if (operator.symbol.equals(symbol.strip())) {
        return operator;
      }
    }
    throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
  }
}
