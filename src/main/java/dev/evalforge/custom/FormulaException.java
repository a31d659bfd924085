package dev.evalforge.custom;

/** Thrown when a custom-metric formula cannot be parsed or uses a disallowed operation. */
public class FormulaException extends RuntimeException {

  private final int position;

  public FormulaException(String message, int position) {
    super(message + " at position " + position);
    this.position = position;
  }

  public FormulaException(String message, int position, Throwable cause) {
    super(message + " at position " + position, cause);
    this.position = position;
  }

  /** Zero-based character offset where the formula failed, or -1 when unknown. */
  public int getPosition() {
    return position;
  }
}
