package dev.evalforge.evaluation;

/**
 * The six stages of an evaluation run, in execution order, with the progress reached when each
 * finishes.
 *
 * <p>A failure in a mandatory stage fails the run. A degradable stage falls back to a substitute
 * result and the run continues.
 */
public enum PipelineStage {
  ANALYZE_PROMPT(20, true, "prompt analysis"),
  GENERATE_TEST_CASES(40, true, "test case generation"),
  EXECUTE_TEST_CASES(60, false, "test execution"),
  CALCULATE_METRICS(80, true, "metrics calculation"),
  ANALYZE_ERRORS(90, false, "error analysis"),
  SUGGEST_IMPROVEMENTS(100, false, "optimization suggestions");

  private final double progress;
  private final boolean mandatory;
  private final String description;

  PipelineStage(double progress, boolean mandatory, String description) {
    this.progress = progress;
    this.mandatory = mandatory;
    this.description = description;
  }

  public double progress() {
    return progress;
  }

  public boolean isMandatory() {
    return mandatory;
  }

  public String description() {
    return description;
  }
}
