package dev.evalforge.pipeline;

/**
 * How many test cases of each category the generator should produce.
 *
 * @param normalCases representative inputs
 * @param edgeCases boundary inputs
 * @param adversarialCases inputs crafted to break the prompt
 */
public record GeneratorOptions(int normalCases, int edgeCases, int adversarialCases) {

  public GeneratorOptions {
    if (normalCases < 0 || edgeCases < 0 || adversarialCases < 0) {
      throw new IllegalArgumentException(
          "Test case counts must be >= 0, got "
              + normalCases
              + "/"
              + edgeCases
              + "/"
              + adversarialCases);
    }
  }

  public int total() {
    return normalCases + edgeCases + adversarialCases;
  }
}
