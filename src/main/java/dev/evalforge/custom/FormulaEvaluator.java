package dev.evalforge.custom;

import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.expression.AccessException;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.PropertyAccessor;
import org.springframework.expression.TypedValue;
import org.springframework.expression.spel.SpelParserConfiguration;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Component;

/**
 * Evaluates {@link MetricType#CUSTOM} metric formulas, written as SpEL expressions over the
 * sample's fields, e.g. {@code tp / (tp + fp)} or {@code usage.tokens / 1000}.
 *
 * <p>Formulas run in a read-only {@link SimpleEvaluationContext}: no type references, bean
 * references, constructors, method calls or assignments. Field reads go through {@link
 * SampleFieldAccessor}, so missing or non-numeric fields read as 0, booleans as 1/0 and numeric
 * strings as their value; dotted names walk nested maps. Division by zero and any non-finite
 * result yield 0.
 *
 * <p>Fields always read as doubles. Integer literals on their own follow SpEL integer arithmetic,
 * so {@code 7 / 2} is 3 while {@code 7.0 / 2} is 3.5.
 */
@Component
public class FormulaEvaluator {

  static final int MAX_FORMULA_LENGTH = 1_000;
  static final int MAX_NESTING_DEPTH = 32;

  private final ExpressionParser parser =
      new SpelExpressionParser(
          new SpelParserConfiguration(null, null, false, false, 0, MAX_FORMULA_LENGTH));

  private final EvaluationContext context =
      SimpleEvaluationContext.forPropertyAccessors(new SampleFieldAccessor()).build();

  /** A parsed formula bound to its source text. Safe to share across threads. */
  public final class CompiledFormula {

    private final String source;
    private final Expression expression;

    private CompiledFormula(String source, Expression expression) {
      this.source = source;
      this.expression = expression;
    }

    public String source() {
      return source;
    }

    /**
     * Evaluates against {@code sample}.
     *
     * @throws FormulaException if the formula uses an operation the context does not allow
     */
    public double evaluate(@Nullable Map<String, Object> sample) {
      Object value;
      try {
        value = expression.getValue(context, sample == null ? Map.of() : sample);
      } catch (ArithmeticException e) {
        return 0.0;
      } catch (EvaluationException e) {
        if (e.getCause() instanceof ArithmeticException) {
          return 0.0;
        }
        throw new FormulaException(e.getSimpleMessage(), e.getPosition(), e);
      }
      double result = toNumber(value);
      return Double.isFinite(result) ? result : 0.0;
    }
  }

  /**
   * Evaluates {@code formula} against {@code sample}. Parses the formula on every call; hold on
   * to {@link #compile} for repeated use.
   *
   * @throws FormulaException if the formula is malformed
   */
  public double evaluate(String formula, @Nullable Map<String, Object> sample) {
    return compile(formula).evaluate(sample);
  }

  /**
   * Parses {@code formula} and checks it against an empty sample.
   *
   * @throws FormulaException if the formula is blank, too long, too deeply nested, malformed, or
   *     uses an operation the context does not allow
   */
  public CompiledFormula compile(@Nullable String formula) {
    if (formula == null || formula.isBlank()) {
      throw new FormulaException("Formula is empty", 0);
    }
    if (formula.length() > MAX_FORMULA_LENGTH) {
      throw new FormulaException(
          "Formula is longer than " + MAX_FORMULA_LENGTH + " characters", MAX_FORMULA_LENGTH);
    }
    checkNesting(formula);
    Expression expression;
    try {
      expression = parser.parseExpression(formula);
    } catch (ParseException e) {
      throw new FormulaException(e.getSimpleMessage(), e.getPosition(), e);
    }
    CompiledFormula compiled = new CompiledFormula(formula, expression);
    compiled.evaluate(Map.of());
    return compiled;
  }

  // SpEL parses nested groups recursively.
  private static void checkNesting(String formula) {
    int depth = 0;
    for (int i = 0; i < formula.length(); i++) {
      char c = formula.charAt(i);
      if (c == '(' || c == '[' || c == '{') {
        depth++;
        if (depth > MAX_NESTING_DEPTH) {
          throw new FormulaException(
              "Formula nests deeper than " + MAX_NESTING_DEPTH + " levels", i);
        }
      } else if (c == ')' || c == ']' || c == '}') {
        depth--;
      }
    }
  }

  static double toNumber(@Nullable Object value) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof Boolean bool) {
      return bool ? 1.0 : 0.0;
    }
    if (value instanceof String text) {
      try {
        return Double.parseDouble(text.strip());
      } catch (NumberFormatException e) {
        return 0.0;
      }
    }
    return 0.0;
  }

  /**
   * Resolves formula identifiers. Nested maps are returned as-is so dotted names can walk them;
   * every other value, and any property of a non-map, reads as a double.
   */
  static final class SampleFieldAccessor implements PropertyAccessor {

    @Override
    public Class<?> @Nullable [] getSpecificTargetClasses() {
      return null;
    }

    @Override
    public boolean canRead(EvaluationContext context, @Nullable Object target, String name) {
      return true;
    }

    @Override
    public TypedValue read(EvaluationContext context, @Nullable Object target, String name) {
      if (!(target instanceof Map<?, ?> fields)) {
        return new TypedValue(0.0);
      }
      Object value = fields.get(name);
      if (value instanceof Map<?, ?>) {
        return new TypedValue(value);
      }
      return new TypedValue(toNumber(value));
    }

    @Override
    public boolean canWrite(EvaluationContext context, @Nullable Object target, String name) {
      return false;
    }

    @Override
    public void write(
        EvaluationContext context, @Nullable Object target, String name, @Nullable Object value)
        throws AccessException {
      throw new AccessException("Formula fields are read-only: " + name);
    }
  }
}
