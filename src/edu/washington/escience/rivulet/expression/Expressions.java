package edu.washington.escience.rivulet.expression;

/**
 * Shorthand constructors for expression trees.
 */
public final class Expressions {

  /** Utility class cannot be instantiated. */
  private Expressions() {}

  /**
   * @param name the column name.
   * @return a reference to the named input column.
   */
  public static ExpressionOperator field(final String name) {
    return new VariableExpression(name);
  }

  /**
   * @param value the value.
   * @return an int constant.
   */
  public static ExpressionOperator literal(final int value) {
    return new ConstantExpression(value);
  }

  /**
   * @param value the value.
   * @return a long constant.
   */
  public static ExpressionOperator literal(final long value) {
    return new ConstantExpression(value);
  }

  /**
   * @param value the value.
   * @return a double constant.
   */
  public static ExpressionOperator literal(final double value) {
    return new ConstantExpression(value);
  }

  /**
   * @param value the value.
   * @return a boolean constant.
   */
  public static ExpressionOperator literal(final boolean value) {
    return new ConstantExpression(value);
  }

  /**
   * @param value the value.
   * @return a string constant.
   */
  public static ExpressionOperator literal(final String value) {
    return new ConstantExpression(value);
  }

  /**
   * @param left the left operand.
   * @param right the right operand.
   * @return {@code left == right}.
   */
  public static ExpressionOperator equal(final ExpressionOperator left, final ExpressionOperator right) {
    return new EqualsExpression(left, right);
  }

  /**
   * @param left the left operand.
   * @param right the right operand.
   * @return {@code left != right}.
   */
  public static ExpressionOperator notEqual(final ExpressionOperator left, final ExpressionOperator right) {
    return new NotEqualsExpression(left, right);
  }

  /**
   * @param left the left operand.
   * @param right the right operand.
   * @return {@code left > right}.
   */
  public static ExpressionOperator greater(final ExpressionOperator left, final ExpressionOperator right) {
    return new GreaterThanExpression(left, right);
  }

  /**
   * @param left the left operand.
   * @param right the right operand.
   * @return {@code left >= right}.
   */
  public static ExpressionOperator greaterEqual(final ExpressionOperator left, final ExpressionOperator right) {
    return new GreaterThanOrEqualsExpression(left, right);
  }

  /**
   * @param left the left operand.
   * @param right the right operand.
   * @return {@code left < right}.
   */
  public static ExpressionOperator less(final ExpressionOperator left, final ExpressionOperator right) {
    return new LessThanExpression(left, right);
  }

  /**
   * @param left the left operand.
   * @param right the right operand.
   * @return {@code left <= right}.
   */
  public static ExpressionOperator lessEqual(final ExpressionOperator left, final ExpressionOperator right) {
    return new LessThanOrEqualsExpression(left, right);
  }

  /**
   * @param left the left operand.
   * @param right the right operand.
   * @return {@code left + right}.
   */
  public static ExpressionOperator add(final ExpressionOperator left, final ExpressionOperator right) {
    return new PlusExpression(left, right);
  }

  /**
   * @param left the left operand.
   * @param right the right operand.
   * @return {@code left - right}.
   */
  public static ExpressionOperator subtract(final ExpressionOperator left, final ExpressionOperator right) {
    return new MinusExpression(left, right);
  }

  /**
   * @param left the left operand.
   * @param right the right operand.
   * @return {@code left * right}.
   */
  public static ExpressionOperator multiply(final ExpressionOperator left, final ExpressionOperator right) {
    return new TimesExpression(left, right);
  }

  /**
   * @param left the left operand.
   * @param right the right operand.
   * @return {@code left AND right}.
   */
  public static ExpressionOperator and(final ExpressionOperator left, final ExpressionOperator right) {
    return new AndExpression(left, right);
  }

  /**
   * @param left the left operand.
   * @param right the right operand.
   * @return {@code left OR right}.
   */
  public static ExpressionOperator or(final ExpressionOperator left, final ExpressionOperator right) {
    return new OrExpression(left, right);
  }

  /**
   * @param operand the operand.
   * @return {@code NOT operand}.
   */
  public static ExpressionOperator not(final ExpressionOperator operand) {
    return new NotExpression(operand);
  }
}
