package edu.washington.escience.rivulet.expression;

/**
 * True if the left operand is greater than or equal to the right one.
 */
public class GreaterThanOrEqualsExpression extends ComparisonExpression {
  /***/
  private static final long serialVersionUID = 1L;

  /**
   * This is not really unused, it's used automagically by Jackson deserialization.
   */
  @SuppressWarnings("unused")
  private GreaterThanOrEqualsExpression() {}

  /**
   * @param left the left operand.
   * @param right the right operand.
   */
  public GreaterThanOrEqualsExpression(final ExpressionOperator left, final ExpressionOperator right) {
    super(left, right);
  }

  @Override
  protected String getFunctionName() {
    return "greater_equal";
  }

  @Override
  protected boolean test(final int cmp) {
    return cmp >= 0;
  }
}
