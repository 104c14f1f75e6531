package edu.washington.escience.rivulet.expression;

/**
 * True if the two operands differ.
 */
public class NotEqualsExpression extends ComparisonExpression {
  /***/
  private static final long serialVersionUID = 1L;

  /**
   * This is not really unused, it's used automagically by Jackson deserialization.
   */
  @SuppressWarnings("unused")
  private NotEqualsExpression() {}

  /**
   * @param left the left operand.
   * @param right the right operand.
   */
  public NotEqualsExpression(final ExpressionOperator left, final ExpressionOperator right) {
    super(left, right);
  }

  @Override
  protected String getFunctionName() {
    return "not_equal";
  }

  @Override
  protected boolean test(final int cmp) {
    return cmp != 0;
  }
}
