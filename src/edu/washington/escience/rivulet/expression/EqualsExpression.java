package edu.washington.escience.rivulet.expression;

/**
 * True if the two operands are equal.
 */
public class EqualsExpression extends ComparisonExpression {
  /***/
  private static final long serialVersionUID = 1L;

  /**
   * This is not really unused, it's used automagically by Jackson deserialization.
   */
  @SuppressWarnings("unused")
  private EqualsExpression() {}

  /**
   * @param left the left operand.
   * @param right the right operand.
   */
  public EqualsExpression(final ExpressionOperator left, final ExpressionOperator right) {
    super(left, right);
  }

  @Override
  protected String getFunctionName() {
    return "equal";
  }

  @Override
  protected boolean test(final int cmp) {
    return cmp == 0;
  }
}
