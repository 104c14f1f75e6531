package edu.washington.escience.rivulet.expression;

/**
 * True if the left operand is greater than the right one.
 */
public class GreaterThanExpression extends ComparisonExpression {
  /***/
  private static final long serialVersionUID = 1L;

  /**
   * This is not really unused, it's used automagically by Jackson deserialization.
   */
  @SuppressWarnings("unused")
  private GreaterThanExpression() {}

  /**
   * @param left the left operand.
   * @param right the right operand.
   */
  public GreaterThanExpression(final ExpressionOperator left, final ExpressionOperator right) {
    super(left, right);
  }

  @Override
  protected String getFunctionName() {
    return "greater";
  }

  @Override
  protected boolean test(final int cmp) {
    return cmp > 0;
  }
}
