package edu.washington.escience.rivulet.expression;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.Type;

/**
 * Boolean and of two operands, with Kleene semantics: false wins over null.
 */
public class AndExpression extends BinaryExpression {
  /***/
  private static final long serialVersionUID = 1L;

  /**
   * This is not really unused, it's used automagically by Jackson deserialization.
   */
  @SuppressWarnings("unused")
  private AndExpression() {}

  /**
   * True if left and right are true.
   *
   * @param left the left operand.
   * @param right the right operand.
   */
  public AndExpression(final ExpressionOperator left, final ExpressionOperator right) {
    super(left, right);
  }

  @Override
  public Type getOutputType(final Schema schema) throws DbException {
    checkBooleanType(schema);
    return Type.BOOLEAN_TYPE;
  }

  @Override
  protected String getFunctionName() {
    return "and_kleene";
  }

  @Override
  protected Object applyNullable(final Type outputType, final Object l, final Object r) {
    if (Boolean.FALSE.equals(l) || Boolean.FALSE.equals(r)) {
      return Boolean.FALSE;
    }
    if (l == null || r == null) {
      return null;
    }
    return Boolean.TRUE;
  }

  @Override
  protected Object apply(final Type outputType, final Object l, final Object r) {
    return (Boolean) l && (Boolean) r;
  }
}
