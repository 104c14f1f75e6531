package edu.washington.escience.rivulet.expression;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.Type;

/**
 * Boolean or of two operands, with Kleene semantics: true wins over null.
 */
public class OrExpression extends BinaryExpression {
  /***/
  private static final long serialVersionUID = 1L;

  /**
   * This is not really unused, it's used automagically by Jackson deserialization.
   */
  @SuppressWarnings("unused")
  private OrExpression() {}

  /**
   * True if left or right is true.
   *
   * @param left the left operand.
   * @param right the right operand.
   */
  public OrExpression(final ExpressionOperator left, final ExpressionOperator right) {
    super(left, right);
  }

  @Override
  public Type getOutputType(final Schema schema) throws DbException {
    checkBooleanType(schema);
    return Type.BOOLEAN_TYPE;
  }

  @Override
  protected String getFunctionName() {
    return "or_kleene";
  }

  @Override
  protected Object applyNullable(final Type outputType, final Object l, final Object r) {
    if (Boolean.TRUE.equals(l) || Boolean.TRUE.equals(r)) {
      return Boolean.TRUE;
    }
    if (l == null || r == null) {
      return null;
    }
    return Boolean.FALSE;
  }

  @Override
  protected Object apply(final Type outputType, final Object l, final Object r) {
    return (Boolean) l || (Boolean) r;
  }
}
