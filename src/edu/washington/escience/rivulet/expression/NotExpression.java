package edu.washington.escience.rivulet.expression;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.Type;

/**
 * Negate (boolean not) the operand.
 */
public class NotExpression extends UnaryExpression {
  /***/
  private static final long serialVersionUID = 1L;

  /**
   * This is not really unused, it's used automagically by Jackson deserialization.
   */
  @SuppressWarnings("unused")
  private NotExpression() {}

  /**
   * Negate (boolean not) the operand.
   *
   * @param operand the operand.
   */
  public NotExpression(final ExpressionOperator operand) {
    super(operand);
  }

  @Override
  public Type getOutputType(final Schema schema) throws DbException {
    checkBooleanType(schema);
    return Type.BOOLEAN_TYPE;
  }

  @Override
  protected String getFunctionName() {
    return "invert";
  }

  @Override
  protected Object apply(final Object value) {
    return !(Boolean) value;
  }
}
