package edu.washington.escience.rivulet.expression;

import com.google.common.math.IntMath;
import com.google.common.math.LongMath;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.StatusCode;
import edu.washington.escience.rivulet.Type;

/**
 * Multiply two operands in an expression tree. Integer overflow is an error.
 */
public class TimesExpression extends BinaryExpression {
  /***/
  private static final long serialVersionUID = 1L;

  /**
   * This is not really unused, it's used automagically by Jackson deserialization.
   */
  @SuppressWarnings("unused")
  private TimesExpression() {}

  /**
   * @param left the left operand.
   * @param right the right operand.
   */
  public TimesExpression(final ExpressionOperator left, final ExpressionOperator right) {
    super(left, right);
  }

  @Override
  public Type getOutputType(final Schema schema) throws DbException {
    return checkAndReturnDefaultNumericType(schema);
  }

  @Override
  protected String getFunctionName() {
    return "multiply";
  }

  @Override
  protected Object apply(final Type outputType, final Object l, final Object r) throws DbException {
    Number a = (Number) l;
    Number b = (Number) r;
    try {
      switch (outputType) {
        case INT_TYPE:
          return IntMath.checkedMultiply(a.intValue(), b.intValue());
        case LONG_TYPE:
          return LongMath.checkedMultiply(a.longValue(), b.longValue());
        default:
          return a.doubleValue() * b.doubleValue();
      }
    } catch (ArithmeticException e) {
      throw new DbException(StatusCode.EXECUTION_ERROR, "Overflow in " + this, e);
    }
  }
}
