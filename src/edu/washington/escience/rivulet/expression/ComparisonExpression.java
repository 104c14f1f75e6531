package edu.washington.escience.rivulet.expression;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.Type;

/**
 * Comparison in expression tree. Numeric operands are compared after widening to double when either side is a
 * double, and to long otherwise; other operands must have the same type.
 */
public abstract class ComparisonExpression extends BinaryExpression {
  /***/
  private static final long serialVersionUID = 1L;

  /**
   * This is not really unused, it's used automagically by Jackson deserialization.
   */
  protected ComparisonExpression() {}

  /**
   * @param left the left operand.
   * @param right the right operand.
   */
  protected ComparisonExpression(final ExpressionOperator left, final ExpressionOperator right) {
    super(left, right);
  }

  /**
   * @param cmp the result of comparing left to right, as in {@link Comparable#compareTo}.
   * @return whether this comparison holds.
   */
  protected abstract boolean test(int cmp);

  @Override
  public Type getOutputType(final Schema schema) throws DbException {
    Type leftType = getLeft().getOutputType(schema);
    Type rightType = getRight().getOutputType(schema);
    if (leftType != rightType && !(leftType.isNumeric() && rightType.isNumeric())) {
      throw DbException.invalid("Cannot compare %s to %s in %s", leftType, rightType, getFunctionName());
    }
    return Type.BOOLEAN_TYPE;
  }

  @Override
  @SuppressWarnings({"unchecked", "rawtypes"})
  protected Object apply(final Type outputType, final Object l, final Object r) {
    final int cmp;
    if (l instanceof Double || r instanceof Double) {
      cmp = Double.compare(((Number) l).doubleValue(), ((Number) r).doubleValue());
    } else if (l instanceof Number) {
      cmp = Long.compare(((Number) l).longValue(), ((Number) r).longValue());
    } else {
      cmp = ((Comparable) l).compareTo(r);
    }
    return test(cmp);
  }
}
