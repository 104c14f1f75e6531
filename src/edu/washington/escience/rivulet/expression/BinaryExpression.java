package edu.washington.escience.rivulet.expression;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;
import edu.washington.escience.rivulet.column.ConstantValueColumn;
import edu.washington.escience.rivulet.column.builder.ColumnBuilder;
import edu.washington.escience.rivulet.column.builder.ColumnFactory;
import edu.washington.escience.rivulet.storage.TupleBatch;

/**
 * An ExpressionOperator with two children.
 */
public abstract class BinaryExpression extends ExpressionOperator {

  /***/
  private static final long serialVersionUID = 1L;

  /** The left child. */
  @JsonProperty private final ExpressionOperator left;
  /** The right child. */
  @JsonProperty private final ExpressionOperator right;

  /**
   * This is not really unused, it's used automagically by Jackson deserialization.
   */
  protected BinaryExpression() {
    left = null;
    right = null;
  }

  /**
   * @param left the left child.
   * @param right the right child.
   */
  protected BinaryExpression(final ExpressionOperator left, final ExpressionOperator right) {
    this.left = left;
    this.right = right;
  }

  /**
   * @return the left child;
   */
  public final ExpressionOperator getLeft() {
    return left;
  }

  /**
   * @return the right child;
   */
  public final ExpressionOperator getRight() {
    return right;
  }

  @Override
  public List<ExpressionOperator> getChildren() {
    ImmutableList.Builder<ExpressionOperator> children = ImmutableList.builder();
    return children.add(getLeft()).add(getRight()).build();
  }

  /**
   * @return the function name used in {@link #toString()}, e.g. {@code add}.
   */
  protected abstract String getFunctionName();

  /**
   * Apply this operator to two non-null values.
   *
   * @param outputType the output type of this expression.
   * @param l the left value.
   * @param r the right value.
   * @return the result, or null.
   * @throws DbException if the operation fails.
   */
  protected abstract Object apply(Type outputType, Object l, Object r) throws DbException;

  /**
   * Apply this operator to two possibly-null values. A null operand makes the result null; boolean connectives
   * override this.
   *
   * @param outputType the output type of this expression.
   * @param l the left value, or null.
   * @param r the right value, or null.
   * @return the result, or null.
   * @throws DbException if the operation fails.
   */
  protected Object applyNullable(final Type outputType, final Object l, final Object r) throws DbException {
    if (l == null || r == null) {
      return null;
    }
    return apply(outputType, l, r);
  }

  @Override
  public final Column<?> evaluate(final TupleBatch input) throws DbException {
    final Column<?> l = left.evaluate(input);
    final Column<?> r = right.evaluate(input);
    final Type outputType = getOutputType(input.getSchema());
    if (l.isConstant() && r.isConstant()) {
      Object result =
          applyNullable(
              outputType, ((ConstantValueColumn) l).getValue(), ((ConstantValueColumn) r).getValue());
      return new ConstantValueColumn((Comparable<?>) result, outputType, input.numTuples());
    }
    ColumnBuilder<?> builder = ColumnFactory.allocateColumn(outputType);
    for (int row = 0; row < input.numTuples(); ++row) {
      builder.appendObject(applyNullable(outputType, l.getObject(row), r.getObject(row)));
    }
    return builder.build();
  }

  /**
   * A function that could be used as the default type checker for a binary expression where both operands must be
   * numeric.
   *
   * @param schema the input schema.
   * @return the default numeric type, based on the types of the children and Java type precedence.
   * @throws DbException INVALID if either operand is not numeric.
   */
  protected final Type checkAndReturnDefaultNumericType(final Schema schema) throws DbException {
    Type leftType = left.getOutputType(schema);
    Type rightType = right.getOutputType(schema);
    if (!leftType.isNumeric() || !rightType.isNumeric()) {
      throw DbException.invalid(
          "%s requires numeric operands, got %s and %s", getFunctionName(), leftType, rightType);
    }
    for (Type t : ImmutableList.of(Type.DOUBLE_TYPE, Type.LONG_TYPE)) {
      if (leftType == t || rightType == t) {
        return t;
      }
    }
    return Type.INT_TYPE;
  }

  /**
   * A function that could be used as the default type checker for a binary expression where both operands must be
   * boolean.
   *
   * @param schema the input schema.
   * @throws DbException INVALID if either operand is not boolean.
   */
  protected final void checkBooleanType(final Schema schema) throws DbException {
    Type leftType = left.getOutputType(schema);
    Type rightType = right.getOutputType(schema);
    if (leftType != Type.BOOLEAN_TYPE || rightType != Type.BOOLEAN_TYPE) {
      throw DbException.invalid(
          "%s requires boolean operands, got %s and %s", getFunctionName(), leftType, rightType);
    }
  }

  @Override
  public String toString() {
    return getFunctionName() + "(" + left + ", " + right + ")";
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass().getCanonicalName(), left, right);
  }

  @Override
  public boolean equals(final Object other) {
    if (other == null || !getClass().equals(other.getClass())) {
      return false;
    }
    BinaryExpression otherExpr = (BinaryExpression) other;
    return Objects.equals(left, otherExpr.left) && Objects.equals(right, otherExpr.right);
  }
}
