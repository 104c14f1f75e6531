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
 * An ExpressionOperator with one child.
 */
public abstract class UnaryExpression extends ExpressionOperator {
  /***/
  private static final long serialVersionUID = 1L;

  /** The child expression. */
  @JsonProperty private final ExpressionOperator operand;

  /**
   * This is not really unused, it's used automagically by Jackson deserialization.
   */
  protected UnaryExpression() {
    operand = null;
  }

  /**
   * @param operand the operand.
   */
  protected UnaryExpression(final ExpressionOperator operand) {
    this.operand = operand;
  }

  /**
   * @return the child expression.
   */
  public final ExpressionOperator getOperand() {
    return operand;
  }

  @Override
  public List<ExpressionOperator> getChildren() {
    return ImmutableList.of(operand);
  }

  /**
   * @return the function name used in {@link #toString()}.
   */
  protected abstract String getFunctionName();

  /**
   * Apply this operator to one non-null value.
   *
   * @param value the operand value.
   * @return the result, or null.
   * @throws DbException if the operation fails.
   */
  protected abstract Object apply(Object value) throws DbException;

  @Override
  public final Column<?> evaluate(final TupleBatch input) throws DbException {
    final Column<?> in = operand.evaluate(input);
    final Type outputType = getOutputType(input.getSchema());
    if (in.isConstant()) {
      Object value = ((ConstantValueColumn) in).getValue();
      Object result = value == null ? null : apply(value);
      return new ConstantValueColumn((Comparable<?>) result, outputType, in.size());
    }
    ColumnBuilder<?> builder = ColumnFactory.allocateColumn(outputType);
    for (int row = 0; row < in.size(); ++row) {
      Object value = in.getObject(row);
      builder.appendObject(value == null ? null : apply(value));
    }
    return builder.build();
  }

  /**
   * A function that could be used as the default type checker for a unary expression where the operand must be
   * boolean.
   *
   * @param schema the input schema.
   * @throws DbException INVALID if the operand is not boolean.
   */
  protected final void checkBooleanType(final Schema schema) throws DbException {
    Type type = operand.getOutputType(schema);
    if (type != Type.BOOLEAN_TYPE) {
      throw DbException.invalid("%s must be applied to a boolean, not %s", getFunctionName(), type);
    }
  }

  @Override
  public String toString() {
    return getFunctionName() + "(" + operand + ")";
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass().getCanonicalName(), operand);
  }

  @Override
  public boolean equals(final Object other) {
    if (other == null || !getClass().equals(other.getClass())) {
      return false;
    }
    return Objects.equals(operand, ((UnaryExpression) other).operand);
  }
}
