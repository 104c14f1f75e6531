package edu.washington.escience.rivulet.expression;

import java.io.Serializable;
import java.util.List;

import javax.annotation.Nonnull;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonSubTypes.Type;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.column.Column;
import edu.washington.escience.rivulet.storage.TupleBatch;

/**
 * A node of a scalar expression tree, evaluated column-at-a-time against a {@link TupleBatch}. Trees travel as JSON,
 * tagged by the {@code type} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  /* Zeroary */
  @Type(name = "CONSTANT", value = ConstantExpression.class),
  @Type(name = "VARIABLE", value = VariableExpression.class),
  /* Unary */
  @Type(name = "NOT", value = NotExpression.class),
  /* Binary */
  @Type(name = "AND", value = AndExpression.class),
  @Type(name = "EQ", value = EqualsExpression.class),
  @Type(name = "GT", value = GreaterThanExpression.class),
  @Type(name = "GTEQ", value = GreaterThanOrEqualsExpression.class),
  @Type(name = "LT", value = LessThanExpression.class),
  @Type(name = "LTEQ", value = LessThanOrEqualsExpression.class),
  @Type(name = "MINUS", value = MinusExpression.class),
  @Type(name = "NEQ", value = NotEqualsExpression.class),
  @Type(name = "OR", value = OrExpression.class),
  @Type(name = "PLUS", value = PlusExpression.class),
  @Type(name = "TIMES", value = TimesExpression.class)
})
public abstract class ExpressionOperator implements Serializable {
  /***/
  private static final long serialVersionUID = 1L;

  /**
   * Resolve the result type against an input schema, validating the operand types on the way.
   *
   * @param schema the schema of the input batches.
   * @return the type of the output of this expression.
   * @throws DbException INVALID if the children have unsuitable types or a referenced column does not exist.
   */
  public abstract edu.washington.escience.rivulet.Type getOutputType(final Schema schema) throws DbException;

  /**
   * Evaluate this expression over every row of a batch. Null inputs produce null outputs unless the operator says
   * otherwise; if every input column is a broadcast scalar the result is one too.
   *
   * @param input the batch.
   * @return a column with one value per input row.
   * @throws DbException if evaluation fails, e.g. on integer overflow.
   */
  public abstract Column<?> evaluate(final TupleBatch input) throws DbException;

  /**
   * @return the operands of this node, empty for leaves.
   */
  @Nonnull
  public abstract List<ExpressionOperator> getChildren();

  /**
   * @return the canonical text of this expression, e.g. {@code multiply(i32, 2)}. Used as the default name of a
   *         projected column.
   */
  @Override
  public abstract String toString();
}
