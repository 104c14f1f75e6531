package edu.washington.escience.rivulet.expression;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;
import edu.washington.escience.rivulet.storage.TupleBatch;

/**
 * Represents a reference to a named input column in an expression tree.
 */
public class VariableExpression extends ZeroaryExpression {
  /***/
  private static final long serialVersionUID = 1L;

  /** The name of the input column that is referenced. */
  @JsonProperty private final String columnName;

  /**
   * A {@link VariableExpression} that references column <code>columnName</code> from the input.
   *
   * @param columnName the name of the input column.
   */
  @JsonCreator
  public VariableExpression(@JsonProperty("columnName") final String columnName) {
    this.columnName = Objects.requireNonNull(columnName, "columnName");
  }

  @Override
  public Type getOutputType(final Schema schema) throws DbException {
    return schema.getColumnType(schema.getColumnIndex(columnName));
  }

  @Override
  public Column<?> evaluate(final TupleBatch input) throws DbException {
    return input.asColumn(input.getSchema().getColumnIndex(columnName));
  }

  /**
   * @return the name of the referenced column.
   */
  public String getColumnName() {
    return columnName;
  }

  @Override
  public String toString() {
    return columnName;
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass().getCanonicalName(), columnName);
  }

  @Override
  public boolean equals(final Object other) {
    if (other == null || !(other instanceof VariableExpression)) {
      return false;
    }
    VariableExpression otherExp = (VariableExpression) other;
    return Objects.equals(columnName, otherExp.columnName);
  }
}
