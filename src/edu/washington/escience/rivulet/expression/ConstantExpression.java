package edu.washington.escience.rivulet.expression;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;
import edu.washington.escience.rivulet.column.ConstantValueColumn;
import edu.washington.escience.rivulet.storage.TupleBatch;

/**
 * A literal. It evaluates to a broadcast scalar column, so it never materializes one value per row. The value is kept
 * in its textual form, which is also how it travels as JSON; a null {@code value} is the typed null literal.
 */
public class ConstantExpression extends ZeroaryExpression {

  /***/
  private static final long serialVersionUID = 1L;

  /** Type of the literal. */
  @JsonProperty private final Type valueType;

  /** Text of the literal, parsed by {@link Type#fromString(String)}; null for a null literal. */
  @JsonProperty private final String value;

  /**
   * @param valueType type of the literal.
   * @param value text of the literal, or null.
   */
  @JsonCreator
  public ConstantExpression(
      @JsonProperty("valueType") final Type valueType, @JsonProperty("value") final String value) {
    this.valueType = Objects.requireNonNull(valueType, "valueType");
    this.value = value;
  }

  /** @param literal an INT literal. */
  public ConstantExpression(final int literal) {
    this(Type.INT_TYPE, Integer.toString(literal));
  }

  /** @param literal a LONG literal. */
  public ConstantExpression(final long literal) {
    this(Type.LONG_TYPE, Long.toString(literal));
  }

  /** @param literal a DOUBLE literal. */
  public ConstantExpression(final double literal) {
    this(Type.DOUBLE_TYPE, Double.toString(literal));
  }

  /** @param literal a BOOLEAN literal. */
  public ConstantExpression(final boolean literal) {
    this(Type.BOOLEAN_TYPE, Boolean.toString(literal));
  }

  /** @param literal a STRING literal. */
  public ConstantExpression(final String literal) {
    this(Type.STRING_TYPE, literal);
  }

  @Override
  public Type getOutputType(final Schema schema) {
    return valueType;
  }

  @Override
  public Column<?> evaluate(final TupleBatch input) {
    final Comparable<?> literal = (value == null) ? null : valueType.fromString(value);
    return new ConstantValueColumn(literal, valueType, input.numTuples());
  }

  /**
   * @return text of the literal, or null.
   */
  public String getValue() {
    return value;
  }

  @Override
  public String toString() {
    if (value == null) {
      return "null";
    }
    return (valueType == Type.STRING_TYPE) ? '"' + value + '"' : value;
  }

  @Override
  public int hashCode() {
    return Objects.hash(ConstantExpression.class, valueType, value);
  }

  @Override
  public boolean equals(final Object other) {
    if (!(other instanceof ConstantExpression)) {
      return false;
    }
    final ConstantExpression that = (ConstantExpression) other;
    return valueType == that.valueType && Objects.equals(value, that.value);
  }
}
