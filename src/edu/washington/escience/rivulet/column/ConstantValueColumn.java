package edu.washington.escience.rivulet.column;

import java.util.BitSet;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import edu.washington.escience.rivulet.Type;

/**
 * A column that holds a single value (possibly null) repeated {@code size} times. This is how a batch carries a
 * broadcast scalar.
 */
public final class ConstantValueColumn extends Column<Comparable<?>> {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;
  /** The value of this column, or null. */
  @Nullable private final Comparable<?> value;
  /** The type of this column. */
  private final Type type;
  /** The number of rows in this column. */
  private final int size;

  /**
   * Instantiate a new ConstantValueColumn that returns the specified value of the specified type.
   *
   * @param value the value of all rows in this column, may be null.
   * @param type the type of the value in this column.
   * @param size the number of rows in this column.
   */
  public ConstantValueColumn(@Nullable final Comparable<?> value, final Type type, final int size) {
    this.type = Objects.requireNonNull(type, "type");
    Preconditions.checkArgument(size >= 0, "size must be non-negative");
    Preconditions.checkArgument(
        value == null || type.toJavaObjectType().isInstance(value),
        "value %s does not match type %s",
        value,
        type);
    this.value = value;
    this.size = size;
  }

  /**
   * @return the broadcast value, or null.
   */
  @Nullable
  public Comparable<?> getValue() {
    return value;
  }

  @Override
  public boolean getBoolean(final int row) {
    Preconditions.checkElementIndex(row, size);
    return (Boolean) value;
  }

  @Override
  public double getDouble(final int row) {
    Preconditions.checkElementIndex(row, size);
    return (Double) value;
  }

  @Override
  public int getInt(final int row) {
    Preconditions.checkElementIndex(row, size);
    return (Integer) value;
  }

  @Override
  public long getLong(final int row) {
    Preconditions.checkElementIndex(row, size);
    return (Long) value;
  }

  @Override
  public String getString(final int row) {
    Preconditions.checkElementIndex(row, size);
    return (String) value;
  }

  @Override
  public Comparable<?> getObject(final int row) {
    Preconditions.checkElementIndex(row, size);
    return value;
  }

  @Override
  public boolean isNull(final int row) {
    Preconditions.checkElementIndex(row, size);
    return value == null;
  }

  @Override
  public int nullCount() {
    return value == null ? size : 0;
  }

  @Override
  public boolean isConstant() {
    return true;
  }

  @Override
  public Type getType() {
    return type;
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public Column<?> filter(final BitSet filter) {
    return new ConstantValueColumn(value, type, filter.get(0, size).cardinality());
  }

  @Override
  public Column<?> take(final int[] rows) {
    for (int row : rows) {
      Preconditions.checkElementIndex(row, size);
    }
    return new ConstantValueColumn(value, type, rows.length);
  }

  @Override
  public Column<?> slice(final int offset, final int length) {
    Preconditions.checkPositionIndexes(offset, offset + length, size);
    return new ConstantValueColumn(value, type, length);
  }

  @Override
  public String toString() {
    return type.getName() + "[" + value + " x " + size + "]";
  }
}
