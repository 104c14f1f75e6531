package edu.washington.escience.rivulet.column.builder;

import java.util.BitSet;

import javax.annotation.Nullable;

import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;

/**
 * A growable column under construction. {@link #build()} takes a snapshot, so a builder may keep growing after it has
 * been built once.
 *
 * @param <T> the type of the objects in this column.
 */
public abstract class ColumnBuilder<T extends Comparable<?>> {

  /** Starting capacity of the array-backed builders. */
  protected static final int INITIAL_CAPACITY = 16;

  /** The null rows appended so far. */
  protected final BitSet nulls = new BitSet();

  /** The number of rows appended so far. */
  protected int size = 0;

  /**
   * @return the type of the column being built.
   */
  public abstract Type getType();

  /**
   * @param value element to be inserted.
   * @return this column builder.
   */
  public ColumnBuilder<T> appendBoolean(final boolean value) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  /**
   * @param value element to be inserted.
   * @return this column builder.
   */
  public ColumnBuilder<T> appendDouble(final double value) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  /**
   * @param value element to be inserted.
   * @return this column builder.
   */
  public ColumnBuilder<T> appendInt(final int value) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  /**
   * @param value element to be inserted.
   * @return this column builder.
   */
  public ColumnBuilder<T> appendLong(final long value) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  /**
   * @param value element to be inserted.
   * @return this column builder.
   */
  public ColumnBuilder<T> appendString(final String value) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  /**
   * Appends a null row.
   *
   * @return this column builder.
   */
  public abstract ColumnBuilder<T> appendNull();

  /**
   * Appends a boxed value, null meaning a null row.
   *
   * @param value the value.
   * @return this column builder.
   */
  public ColumnBuilder<T> appendObject(@Nullable final Object value) {
    if (value == null) {
      return appendNull();
    }
    switch (getType()) {
      case BOOLEAN_TYPE:
        return appendBoolean((Boolean) value);
      case INT_TYPE:
        return appendInt(((Number) value).intValue());
      case LONG_TYPE:
        return appendLong(((Number) value).longValue());
      case DOUBLE_TYPE:
        return appendDouble(((Number) value).doubleValue());
      case STRING_TYPE:
        return appendString((String) value);
      default:
        throw new UnsupportedOperationException("type " + getType());
    }
  }

  /**
   * Copies one row of a column of the same type.
   *
   * @param column the source column.
   * @param row the row of the source column.
   * @return this column builder.
   */
  public ColumnBuilder<T> appendFrom(final Column<?> column, final int row) {
    if (column.isNull(row)) {
      return appendNull();
    }
    switch (getType()) {
      case BOOLEAN_TYPE:
        return appendBoolean(column.getBoolean(row));
      case INT_TYPE:
        return appendInt(column.getInt(row));
      case LONG_TYPE:
        return appendLong(column.getLong(row));
      case DOUBLE_TYPE:
        return appendDouble(column.getDouble(row));
      case STRING_TYPE:
        return appendString(column.getString(row));
      default:
        throw new UnsupportedOperationException("type " + getType());
    }
  }

  /**
   * @return the number of rows appended so far.
   */
  public int size() {
    return size;
  }

  /**
   * @return a column holding the rows appended so far.
   */
  public abstract Column<T> build();
}
