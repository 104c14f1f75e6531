package edu.washington.escience.rivulet.column;

import java.io.Serializable;
import java.util.BitSet;

import com.google.common.base.Preconditions;

import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.builder.ColumnBuilder;
import edu.washington.escience.rivulet.column.builder.ColumnFactory;

/**
 * A column of a batch of tuples. Any row may be null; the typed getters must not be called on null rows.
 *
 * @param <T> type of the objects in this column.
 */
public abstract class Column<T extends Comparable<?>> implements Serializable {

  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * @param row row of element to return.
   * @return the element at the specified row in this column.
   */
  public boolean getBoolean(final int row) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  /**
   * @param row row of element to return.
   * @return the element at the specified row in this column.
   */
  public double getDouble(final int row) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  /**
   * @param row row of element to return.
   * @return the element at the specified row in this column.
   */
  public int getInt(final int row) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  /**
   * @param row row of element to return.
   * @return the element at the specified row in this column.
   */
  public long getLong(final int row) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  /**
   * @param row row of element to return.
   * @return the element at the specified row in this column.
   */
  public String getString(final int row) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  /**
   * Returns the element at the specified row in this column, or null if the row is null.
   *
   * @param row row of element to return.
   * @return the element at the specified row in this column.
   */
  public abstract T getObject(int row);

  /**
   * @param row the row.
   * @return true if the value at the given row is null.
   */
  public abstract boolean isNull(int row);

  /**
   * @return the type of the values in this column.
   */
  public abstract Type getType();

  /**
   * @return the number of rows in this column.
   */
  public abstract int size();

  /**
   * @return true if every row of this column holds the same (broadcast) value.
   */
  public boolean isConstant() {
    return false;
  }

  /**
   * @return the number of null rows.
   */
  public int nullCount() {
    int count = 0;
    for (int i = 0; i < size(); ++i) {
      if (isNull(i)) {
        ++count;
      }
    }
    return count;
  }

  /**
   * Reads a numeric value widened to a double.
   *
   * @param row the row, which must not be null.
   * @return the value as a double.
   */
  public double getNumericAsDouble(final int row) {
    switch (getType()) {
      case INT_TYPE:
        return getInt(row);
      case LONG_TYPE:
        return getLong(row);
      case DOUBLE_TYPE:
        return getDouble(row);
      default:
        throw new UnsupportedOperationException("not a numeric column: " + getType());
    }
  }

  /**
   * Reads an integral value widened to a long.
   *
   * @param row the row, which must not be null.
   * @return the value as a long.
   */
  public long getIntegralAsLong(final int row) {
    switch (getType()) {
      case INT_TYPE:
        return getInt(row);
      case LONG_TYPE:
        return getLong(row);
      default:
        throw new UnsupportedOperationException("not an integral column: " + getType());
    }
  }

  /**
   * Creates a new Column containing the contents of this column including only the specified rows.
   *
   * @param filter a BitSet indicating which rows should be kept.
   * @return a new Column containing the contents of this column including only the specified rows.
   */
  public Column<?> filter(final BitSet filter) {
    ColumnBuilder<?> builder = ColumnFactory.allocateColumn(getType());
    for (int i = filter.nextSetBit(0); i >= 0 && i < size(); i = filter.nextSetBit(i + 1)) {
      builder.appendFrom(this, i);
    }
    return builder.build();
  }

  /**
   * Creates a new Column holding the given rows of this column, in the given order.
   *
   * @param rows the rows to gather. Rows may repeat.
   * @return the new column.
   */
  public Column<?> take(final int[] rows) {
    ColumnBuilder<?> builder = ColumnFactory.allocateColumn(getType());
    for (int row : rows) {
      builder.appendFrom(this, row);
    }
    return builder.build();
  }

  /**
   * @param offset the first row of the slice.
   * @param length the number of rows in the slice.
   * @return a new column holding rows {@code [offset, offset + length)}.
   */
  public Column<?> slice(final int offset, final int length) {
    Preconditions.checkPositionIndexes(offset, offset + length, size());
    ColumnBuilder<?> builder = ColumnFactory.allocateColumn(getType());
    for (int i = offset; i < offset + length; ++i) {
      builder.appendFrom(this, i);
    }
    return builder.build();
  }

  /**
   * @param type the type of the column to be returned.
   * @return a new empty column of the specified type.
   */
  public static Column<?> emptyColumn(final Type type) {
    return ColumnFactory.allocateColumn(type).build();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(getType().getName()).append('[');
    for (int i = 0; i < size(); ++i) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(getObject(i));
    }
    return sb.append(']').toString();
  }
}
