package edu.washington.escience.rivulet.column;

import java.util.BitSet;

import com.google.common.base.Preconditions;

import edu.washington.escience.rivulet.Type;

/**
 * A column of Integer values.
 */
public final class IntColumn extends Column<Integer> {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;
  /** Row values; the slot of a null row holds an arbitrary value. */
  private final int[] data;
  /** Set bits mark null rows. */
  private final BitSet nulls;
  /** Row count; {@code data} may be longer. */
  private final int position;

  /**
   * Wraps finished builder storage without copying it.
   *
   * @param data row values
   * @param nulls set bits mark null rows
   * @param numData row count
   */
  public IntColumn(final int[] data, final BitSet nulls, final int numData) {
    this.data = data;
    this.nulls = nulls;
    position = numData;
  }

  @Override
  public Integer getObject(final int row) {
    if (isNull(row)) {
      return null;
    }
    return Integer.valueOf(getInt(row));
  }

  @Override
  public int getInt(final int row) {
    Preconditions.checkElementIndex(row, position);
    return data[row];
  }

  @Override
  public boolean isNull(final int row) {
    Preconditions.checkElementIndex(row, position);
    return nulls.get(row);
  }

  @Override
  public int nullCount() {
    return nulls.cardinality();
  }

  @Override
  public Type getType() {
    return Type.INT_TYPE;
  }

  @Override
  public int size() {
    return position;
  }
}
