package edu.washington.escience.rivulet.column;

import java.util.BitSet;

import com.google.common.base.Preconditions;

import edu.washington.escience.rivulet.Type;

/**
 * A column of Double values.
 */
public final class DoubleColumn extends Column<Double> {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;
  /** Row values; the slot of a null row holds an arbitrary value. */
  private final double[] data;
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
  public DoubleColumn(final double[] data, final BitSet nulls, final int numData) {
    this.data = data;
    this.nulls = nulls;
    position = numData;
  }

  @Override
  public Double getObject(final int row) {
    if (isNull(row)) {
      return null;
    }
    return Double.valueOf(getDouble(row));
  }

  @Override
  public double getDouble(final int row) {
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
    return Type.DOUBLE_TYPE;
  }

  @Override
  public int size() {
    return position;
  }
}
