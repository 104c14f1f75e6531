package edu.washington.escience.rivulet.column;

import java.util.BitSet;

import com.google.common.base.Preconditions;

import edu.washington.escience.rivulet.Type;

/**
 * A column of Boolean values. To save space, this implementation uses a BitSet as the internal representation.
 */
public final class BooleanColumn extends Column<Boolean> {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;
  /** Row values; the slot of a null row holds an arbitrary value. */
  private final BitSet data;
  /** Set bits mark null rows. */
  private final BitSet nulls;
  /** Number of valid elements. */
  private final int numBits;

  /**
   * @param data row values
   * @param nulls set bits mark null rows
   * @param size the size of the column
   */
  public BooleanColumn(final BitSet data, final BitSet nulls, final int size) {
    this.data = data;
    this.nulls = nulls;
    numBits = size;
  }

  @Override
  public Boolean getObject(final int row) {
    if (isNull(row)) {
      return null;
    }
    return Boolean.valueOf(getBoolean(row));
  }

  @Override
  public boolean getBoolean(final int row) {
    Preconditions.checkElementIndex(row, numBits);
    return data.get(row);
  }

  @Override
  public boolean isNull(final int row) {
    Preconditions.checkElementIndex(row, numBits);
    return nulls.get(row);
  }

  @Override
  public int nullCount() {
    return nulls.cardinality();
  }

  @Override
  public Type getType() {
    return Type.BOOLEAN_TYPE;
  }

  @Override
  public int size() {
    return numBits;
  }
}
