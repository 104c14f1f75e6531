package edu.washington.escience.rivulet.column.builder;

import java.util.Arrays;
import java.util.BitSet;

import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.LongColumn;

/**
 * A column of Long values.
 */
public final class LongColumnBuilder extends ColumnBuilder<Long> {
  /** Internal representation of the column data. */
  private long[] data = new long[INITIAL_CAPACITY];

  @Override
  public Type getType() {
    return Type.LONG_TYPE;
  }

  @Override
  public LongColumnBuilder appendLong(final long value) {
    if (size == data.length) {
      data = Arrays.copyOf(data, data.length * 2);
    }
    data[size] = value;
    size++;
    return this;
  }

  @Override
  public LongColumnBuilder appendNull() {
    nulls.set(size);
    return appendLong(0);
  }

  @Override
  public LongColumn build() {
    return new LongColumn(Arrays.copyOf(data, size), (BitSet) nulls.clone(), size);
  }
}
