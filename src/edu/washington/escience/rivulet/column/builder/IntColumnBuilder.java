package edu.washington.escience.rivulet.column.builder;

import java.util.Arrays;
import java.util.BitSet;

import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.IntColumn;

/**
 * A column of Integer values.
 */
public final class IntColumnBuilder extends ColumnBuilder<Integer> {
  /** Internal representation of the column data. */
  private int[] data = new int[INITIAL_CAPACITY];

  @Override
  public Type getType() {
    return Type.INT_TYPE;
  }

  @Override
  public IntColumnBuilder appendInt(final int value) {
    if (size == data.length) {
      data = Arrays.copyOf(data, data.length * 2);
    }
    data[size] = value;
    size++;
    return this;
  }

  @Override
  public IntColumnBuilder appendNull() {
    nulls.set(size);
    return appendInt(0);
  }

  @Override
  public IntColumn build() {
    return new IntColumn(Arrays.copyOf(data, size), (BitSet) nulls.clone(), size);
  }
}
