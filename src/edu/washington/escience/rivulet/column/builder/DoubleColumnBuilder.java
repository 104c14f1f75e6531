package edu.washington.escience.rivulet.column.builder;

import java.util.Arrays;
import java.util.BitSet;

import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.DoubleColumn;

/**
 * A column of Double values.
 */
public final class DoubleColumnBuilder extends ColumnBuilder<Double> {
  /** Internal representation of the column data. */
  private double[] data = new double[INITIAL_CAPACITY];

  @Override
  public Type getType() {
    return Type.DOUBLE_TYPE;
  }

  @Override
  public DoubleColumnBuilder appendDouble(final double value) {
    if (size == data.length) {
      data = Arrays.copyOf(data, data.length * 2);
    }
    data[size] = value;
    size++;
    return this;
  }

  @Override
  public DoubleColumnBuilder appendNull() {
    nulls.set(size);
    return appendDouble(0);
  }

  @Override
  public DoubleColumn build() {
    return new DoubleColumn(Arrays.copyOf(data, size), (BitSet) nulls.clone(), size);
  }
}
