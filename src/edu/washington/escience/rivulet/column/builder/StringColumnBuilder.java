package edu.washington.escience.rivulet.column.builder;

import java.util.Arrays;

import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.StringColumn;

/**
 * A column of String values.
 */
public final class StringColumnBuilder extends ColumnBuilder<String> {
  /** Internal representation of the column data. */
  private String[] data = new String[INITIAL_CAPACITY];

  @Override
  public Type getType() {
    return Type.STRING_TYPE;
  }

  @Override
  public StringColumnBuilder appendString(final String value) {
    if (size == data.length) {
      data = Arrays.copyOf(data, data.length * 2);
    }
    data[size] = value;
    if (value == null) {
      nulls.set(size);
    }
    size++;
    return this;
  }

  @Override
  public StringColumnBuilder appendNull() {
    return appendString(null);
  }

  @Override
  public StringColumn build() {
    return new StringColumn(Arrays.copyOf(data, size), size);
  }
}
