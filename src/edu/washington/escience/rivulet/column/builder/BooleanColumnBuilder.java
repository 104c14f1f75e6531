package edu.washington.escience.rivulet.column.builder;

import java.util.BitSet;

import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.BooleanColumn;

/**
 * A column of Boolean values.
 */
public final class BooleanColumnBuilder extends ColumnBuilder<Boolean> {
  /** Internal representation of the column data. */
  private final BitSet data = new BitSet();

  @Override
  public Type getType() {
    return Type.BOOLEAN_TYPE;
  }

  @Override
  public BooleanColumnBuilder appendBoolean(final boolean value) {
    data.set(size, value);
    size++;
    return this;
  }

  @Override
  public BooleanColumnBuilder appendNull() {
    nulls.set(size);
    size++;
    return this;
  }

  @Override
  public BooleanColumn build() {
    return new BooleanColumn((BitSet) data.clone(), (BitSet) nulls.clone(), size);
  }
}
