package edu.washington.escience.rivulet.column;

import com.google.common.base.Preconditions;

import edu.washington.escience.rivulet.Type;

/**
 * A column of String values. A null entry is a null row.
 */
public final class StringColumn extends Column<String> {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;
  /** Contains the packed character data. */
  private final String[] data;
  /** Number of elements in this column. */
  private final int numStrings;

  /**
   * @param data the strings, null entries are null rows.
   * @param numStrings number of tuples.
   */
  public StringColumn(final String[] data, final int numStrings) {
    this.data = data;
    this.numStrings = numStrings;
  }

  @Override
  public String getObject(final int row) {
    return getString(row);
  }

  @Override
  public String getString(final int row) {
    Preconditions.checkElementIndex(row, numStrings);
    return data[row];
  }

  @Override
  public boolean isNull(final int row) {
    return getString(row) == null;
  }

  @Override
  public Type getType() {
    return Type.STRING_TYPE;
  }

  @Override
  public int size() {
    return numStrings;
  }
}
