package edu.washington.escience.rivulet.operator.agg;

import java.util.Arrays;

import com.google.common.base.Preconditions;

import net.jcip.annotations.Immutable;

/**
 * A partition of row indices by group id, stored as one array of row indices and one array of offsets: the rows of
 * group {@code g} are {@code rowIndices[offsets[g] .. offsets[g + 1])}, in ascending order.
 */
@Immutable
public final class Groupings {
  /** Start of each group's rows in {@link #rowIndices}, plus one trailing end offset. */
  private final int[] offsets;
  /** The row indices, grouped. */
  private final int[] rowIndices;

  /**
   * @param offsets start of each group's rows, plus one trailing end offset.
   * @param rowIndices the row indices, grouped.
   */
  Groupings(final int[] offsets, final int[] rowIndices) {
    this.offsets = offsets;
    this.rowIndices = rowIndices;
  }

  /**
   * @return the number of groups, including empty ones.
   */
  public int numGroups() {
    return offsets.length - 1;
  }

  /**
   * @param group the group id.
   * @return the number of rows in the group.
   */
  public int groupSize(final int group) {
    Preconditions.checkElementIndex(group, numGroups());
    return offsets[group + 1] - offsets[group];
  }

  /**
   * @param group the group id.
   * @return the rows of the group, in ascending order.
   */
  public int[] getRows(final int group) {
    Preconditions.checkElementIndex(group, numGroups());
    return Arrays.copyOfRange(rowIndices, offsets[group], offsets[group + 1]);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Groupings{");
    for (int g = 0; g < numGroups(); ++g) {
      if (g > 0) {
        sb.append(", ");
      }
      sb.append(g).append('=').append(Arrays.toString(getRows(g)));
    }
    return sb.append('}').toString();
  }
}
