package edu.washington.escience.rivulet.operator.agg;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.washington.escience.rivulet.column.Column;

/**
 * Utility functions for aggregation.
 */
public final class AggUtils {
  /** Utility classes do not have a public constructor. */
  private AggUtils() {}

  /**
   * Partition row indices by group id.
   *
   * @param ids the group id of each row.
   * @param numGroups the number of groups. Every id must be in {@code [0, numGroups)}.
   * @return for each group, the rows that carry its id.
   */
  public static Groupings makeGroupings(final int[] ids, final int numGroups) {
    Preconditions.checkArgument(numGroups >= 0, "numGroups must be non-negative");
    final int[] offsets = new int[numGroups + 1];
    for (int id : ids) {
      Preconditions.checkElementIndex(id, numGroups, "group id");
      offsets[id + 1]++;
    }
    for (int g = 0; g < numGroups; ++g) {
      offsets[g + 1] += offsets[g];
    }
    final int[] cursor = new int[numGroups];
    System.arraycopy(offsets, 0, cursor, 0, numGroups);
    final int[] rowIndices = new int[ids.length];
    for (int row = 0; row < ids.length; ++row) {
      rowIndices[cursor[ids[row]]++] = row;
    }
    return new Groupings(offsets, rowIndices);
  }

  /**
   * Gather the values of a column group by group.
   *
   * @param groupings the partition of rows.
   * @param column the column. It must have a row for every index in {@code groupings}.
   * @return one column per group, holding that group's values in row order.
   */
  public static List<Column<?>> applyGroupings(final Groupings groupings, final Column<?> column) {
    final ImmutableList.Builder<Column<?>> out = ImmutableList.builder();
    for (int g = 0; g < groupings.numGroups(); ++g) {
      out.add(column.take(groupings.getRows(g)));
    }
    return out.build();
  }

  /**
   * Check that a state handed to {@link Aggregator#mergeFrom(Aggregator)} comes from the same kernel.
   *
   * @param other the other state.
   * @param stateClass the expected class.
   * @param <T> the expected class.
   * @return {@code other}, cast.
   */
  static <T extends Aggregator> T sameKernel(final Aggregator other, final Class<T> stateClass) {
    Preconditions.checkArgument(
        stateClass.isInstance(other),
        "cannot merge a %s into a %s",
        other.getClass().getSimpleName(),
        stateClass.getSimpleName());
    return stateClass.cast(other);
  }
}
