package edu.washington.escience.rivulet.column.builder;

import java.util.List;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.Type;

/**
 * Maps a {@link Type} (or a whole {@link Schema}) to empty builders of the matching column class.
 */
public final class ColumnFactory {

  /** Utility class cannot be instantiated. */
  private ColumnFactory() {}

  /**
   * One builder per column of {@code schema}, in order.
   *
   * @param schema the Schema
   * @return builders aligned with the schema columns
   */
  public static List<ColumnBuilder<?>> allocateColumns(final Schema schema) {
    final ImmutableList.Builder<ColumnBuilder<?>> builders = ImmutableList.builder();
    for (final Type type : schema.getColumnTypes()) {
      builders.add(allocateColumn(type));
    }
    return builders.build();
  }

  /**
   * An empty builder for values of {@code type}.
   *
   * @param type the type of the column.
   * @return an empty builder for that type.
   */
  public static ColumnBuilder<?> allocateColumn(final Type type) {
    switch (type) {
      case BOOLEAN_TYPE:
        return new BooleanColumnBuilder();
      case INT_TYPE:
        return new IntColumnBuilder();
      case LONG_TYPE:
        return new LongColumnBuilder();
      case DOUBLE_TYPE:
        return new DoubleColumnBuilder();
      case STRING_TYPE:
        return new StringColumnBuilder();
      default:
        throw new IllegalArgumentException("no column builder for " + type);
    }
  }
}
