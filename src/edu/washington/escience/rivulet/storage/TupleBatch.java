package edu.washington.escience.rivulet.storage;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;
import edu.washington.escience.rivulet.column.ConstantValueColumn;

import net.jcip.annotations.ThreadSafe;

/**
 * Container class for a batch of tuples. Every column is either a full array of {@link #numTuples()} rows or a
 * {@link ConstantValueColumn} broadcasting one value over all of them. A batch is immutable once constructed.
 */
@ThreadSafe
public class TupleBatch implements Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;
  /** The hard-coded number of tuples in a batch. */
  public static final int BATCH_SIZE = 10 * 1000;
  /** Schema of tuples in this batch. */
  private final Schema schema;
  /** Tuple data stored as columns in this batch. */
  private final ImmutableList<Column<?>> columns;
  /** Number of tuples in this TB. */
  private final int numTuples;
  /** Optional tag, only used to tell apart otherwise identical batches. */
  @Nullable private final Integer tag;

  /**
   * Constructor that gets the number of tuples from the columns.
   *
   * @param schema schema of the tuples in this batch. Must match columns.
   * @param columns contains the column-stored data. Must match schema.
   */
  public TupleBatch(final Schema schema, final List<? extends Column<?>> columns) {
    this(schema, columns, columns.isEmpty() ? 0 : columns.get(0).size(), null);
  }

  /**
   * Construct a TupleBatch from the specified components.
   *
   * @param schema schema of the tuples in this batch. Must match columns.
   * @param columns contains the column-stored data. Must match schema.
   * @param numTuples the number of tuples in this batch. Must match columns.
   * @param tag optional batch tag.
   */
  public TupleBatch(
      final Schema schema,
      final List<? extends Column<?>> columns,
      final int numTuples,
      @Nullable final Integer tag) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.columns = ImmutableList.copyOf(Objects.requireNonNull(columns, "columns"));
    Preconditions.checkArgument(
        columns.size() == schema.numColumns(),
        "Number of columns in data must equal the number of fields in schema");
    for (int i = 0; i < columns.size(); ++i) {
      Column<?> column = columns.get(i);
      Preconditions.checkArgument(
          numTuples == column.size(), "Column %s != %s tuples", column.size(), numTuples);
      Preconditions.checkArgument(
          column.getType() == schema.getColumnType(i),
          "Column %s has type %s, schema says %s",
          i,
          column.getType(),
          schema.getColumnType(i));
    }
    this.numTuples = numTuples;
    this.tag = tag;
  }

  /**
   * @param schema the schema.
   * @return a batch with no rows.
   */
  public static TupleBatch empty(final Schema schema) {
    ImmutableList.Builder<Column<?>> b = ImmutableList.builder();
    for (Type type : schema.getColumnTypes()) {
      b.add(Column.emptyColumn(type));
    }
    return new TupleBatch(schema, b.build(), 0, null);
  }

  /**
   * Return a new TupleBatch that contains only the filtered rows of the current dataset. Broadcast columns stay
   * broadcast.
   *
   * @param filter the rows to be retained.
   * @return a TupleBatch that contains only the filtered rows of the current dataset.
   */
  public final TupleBatch filter(final BitSet filter) {
    final int newSize = filter.get(0, numTuples).cardinality();
    if (newSize == numTuples) {
      return this;
    }
    ImmutableList.Builder<Column<?>> newColumns = ImmutableList.builder();
    for (Column<?> column : columns) {
      newColumns.add(column.filter(filter));
    }
    return new TupleBatch(schema, newColumns.build(), newSize, tag);
  }

  /**
   * @param columnIndices the columns to keep, in order.
   * @return a batch holding only the given columns.
   */
  public final TupleBatch selectColumns(final int[] columnIndices) {
    ImmutableList.Builder<Column<?>> newColumns = ImmutableList.builder();
    for (int i : columnIndices) {
      newColumns.add(columns.get(i));
    }
    return new TupleBatch(schema.getSubSchema(columnIndices), newColumns.build(), numTuples, tag);
  }

  /**
   * @param newTag the tag.
   * @return a copy of this batch carrying the given tag.
   */
  public final TupleBatch withTag(@Nullable final Integer newTag) {
    return new TupleBatch(schema, columns, numTuples, newTag);
  }

  /**
   * @param columnIndex the column.
   * @return the column.
   */
  public final Column<?> asColumn(final int columnIndex) {
    return columns.get(columnIndex);
  }

  /**
   * @return the data columns.
   */
  public final ImmutableList<Column<?>> getDataColumns() {
    return columns;
  }

  /**
   * @param column the column.
   * @param row the row.
   * @return the boxed value, or null.
   */
  @Nullable
  public final Object getObject(final int column, final int row) {
    return columns.get(column).getObject(row);
  }

  /**
   * @return the Schema of the tuples in this batch.
   */
  public final Schema getSchema() {
    return schema;
  }

  /**
   * @return the number of columns.
   */
  public final int numColumns() {
    return schema.numColumns();
  }

  /**
   * @return the number of valid tuples in this batch.
   */
  public final int numTuples() {
    return numTuples;
  }

  /**
   * @return the tag of this batch, or null.
   */
  @Nullable
  public final Integer getTag() {
    return tag;
  }

  /**
   * @return true if there is at least one column and all of them are broadcast scalars.
   */
  public final boolean isScalar() {
    if (columns.isEmpty()) {
      return false;
    }
    for (Column<?> c : columns) {
      if (!c.isConstant()) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return the rows of this batch as lists of boxed values.
   */
  public final List<List<Object>> toRows() {
    List<List<Object>> rows = new ArrayList<>(numTuples);
    for (int row = 0; row < numTuples; ++row) {
      List<Object> r = new ArrayList<>(columns.size());
      for (Column<?> c : columns) {
        r.add(c.getObject(row));
      }
      rows.add(r);
    }
    return rows;
  }

  /**
   * Value equality: same column types, same rows and same tag. Column names and whether a column is broadcast do not
   * matter.
   */
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TupleBatch)) {
      return false;
    }
    TupleBatch other = (TupleBatch) o;
    return numTuples == other.numTuples
        && schema.getColumnTypes().equals(other.schema.getColumnTypes())
        && Objects.equals(tag, other.tag)
        && toRows().equals(other.toRows());
  }

  @Override
  public int hashCode() {
    return Objects.hash(schema.getColumnTypes(), tag, toRows());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("TupleBatch").append(schema).append(toRows());
    if (tag != null) {
      sb.append(" #").append(tag);
    }
    return sb.toString();
  }
}
