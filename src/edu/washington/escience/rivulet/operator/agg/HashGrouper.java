package edu.washington.escience.rivulet.operator.agg;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.eclipse.collections.api.iterator.IntIterator;
import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;
import org.eclipse.collections.impl.map.mutable.primitive.IntObjectHashMap;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.column.Column;
import edu.washington.escience.rivulet.column.builder.ColumnBuilder;
import edu.washington.escience.rivulet.column.builder.ColumnFactory;
import edu.washington.escience.rivulet.storage.TupleBatch;
import edu.washington.escience.rivulet.util.HashUtils;

/**
 * A {@link Grouper} backed by a hash table from key hash codes to the group ids carrying that hash. Null is an
 * ordinary key value.
 */
public final class HashGrouper implements Grouper {

  /** The schema of the key columns. */
  private final Schema keySchema;

  /** Map from hash codes to group ids. */
  private final IntObjectHashMap<IntArrayList> keyHashCodesToGroups = new IntObjectHashMap<>();

  /** The key of each group, boxed, indexed by group id. */
  private final List<Object[]> groupKeys = new ArrayList<>();

  /** The key of each group, columnar, for {@link #getUniques()}. */
  private final List<ColumnBuilder<?>> uniques;

  /**
   * @param keySchema the schema of the key columns.
   */
  public HashGrouper(final Schema keySchema) {
    this.keySchema = Objects.requireNonNull(keySchema, "keySchema");
    uniques = ColumnFactory.allocateColumns(keySchema);
  }

  @Override
  public int[] consume(final List<? extends Column<?>> keys) throws DbException {
    if (keys.size() != keySchema.numColumns()) {
      throw DbException.invalid("Expected %s key columns, got %s", keySchema.numColumns(), keys.size());
    }
    for (int c = 0; c < keys.size(); ++c) {
      if (keys.get(c).getType() != keySchema.getColumnType(c)) {
        throw DbException.invalid(
            "Key column %s has type %s, expected %s", c, keys.get(c).getType(), keySchema.getColumnType(c));
      }
    }
    final int numRows = keys.isEmpty() ? 0 : keys.get(0).size();
    final int[] ids = new int[numRows];
    for (int row = 0; row < numRows; ++row) {
      ids[row] = findOrInsert(keys, row);
    }
    return ids;
  }

  /**
   * @param keys the key columns.
   * @param row the row.
   * @return the group id of the row's key.
   */
  private int findOrInsert(final List<? extends Column<?>> keys, final int row) {
    final Object[] key = new Object[keys.size()];
    for (int c = 0; c < key.length; ++c) {
      key[c] = keys.get(c).getObject(row);
    }
    final int hashcode = HashUtils.hashSubRow(keys, row);
    IntArrayList groups = keyHashCodesToGroups.get(hashcode);
    if (groups == null) {
      groups = new IntArrayList();
      keyHashCodesToGroups.put(hashcode, groups);
    } else {
      IntIterator iter = groups.intIterator();
      while (iter.hasNext()) {
        int group = iter.next();
        if (Arrays.equals(groupKeys.get(group), key)) {
          return group;
        }
      }
    }
    final int group = groupKeys.size();
    groups.add(group);
    groupKeys.add(key);
    for (int c = 0; c < key.length; ++c) {
      uniques.get(c).appendFrom(keys.get(c), row);
    }
    return group;
  }

  @Override
  public TupleBatch getUniques() {
    ImmutableList.Builder<Column<?>> columns = ImmutableList.builder();
    for (ColumnBuilder<?> builder : uniques) {
      columns.add(builder.build());
    }
    return new TupleBatch(keySchema, columns.build(), groupKeys.size(), null);
  }

  @Override
  public int numGroups() {
    return groupKeys.size();
  }

  /**
   * @return the schema of the key columns.
   */
  public Schema getKeySchema() {
    return keySchema;
  }
}
