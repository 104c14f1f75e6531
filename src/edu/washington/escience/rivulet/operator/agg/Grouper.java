package edu.washington.escience.rivulet.operator.agg;

import java.util.List;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.column.Column;
import edu.washington.escience.rivulet.storage.TupleBatch;

/**
 * Assigns dense, zero-based group ids to composite keys. Ids are handed out in first-seen order and are never reused
 * or renumbered. Not thread-safe.
 */
public interface Grouper {

  /**
   * Map each row's key to its group id, assigning new ids to keys not seen before.
   *
   * @param keys the key columns, matching the grouper's key schema.
   * @return the group id of each row.
   * @throws DbException INVALID if the columns do not match the key schema.
   */
  int[] consume(List<? extends Column<?>> keys) throws DbException;

  /**
   * @return one row per group, in group id order.
   */
  TupleBatch getUniques();

  /**
   * @return the number of groups seen so far.
   */
  int numGroups();
}
