package edu.washington.escience.rivulet.operator.agg;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;

/**
 * The running state of one aggregate over one group (or over the whole input). A state is fed by
 * {@link #consume(Column)} and {@link #mergeFrom(Aggregator)} in any interleaving, and read once by
 * {@link #finalizeResult()}. Consuming a column gives the same result as consuming it into a fresh state and merging
 * that state in. Not thread-safe: callers serialize access.
 */
public interface Aggregator {

  /**
   * Update the aggregate state with every row of a column. A broadcast column counts once per row.
   *
   * @param input the input values.
   * @throws DbException if the update fails, e.g. on integer overflow.
   */
  void consume(@Nonnull Column<?> input) throws DbException;

  /**
   * Fold another state of the same kernel into this one.
   *
   * @param other the other state. It is not modified.
   * @throws DbException if the merge fails, e.g. on integer overflow.
   */
  void mergeFrom(@Nonnull Aggregator other) throws DbException;

  /**
   * @return the aggregate value, boxed as {@link #getOutputType()} describes, or null.
   * @throws DbException if the result cannot be computed.
   */
  @Nullable
  Object finalizeResult() throws DbException;

  /**
   * @return the type of the finalized value.
   */
  Type getOutputType();
}
