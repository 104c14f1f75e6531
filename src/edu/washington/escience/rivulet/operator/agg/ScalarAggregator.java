package edu.washington.escience.rivulet.operator.agg;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.column.Column;

/**
 * Base of the kernels that follow {@link ScalarAggregateOptions}: the result is null when fewer than
 * {@code minCount} non-null values were seen, or when nulls are not skipped and a null was seen.
 */
abstract class ScalarAggregator implements Aggregator {

  /** The options. */
  protected final ScalarAggregateOptions options;

  /** Number of non-null values consumed. */
  protected long count = 0;

  /** Whether any null was consumed. */
  protected boolean hasNull = false;

  /**
   * @param options the options.
   */
  protected ScalarAggregator(final ScalarAggregateOptions options) {
    this.options = options;
  }

  @Override
  public final void consume(final Column<?> input) throws DbException {
    final int nulls = input.nullCount();
    hasNull |= nulls > 0;
    final int valid = input.size() - nulls;
    if (valid == 0) {
      return;
    }
    count += valid;
    if (input.isConstant()) {
      consumeRepeated(input, valid);
      return;
    }
    for (int row = 0; row < input.size(); ++row) {
      if (!input.isNull(row)) {
        consumeValue(input, row);
      }
    }
  }

  @Override
  public final void mergeFrom(final Aggregator other) throws DbException {
    ScalarAggregator state = AggUtils.sameKernel(other, getClass());
    count += state.count;
    hasNull |= state.hasNull;
    mergeValue(state);
  }

  @Override
  public Object finalizeResult() throws DbException {
    if ((!options.getSkipNulls() && hasNull) || count < options.getMinCount()) {
      return null;
    }
    return finalizeValue();
  }

  /**
   * @param input the column.
   * @param row a non-null row.
   * @throws DbException if the update fails.
   */
  protected abstract void consumeValue(Column<?> input, int row) throws DbException;

  /**
   * Consume the value in row 0 of a broadcast column {@code repeat} times.
   *
   * @param input the broadcast column.
   * @param repeat how many times its value occurs.
   * @throws DbException if the update fails.
   */
  protected void consumeRepeated(final Column<?> input, final int repeat) throws DbException {
    for (int i = 0; i < repeat; ++i) {
      consumeValue(input, 0);
    }
  }

  /**
   * @param other a state of the same class.
   * @throws DbException if the merge fails.
   */
  protected abstract void mergeValue(ScalarAggregator other) throws DbException;

  /**
   * @return the aggregate of a state that passed the null checks.
   * @throws DbException if the result cannot be computed.
   */
  protected abstract Object finalizeValue() throws DbException;
}
