package edu.washington.escience.rivulet.operator.agg;

import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;

/**
 * Counts the non-null values of a column, or its nulls when nulls are not skipped. The result is never null.
 */
final class CountAggregator implements Aggregator {

  /** Whether to count non-null values (true) or nulls (false). */
  private final boolean countValid;

  /** The count so far. */
  private long count = 0;

  /**
   * @param options the options.
   */
  CountAggregator(final ScalarAggregateOptions options) {
    countValid = options.getSkipNulls();
  }

  @Override
  public void consume(final Column<?> input) {
    final int nulls = input.nullCount();
    count += countValid ? input.size() - nulls : nulls;
  }

  @Override
  public void mergeFrom(final Aggregator other) {
    count += AggUtils.sameKernel(other, CountAggregator.class).count;
  }

  @Override
  public Object finalizeResult() {
    return count;
  }

  @Override
  public Type getOutputType() {
    return Type.LONG_TYPE;
  }
}
