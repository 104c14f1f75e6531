package edu.washington.escience.rivulet.operator.agg;

import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;

/**
 * Minimum or maximum of a column of any type. The result has the input type.
 */
final class MinMaxAggregator extends ScalarAggregator {

  /** The input type. */
  private final Type type;

  /** True for min, false for max. */
  private final boolean min;

  /** The extreme so far, or null if nothing was consumed. */
  private Comparable<Object> extreme = null;

  /**
   * @param type the input type.
   * @param min true for min, false for max.
   * @param options the options.
   */
  MinMaxAggregator(final Type type, final boolean min, final ScalarAggregateOptions options) {
    super(options);
    this.type = type;
    this.min = min;
  }

  @Override
  protected void consumeValue(final Column<?> input, final int row) {
    offer(input.getObject(row));
  }

  @Override
  protected void consumeRepeated(final Column<?> input, final int repeat) {
    offer(input.getObject(0));
  }

  @Override
  protected void mergeValue(final ScalarAggregator other) {
    MinMaxAggregator state = (MinMaxAggregator) other;
    if (state.extreme != null) {
      offer(state.extreme);
    }
  }

  /**
   * @param value a non-null value.
   */
  @SuppressWarnings("unchecked")
  private void offer(final Object value) {
    if (extreme == null) {
      extreme = (Comparable<Object>) value;
      return;
    }
    int cmp = extreme.compareTo(value);
    if (min ? cmp > 0 : cmp < 0) {
      extreme = (Comparable<Object>) value;
    }
  }

  @Override
  protected Object finalizeValue() {
    return extreme;
  }

  @Override
  public Type getOutputType() {
    return type;
  }
}
