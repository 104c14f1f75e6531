package edu.washington.escience.rivulet.operator.agg;

import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;

/**
 * {@code any} or {@code all} of a boolean column. When nulls are not skipped, the result follows Kleene logic: a null
 * makes the result null unless a value already decides it.
 */
final class BooleanAggregator extends ScalarAggregator {

  /** True for any, false for all. */
  private final boolean any;

  /** Whether a true value was seen. */
  private boolean seenTrue = false;

  /** Whether a false value was seen. */
  private boolean seenFalse = false;

  /**
   * @param any true for any, false for all.
   * @param options the options.
   */
  BooleanAggregator(final boolean any, final ScalarAggregateOptions options) {
    super(options);
    this.any = any;
  }

  @Override
  protected void consumeValue(final Column<?> input, final int row) {
    if (input.getBoolean(row)) {
      seenTrue = true;
    } else {
      seenFalse = true;
    }
  }

  @Override
  protected void consumeRepeated(final Column<?> input, final int repeat) {
    consumeValue(input, 0);
  }

  @Override
  protected void mergeValue(final ScalarAggregator other) {
    BooleanAggregator state = (BooleanAggregator) other;
    seenTrue |= state.seenTrue;
    seenFalse |= state.seenFalse;
  }

  @Override
  public Object finalizeResult() {
    if (count < options.getMinCount()) {
      return null;
    }
    final boolean result = any ? seenTrue : !seenFalse;
    /* an undecided result with a null in the input is unknown */
    if (!options.getSkipNulls() && hasNull && result != any) {
      return null;
    }
    return result;
  }

  @Override
  protected Object finalizeValue() {
    return any ? seenTrue : !seenFalse;
  }

  @Override
  public Type getOutputType() {
    return Type.BOOLEAN_TYPE;
  }
}
