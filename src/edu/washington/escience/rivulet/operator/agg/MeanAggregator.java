package edu.washington.escience.rivulet.operator.agg;

import edu.washington.escience.rivulet.Type;

/**
 * Arithmetic mean of a numeric column, always a double.
 */
final class MeanAggregator extends SumAggregator {

  /**
   * @param inputType the input type, numeric.
   * @param options the options.
   */
  MeanAggregator(final Type inputType, final ScalarAggregateOptions options) {
    super(inputType, options);
  }

  @Override
  protected Object finalizeValue() {
    if (count == 0) {
      return null;
    }
    final double sum = integral ? (double) longSum : doubleSum;
    return sum / count;
  }

  @Override
  public Type getOutputType() {
    return Type.DOUBLE_TYPE;
  }
}
