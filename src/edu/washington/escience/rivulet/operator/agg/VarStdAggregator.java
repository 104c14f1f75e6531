package edu.washington.escience.rivulet.operator.agg;

import java.math.BigInteger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;
import edu.washington.escience.rivulet.column.ConstantValueColumn;
import edu.washington.escience.rivulet.util.Int128Accumulator;

/**
 * Variance or standard deviation of a numeric column. Nulls are skipped.
 *
 * <p>
 * Double and long inputs use the two-pass algorithm: an exact sum (128-bit for longs) gives the mean, then the squared
 * deviations from it are summed. Int inputs use one pass of integer arithmetic over chunks short enough that the
 * running sum cannot overflow a long, and each chunk's state is merged into the total.
 */
final class VarStdAggregator implements Aggregator {

  /** Whether to finalize to the standard deviation rather than the variance. */
  private final boolean stddev;

  /** Delta degrees of freedom. */
  private final int ddof;

  /** The input type. */
  private final Type inputType;

  /** Maximum chunk length of the one-pass integer path. */
  private final long maxChunkLength;

  /** The running state. */
  private final VarStdState state = new VarStdState();

  /**
   * @param inputType the input type, numeric.
   * @param stddev true for stddev, false for variance.
   * @param options the options.
   */
  VarStdAggregator(final Type inputType, final boolean stddev, final VarianceOptions options) {
    this(inputType, stddev, options, defaultChunkLength(inputType));
  }

  /**
   * @param inputType the input type.
   * @return the longest run of values of that type whose sum provably fits in a long.
   */
  private static long defaultChunkLength(final Type inputType) {
    if (inputType == Type.INT_TYPE) {
      return 1L << (Long.SIZE - 1 - inputType.getBitWidth());
    }
    return Long.MAX_VALUE;
  }

  /**
   * @param inputType the input type, numeric.
   * @param stddev true for stddev, false for variance.
   * @param options the options.
   * @param maxChunkLength maximum chunk length of the one-pass integer path.
   */
  @VisibleForTesting
  VarStdAggregator(
      final Type inputType, final boolean stddev, final VarianceOptions options, final long maxChunkLength) {
    Preconditions.checkArgument(inputType.isNumeric(), "not numeric: %s", inputType);
    Preconditions.checkArgument(maxChunkLength > 0, "maxChunkLength must be positive");
    this.inputType = inputType;
    this.stddev = stddev;
    ddof = options.getDdof();
    this.maxChunkLength = maxChunkLength;
  }

  @Override
  public void consume(final Column<?> input) {
    if (input.isConstant()) {
      consumeScalar((ConstantValueColumn) input);
    } else if (inputType == Type.INT_TYPE) {
      consumeIntegers(input);
    } else {
      consumeTwoPass(input);
    }
  }

  /**
   * A broadcast value contributes its repetition count, its value as the mean, and no spread.
   *
   * @param input the broadcast column.
   */
  private void consumeScalar(final ConstantValueColumn input) {
    if (input.getValue() == null || input.size() == 0) {
      return;
    }
    state.mergeFrom(new VarStdState(input.size(), ((Number) input.getValue()).doubleValue(), 0));
  }

  /**
   * @param input a double or long column.
   */
  private void consumeTwoPass(final Column<?> input) {
    final long count = input.size() - input.nullCount();
    if (count == 0) {
      return;
    }
    final double mean;
    if (inputType == Type.DOUBLE_TYPE) {
      double sum = 0;
      for (int row = 0; row < input.size(); ++row) {
        if (!input.isNull(row)) {
          sum += input.getDouble(row);
        }
      }
      mean = sum / count;
    } else {
      Int128Accumulator sum = new Int128Accumulator();
      for (int row = 0; row < input.size(); ++row) {
        if (!input.isNull(row)) {
          sum.add(input.getLong(row));
        }
      }
      mean = sum.doubleValue() / count;
    }
    double m2 = 0;
    for (int row = 0; row < input.size(); ++row) {
      if (!input.isNull(row)) {
        final double d = input.getNumericAsDouble(row) - mean;
        m2 += d * d;
      }
    }
    state.mergeFrom(new VarStdState(count, mean, m2));
  }

  /**
   * @param input an int column.
   */
  private void consumeIntegers(final Column<?> input) {
    for (long start = 0; start < input.size(); start += maxChunkLength) {
      final int end = (int) Math.min(input.size(), start + maxChunkLength);
      IntegerMoments moments = new IntegerMoments();
      for (int row = (int) start; row < end; ++row) {
        if (!input.isNull(row)) {
          moments.add(input.getInt(row));
        }
      }
      if (moments.count > 0) {
        state.mergeFrom(new VarStdState(moments.count, moments.mean(), moments.m2()));
      }
    }
  }

  @Override
  public void mergeFrom(final Aggregator other) {
    state.mergeFrom(AggUtils.sameKernel(other, VarStdAggregator.class).state);
  }

  @Override
  public Object finalizeResult() {
    if (state.count <= ddof) {
      return null;
    }
    final double variance = state.m2 / (state.count - ddof);
    return stddev ? Math.sqrt(variance) : variance;
  }

  @Override
  public Type getOutputType() {
    return Type.DOUBLE_TYPE;
  }

  /**
   * @return the running state.
   */
  @VisibleForTesting
  VarStdState getState() {
    return state;
  }

  /**
   * Exact count, sum and sum of squares of a chunk of ints.
   */
  private static final class IntegerMoments {
    /** Number of values. */
    private long count = 0;
    /** Sum of the values, bounded by the chunk length. */
    private long sum = 0;
    /** Sum of the squared values. */
    private final Int128Accumulator squareSum = new Int128Accumulator();

    /**
     * @param value the value.
     */
    void add(final int value) {
      sum += value;
      squareSum.addProduct(value, value);
      count++;
    }

    /**
     * @return the mean.
     */
    double mean() {
      return (double) sum / count;
    }

    /**
     * {@code m2 = squareSum - sum * sum / count}, with the division split into its integer quotient and its remainder
     * so that only the fractional part is rounded.
     *
     * @return the sum of squared deviations from the mean.
     */
    double m2() {
      final BigInteger bigCount = BigInteger.valueOf(count);
      final BigInteger sumSquare = BigInteger.valueOf(sum).multiply(BigInteger.valueOf(sum));
      final BigInteger[] quotientAndRemainder = sumSquare.divideAndRemainder(bigCount);
      final double fractions = quotientAndRemainder[1].doubleValue() / count;
      return squareSum.toBigInteger().subtract(quotientAndRemainder[0]).doubleValue() - fractions;
    }
  }
}
