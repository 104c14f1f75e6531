package edu.washington.escience.rivulet.operator.agg;

import com.google.common.math.LongMath;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.StatusCode;
import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;

/**
 * Sum of a numeric column. Integer inputs sum into a long and fail on overflow; double inputs sum into a double.
 */
class SumAggregator extends ScalarAggregator {

  /** Whether the input is an integer type. */
  protected final boolean integral;

  /** The sum of integer inputs. */
  protected long longSum = 0;

  /** The sum of double inputs. */
  protected double doubleSum = 0;

  /**
   * @param inputType the input type, numeric.
   * @param options the options.
   */
  SumAggregator(final Type inputType, final ScalarAggregateOptions options) {
    super(options);
    integral = inputType.isInteger();
  }

  @Override
  protected void consumeValue(final Column<?> input, final int row) throws DbException {
    if (integral) {
      longSum = checkedAdd(longSum, input.getIntegralAsLong(row));
    } else {
      doubleSum += input.getDouble(row);
    }
  }

  @Override
  protected void consumeRepeated(final Column<?> input, final int repeat) throws DbException {
    if (integral) {
      try {
        longSum = checkedAdd(longSum, LongMath.checkedMultiply(input.getIntegralAsLong(0), repeat));
      } catch (ArithmeticException e) {
        throw new DbException(StatusCode.EXECUTION_ERROR, "Overflow in sum", e);
      }
    } else {
      doubleSum += input.getDouble(0) * repeat;
    }
  }

  @Override
  protected void mergeValue(final ScalarAggregator other) throws DbException {
    SumAggregator state = (SumAggregator) other;
    longSum = checkedAdd(longSum, state.longSum);
    doubleSum += state.doubleSum;
  }

  @Override
  protected Object finalizeValue() throws DbException {
    if (integral) {
      return longSum;
    }
    return doubleSum;
  }

  @Override
  public Type getOutputType() {
    return integral ? Type.LONG_TYPE : Type.DOUBLE_TYPE;
  }

  /**
   * @param a a summand.
   * @param b a summand.
   * @return the sum.
   * @throws DbException EXECUTION_ERROR on overflow.
   */
  private static long checkedAdd(final long a, final long b) throws DbException {
    try {
      return LongMath.checkedAdd(a, b);
    } catch (ArithmeticException e) {
      throw new DbException(StatusCode.EXECUTION_ERROR, "Overflow in sum", e);
    }
  }
}
