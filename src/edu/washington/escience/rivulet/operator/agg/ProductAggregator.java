package edu.washington.escience.rivulet.operator.agg;

import com.google.common.math.LongMath;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.StatusCode;
import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;

/**
 * Product of a numeric column. Integer inputs multiply into a long and fail on overflow.
 */
final class ProductAggregator extends ScalarAggregator {

  /** Whether the input is an integer type. */
  private final boolean integral;

  /** The product of integer inputs. */
  private long longProduct = 1;

  /** The product of double inputs. */
  private double doubleProduct = 1;

  /**
   * @param inputType the input type, numeric.
   * @param options the options.
   */
  ProductAggregator(final Type inputType, final ScalarAggregateOptions options) {
    super(options);
    integral = inputType.isInteger();
  }

  @Override
  protected void consumeValue(final Column<?> input, final int row) throws DbException {
    if (integral) {
      longProduct = checkedMultiply(longProduct, input.getIntegralAsLong(row));
    } else {
      doubleProduct *= input.getDouble(row);
    }
  }

  @Override
  protected void mergeValue(final ScalarAggregator other) throws DbException {
    ProductAggregator state = (ProductAggregator) other;
    longProduct = checkedMultiply(longProduct, state.longProduct);
    doubleProduct *= state.doubleProduct;
  }

  @Override
  protected Object finalizeValue() {
    if (integral) {
      return longProduct;
    }
    return doubleProduct;
  }

  @Override
  public Type getOutputType() {
    return integral ? Type.LONG_TYPE : Type.DOUBLE_TYPE;
  }

  /**
   * @param a a factor.
   * @param b a factor.
   * @return the product.
   * @throws DbException EXECUTION_ERROR on overflow.
   */
  private static long checkedMultiply(final long a, final long b) throws DbException {
    try {
      return LongMath.checkedMultiply(a, b);
    } catch (ArithmeticException e) {
      throw new DbException(StatusCode.EXECUTION_ERROR, "Overflow in product", e);
    }
  }
}
