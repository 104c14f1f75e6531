package edu.washington.escience.rivulet.util;

import java.math.BigInteger;

/**
 * A signed 128-bit integer accumulator made of two longs, used to sum 64-bit values (or their squares) without
 * overflow. Not thread-safe.
 */
public final class Int128Accumulator {
  /** The upper 64 bits, two's complement. */
  private long high;
  /** The lower 64 bits, treated as unsigned. */
  private long low;

  /** An accumulator holding zero. */
  public Int128Accumulator() {
    this(0L, 0L);
  }

  /**
   * @param high the upper 64 bits.
   * @param low the lower 64 bits.
   */
  private Int128Accumulator(final long high, final long low) {
    this.high = high;
    this.low = low;
  }

  /**
   * Adds a signed 64-bit value.
   *
   * @param value the value.
   * @return this accumulator.
   */
  public Int128Accumulator add(final long value) {
    final long newLow = low + value;
    high += (value < 0 ? -1 : 0) + (Long.compareUnsigned(newLow, low) < 0 ? 1 : 0);
    low = newLow;
    return this;
  }

  /**
   * Adds the exact product of two signed 64-bit values.
   *
   * @param a the first factor.
   * @param b the second factor.
   * @return this accumulator.
   */
  public Int128Accumulator addProduct(final long a, final long b) {
    final long productLow = a * b;
    final long productHigh = Math.multiplyHigh(a, b);
    final long newLow = low + productLow;
    high += productHigh + (Long.compareUnsigned(newLow, low) < 0 ? 1 : 0);
    low = newLow;
    return this;
  }

  /**
   * Adds another accumulator.
   *
   * @param other the other accumulator.
   * @return this accumulator.
   */
  public Int128Accumulator add(final Int128Accumulator other) {
    final long newLow = low + other.low;
    high += other.high + (Long.compareUnsigned(newLow, low) < 0 ? 1 : 0);
    low = newLow;
    return this;
  }

  /**
   * @return the exact value.
   */
  public BigInteger toBigInteger() {
    return BigInteger.valueOf(high)
        .shiftLeft(Long.SIZE)
        .add(new BigInteger(Long.toUnsignedString(low)));
  }

  /**
   * @return the value, rounded to a double.
   */
  public double doubleValue() {
    return toBigInteger().doubleValue();
  }

  @Override
  public String toString() {
    return toBigInteger().toString();
  }
}
