package edu.washington.escience.rivulet.util;

import static org.junit.Assert.assertEquals;

import java.math.BigInteger;
import java.util.Random;

import org.junit.Test;

public class Int128AccumulatorTest {

  @Test
  public void testSumsPastLongRange() {
    Int128Accumulator acc = new Int128Accumulator();
    for (int i = 0; i < 4; ++i) {
      acc.add(Long.MAX_VALUE);
    }
    assertEquals(BigInteger.valueOf(Long.MAX_VALUE).multiply(BigInteger.valueOf(4)), acc.toBigInteger());
    for (int i = 0; i < 8; ++i) {
      acc.add(Long.MIN_VALUE);
    }
    BigInteger expected =
        BigInteger.valueOf(Long.MAX_VALUE)
            .multiply(BigInteger.valueOf(4))
            .add(BigInteger.valueOf(Long.MIN_VALUE).multiply(BigInteger.valueOf(8)));
    assertEquals(expected, acc.toBigInteger());
    assertEquals(expected.toString(), acc.toString());
  }

  @Test
  public void testProducts() {
    Int128Accumulator acc = new Int128Accumulator();
    acc.addProduct(Long.MAX_VALUE, Long.MAX_VALUE).addProduct(Long.MIN_VALUE, 3).addProduct(-7, -9);
    BigInteger expected =
        BigInteger.valueOf(Long.MAX_VALUE)
            .pow(2)
            .add(BigInteger.valueOf(Long.MIN_VALUE).multiply(BigInteger.valueOf(3)))
            .add(BigInteger.valueOf(63));
    assertEquals(expected, acc.toBigInteger());
    assertEquals(expected.doubleValue(), acc.doubleValue(), 0.0);
  }

  @Test
  public void testRandomMerge() {
    Random random = new Random(7);
    Int128Accumulator left = new Int128Accumulator();
    Int128Accumulator right = new Int128Accumulator();
    BigInteger expected = BigInteger.ZERO;
    for (int i = 0; i < 1000; ++i) {
      long a = random.nextLong();
      long b = random.nextLong();
      (i % 2 == 0 ? left : right).add(a).addProduct(a, b);
      expected = expected.add(BigInteger.valueOf(a)).add(BigInteger.valueOf(a).multiply(BigInteger.valueOf(b)));
    }
    assertEquals(expected, left.add(right).toBigInteger());
  }
}
