package edu.washington.escience.rivulet.operator.agg;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Random;

import org.junit.Test;

import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;
import edu.washington.escience.rivulet.column.ConstantValueColumn;
import edu.washington.escience.rivulet.column.builder.ColumnBuilder;
import edu.washington.escience.rivulet.column.builder.ColumnFactory;

public class VarStdAggregatorTest {

  private static final double EPSILON = 1e-12;

  private static Column<?> ints(final Integer... values) {
    ColumnBuilder<?> builder = ColumnFactory.allocateColumn(Type.INT_TYPE);
    for (Integer value : values) {
      builder.appendObject(value);
    }
    return builder.build();
  }

  @Test
  public void testScalarAndArrayMix() {
    VarStdAggregator variance = new VarStdAggregator(Type.INT_TYPE, false, VarianceOptions.defaults());
    VarStdAggregator stddev = new VarStdAggregator(Type.INT_TYPE, true, VarianceOptions.defaults());
    for (VarStdAggregator agg : new VarStdAggregator[] {variance, stddev}) {
      agg.consume(new ConstantValueColumn(5, Type.INT_TYPE, 4));
      agg.consume(ints(6, null, 7));
      agg.consume(new ConstantValueColumn(null, Type.INT_TYPE, 2));
    }
    assertEquals(6, variance.getState().count);
    assertEquals(5.5, variance.getState().mean, EPSILON);
    assertEquals(0.5833333333333334, (Double) variance.finalizeResult(), EPSILON);
    assertEquals(0.7637626158259734, (Double) stddev.finalizeResult(), EPSILON);
  }

  @Test
  public void testDdof() {
    VarStdAggregator agg = new VarStdAggregator(Type.DOUBLE_TYPE, false, new VarianceOptions(2));
    assertNull(agg.finalizeResult());
    ColumnBuilder<?> builder = ColumnFactory.allocateColumn(Type.DOUBLE_TYPE);
    agg.consume(builder.appendDouble(1.0).appendDouble(2.0).build());
    assertNull(agg.finalizeResult());
    agg.consume(new ConstantValueColumn(3.0, Type.DOUBLE_TYPE, 1));
    // m2 = 2, n - ddof = 1
    assertEquals(2.0, (Double) agg.finalizeResult(), EPSILON);
  }

  @Test
  public void testChunkedIntegers() {
    Column<?> values = ints(2, 4, 3, null, 1, 5, 3, 100, -7);
    VarStdAggregator whole = new VarStdAggregator(Type.INT_TYPE, false, VarianceOptions.defaults());
    whole.consume(values);
    for (long chunk = 1; chunk <= 4; ++chunk) {
      VarStdAggregator chunked = new VarStdAggregator(Type.INT_TYPE, false, VarianceOptions.defaults(), chunk);
      chunked.consume(values);
      assertEquals(whole.getState().count, chunked.getState().count);
      assertEquals((Double) whole.finalizeResult(), (Double) chunked.finalizeResult(), 1e-9);
    }
  }

  @Test
  public void testLargeIntegersAreExact() {
    Column<?> values = ints(Integer.MAX_VALUE, Integer.MAX_VALUE - 1, Integer.MAX_VALUE - 2);
    VarStdAggregator agg = new VarStdAggregator(Type.INT_TYPE, false, new VarianceOptions(1));
    agg.consume(values);
    assertEquals(1.0, (Double) agg.finalizeResult(), EPSILON);

    ColumnBuilder<?> longs = ColumnFactory.allocateColumn(Type.LONG_TYPE);
    longs.appendLong(Long.MAX_VALUE).appendLong(Long.MAX_VALUE - 2);
    VarStdAggregator longAgg = new VarStdAggregator(Type.LONG_TYPE, false, VarianceOptions.defaults());
    longAgg.consume(longs.build());
    assertEquals(Long.MAX_VALUE - 1.0, longAgg.getState().mean, 1e3);
  }

  @Test
  public void testRandomMerges() {
    Random random = new Random(42);
    for (int trial = 0; trial < 20; ++trial) {
      int n = 1 + random.nextInt(500);
      double[] data = new double[n];
      ColumnBuilder<?> all = ColumnFactory.allocateColumn(Type.DOUBLE_TYPE);
      for (int i = 0; i < n; ++i) {
        data[i] = random.nextGaussian() * 1000 + 50;
        all.appendDouble(data[i]);
      }
      VarStdAggregator whole = new VarStdAggregator(Type.DOUBLE_TYPE, true, VarianceOptions.defaults());
      whole.consume(all.build());

      VarStdAggregator merged = new VarStdAggregator(Type.DOUBLE_TYPE, true, VarianceOptions.defaults());
      int start = 0;
      while (start < n) {
        int end = Math.min(n, start + 1 + random.nextInt(50));
        ColumnBuilder<?> piece = ColumnFactory.allocateColumn(Type.DOUBLE_TYPE);
        for (int i = start; i < end; ++i) {
          piece.appendDouble(data[i]);
        }
        VarStdAggregator local = new VarStdAggregator(Type.DOUBLE_TYPE, true, VarianceOptions.defaults());
        local.consume(piece.build());
        merged.mergeFrom(local);
        start = end;
      }
      double expected = (Double) whole.finalizeResult();
      assertEquals(expected, (Double) merged.finalizeResult(), Math.abs(expected) * 1e-9);
    }
  }
}
