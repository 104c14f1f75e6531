package edu.washington.escience.rivulet.operator.agg;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Test;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.StatusCode;
import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;
import edu.washington.escience.rivulet.column.ConstantValueColumn;
import edu.washington.escience.rivulet.column.builder.ColumnBuilder;
import edu.washington.escience.rivulet.column.builder.ColumnFactory;

/**
 * Each kernel, fed in two pieces that are merged, must match the expected value.
 */
public class AggregateFunctionsTest {

  private static final ScalarAggregateOptions KEEP_NULLS = new ScalarAggregateOptions(false, 0);

  private static Column<?> column(final Type type, final Object... values) {
    ColumnBuilder<?> builder = ColumnFactory.allocateColumn(type);
    for (Object value : values) {
      builder.appendObject(value);
    }
    return builder.build();
  }

  /**
   * Consume the first half of the values into one state and the second half into another, then merge.
   */
  private static Object aggregate(
      final String function, final FunctionOptions options, final Type type, final Object... values)
      throws DbException {
    AggregatorFactory factory = AggregateFunctions.get(function).getFactory(type, options);
    Aggregator left = factory.get();
    Aggregator right = factory.get();
    int half = values.length / 2;
    left.consume(column(type, Arrays.copyOfRange(values, 0, half)));
    right.consume(column(type, Arrays.copyOfRange(values, half, values.length)));
    left.mergeFrom(right);
    return left.finalizeResult();
  }

  private static Object aggregate(final String function, final Type type, final Object... values)
      throws DbException {
    return aggregate(function, (FunctionOptions) null, type, values);
  }

  @Test
  public void testCount() throws DbException {
    assertEquals(3L, aggregate("count", Type.STRING_TYPE, "a", null, "b", null, "c"));
    assertEquals(2L, aggregate("count", KEEP_NULLS, Type.STRING_TYPE, "a", null, "b", null, "c"));
    assertEquals(0L, aggregate("count", Type.INT_TYPE));
  }

  @Test
  public void testSumAndProduct() throws DbException {
    assertEquals(6L, aggregate("sum", Type.INT_TYPE, 1, 2, null, 3));
    assertEquals(-0.5, aggregate("sum", Type.DOUBLE_TYPE, 0.5, -1.0));
    assertNull(aggregate("sum", Type.LONG_TYPE));
    assertNull(aggregate("sum", Type.LONG_TYPE, null, null));
    assertNull(aggregate("sum", KEEP_NULLS, Type.INT_TYPE, 1, null));
    assertEquals(0L, aggregate("sum", KEEP_NULLS, Type.INT_TYPE));
    assertNull(aggregate("sum", new ScalarAggregateOptions(true, 3), Type.INT_TYPE, 1, null, 2));
    assertEquals(-24L, aggregate("product", Type.LONG_TYPE, 2L, -3L, null, 4L));
    assertEquals(1.5, aggregate("product", Type.DOUBLE_TYPE, 0.5, 3.0));
  }

  @Test
  public void testMean() throws DbException {
    assertEquals(2.0, aggregate("mean", Type.INT_TYPE, 1, null, 2, 3));
    assertEquals(0.25, aggregate("mean", Type.DOUBLE_TYPE, 0.5, 0.0));
    assertNull(aggregate("mean", Type.INT_TYPE, (Object) null));
  }

  @Test
  public void testMinMax() throws DbException {
    assertEquals(-3, aggregate("min", Type.INT_TYPE, 4, null, -3, 7));
    assertEquals(7, aggregate("max", Type.INT_TYPE, 4, null, -3, 7));
    assertEquals("alfa", aggregate("min", Type.STRING_TYPE, "gama", "alfa", "beta"));
    assertEquals("gama", aggregate("max", Type.STRING_TYPE, "gama", "alfa", "beta"));
    assertEquals(true, aggregate("max", Type.BOOLEAN_TYPE, false, true));
    assertNull(aggregate("min", Type.DOUBLE_TYPE));
  }

  @Test
  public void testAnyAll() throws DbException {
    assertEquals(true, aggregate("any", Type.BOOLEAN_TYPE, false, null, true));
    assertEquals(false, aggregate("all", Type.BOOLEAN_TYPE, false, null, true));
    assertEquals(true, aggregate("all", Type.BOOLEAN_TYPE, true, null, true));
    assertNull(aggregate("all", Type.BOOLEAN_TYPE));
    // Kleene: an undecided result with a null is unknown
    assertNull(aggregate("any", KEEP_NULLS, Type.BOOLEAN_TYPE, false, null));
    assertEquals(true, aggregate("any", KEEP_NULLS, Type.BOOLEAN_TYPE, true, null));
    assertNull(aggregate("all", KEEP_NULLS, Type.BOOLEAN_TYPE, null, true));
    assertEquals(false, aggregate("all", KEEP_NULLS, Type.BOOLEAN_TYPE, false, null));
  }

  @Test
  public void testVarianceAndStddev() throws DbException {
    assertEquals(
        1.6666666666666667, (Double) aggregate("variance", Type.INT_TYPE, 2, 4, 3, null, 1, 5, 3), 1e-12);
    assertEquals(
        2.0,
        (Double) aggregate("variance", new VarianceOptions(1), Type.LONG_TYPE, 2L, 4L, 3L, 1L, 5L, 3L),
        1e-12);
    assertEquals(
        1.2909944487358056, (Double) aggregate("stddev", Type.DOUBLE_TYPE, 2.0, 4.0, 3.0, 1.0, 5.0, 3.0), 1e-12);
    assertNull(aggregate("variance", new VarianceOptions(2), Type.INT_TYPE, 1, 2));
  }

  @Test
  public void testTDigest() throws DbException {
    Object[] values = new Object[101];
    for (int i = 0; i <= 100; ++i) {
      values[i] = i;
    }
    double median = (Double) aggregate("tdigest", Type.INT_TYPE, values);
    assertEquals(50.0, median, 1.0);
    double p90 = (Double) aggregate("tdigest", new TDigestOptions(0.9, 100, 500), Type.INT_TYPE, values);
    assertEquals(90.0, p90, 1.5);
    assertNull(aggregate("tdigest", Type.DOUBLE_TYPE));
  }

  @Test
  public void testBroadcastColumn() throws DbException {
    AggregatorFactory sum = AggregateFunctions.get("sum").getFactory(Type.INT_TYPE, null);
    Aggregator state = sum.get();
    state.consume(new ConstantValueColumn(5, Type.INT_TYPE, 4));
    state.consume(new ConstantValueColumn(null, Type.INT_TYPE, 3));
    assertEquals(20L, state.finalizeResult());

    Aggregator count = AggregateFunctions.get("count").getFactory(Type.INT_TYPE, null).get();
    count.consume(new ConstantValueColumn(5, Type.INT_TYPE, 4));
    assertEquals(4L, count.finalizeResult());
  }

  @Test
  public void testOverflow() throws DbException {
    AggregatorFactory sum = AggregateFunctions.get("sum").getFactory(Type.LONG_TYPE, null);
    Aggregator state = sum.get();
    try {
      state.consume(column(Type.LONG_TYPE, Long.MAX_VALUE, 1L));
      fail("the sum overflows");
    } catch (DbException e) {
      assertEquals(StatusCode.EXECUTION_ERROR, e.getCode());
    }
  }

  @Test
  public void testOutputTypes() throws DbException {
    assertEquals(Type.LONG_TYPE, AggregateFunctions.get("count").getFactory(Type.STRING_TYPE, null).getOutputType());
    assertEquals(Type.LONG_TYPE, AggregateFunctions.get("hash_sum").getFactory(Type.INT_TYPE, null).getOutputType());
    assertEquals(Type.DOUBLE_TYPE, AggregateFunctions.get("sum").getFactory(Type.DOUBLE_TYPE, null).getOutputType());
    assertEquals(Type.DOUBLE_TYPE, AggregateFunctions.get("mean").getFactory(Type.LONG_TYPE, null).getOutputType());
    assertEquals(Type.STRING_TYPE, AggregateFunctions.get("min").getFactory(Type.STRING_TYPE, null).getOutputType());
    assertEquals(Type.DOUBLE_TYPE, AggregateFunctions.get("stddev").getFactory(Type.INT_TYPE, null).getOutputType());
  }

  @Test
  public void testUnsupportedTypes() {
    String[][] unsupported = {
      {"sum", "STRING_TYPE"}, {"mean", "BOOLEAN_TYPE"}, {"product", "STRING_TYPE"}, {"any", "INT_TYPE"},
      {"all", "STRING_TYPE"}, {"variance", "STRING_TYPE"}, {"tdigest", "BOOLEAN_TYPE"},
    };
    for (String[] pair : unsupported) {
      try {
        AggregateFunctions.get(pair[0]).getFactory(Type.valueOf(pair[1]), null);
        fail(pair[0] + " of " + pair[1]);
      } catch (DbException e) {
        assertEquals(pair[0], StatusCode.NOT_IMPLEMENTED, e.getCode());
      }
    }
  }

  @Test
  public void testUnknownFunction() {
    try {
      AggregateFunctions.get("hash_median");
      fail("there is no median");
    } catch (DbException e) {
      assertEquals(StatusCode.INVALID, e.getCode());
    }
  }

  @Test
  public void testWrongOptions() {
    try {
      AggregateFunctions.get("variance").getFactory(Type.INT_TYPE, ScalarAggregateOptions.defaults());
      fail("variance takes variance options");
    } catch (DbException e) {
      assertEquals(StatusCode.INVALID, e.getCode());
    }
  }

  @Test
  public void testRegistry() throws DbException {
    int n = 0;
    for (String name : AggregateFunctions.getFunctionNames()) {
      AggregateFunction function = AggregateFunctions.get(name);
      assertEquals(name, function.getName());
      assertEquals(function, AggregateFunctions.get(AggregateFunctions.GROUPED_PREFIX + name));
      assertTrue(!function.getDoc().isEmpty());
      ++n;
    }
    assertEquals(11, n);
  }
}
