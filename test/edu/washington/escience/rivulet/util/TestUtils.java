package edu.washington.escience.rivulet.util;

import static org.junit.Assert.assertEquals;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;
import edu.washington.escience.rivulet.column.builder.ColumnBuilder;
import edu.washington.escience.rivulet.column.builder.ColumnFactory;
import edu.washington.escience.rivulet.storage.TupleBatch;

public final class TestUtils {

  /** How long a test waits on a future before giving up. */
  public static final long TIMEOUT_SECONDS = 60;

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private TestUtils() {}

  /**
   * Build a batch from a JSON array of rows, e.g. {@code [[null, true], [4, false]]}.
   *
   * @param schema the schema of the batch.
   * @param json the rows.
   * @return the batch.
   */
  public static TupleBatch batchFromJson(final Schema schema, final String json) {
    final JsonNode rows;
    try {
      rows = MAPPER.readTree(json);
    } catch (IOException e) {
      throw new IllegalArgumentException("bad JSON batch: " + json, e);
    }
    Preconditions.checkArgument(rows.isArray(), "a batch is an array of rows");
    List<ColumnBuilder<?>> builders = ColumnFactory.allocateColumns(schema);
    for (JsonNode row : rows) {
      Preconditions.checkArgument(row.size() == schema.numColumns(), "row %s does not match %s", row, schema);
      for (int c = 0; c < schema.numColumns(); ++c) {
        append(builders.get(c), schema.getColumnType(c), row.get(c));
      }
    }
    ImmutableList.Builder<Column<?>> columns = ImmutableList.builder();
    for (ColumnBuilder<?> builder : builders) {
      columns.add(builder.build());
    }
    return new TupleBatch(schema, columns.build());
  }

  /**
   * @param types the column types, named {@code f0, f1, ...}.
   * @param json the rows.
   * @return the batch.
   */
  public static TupleBatch batchFromJson(final List<Type> types, final String json) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (int i = 0; i < types.size(); ++i) {
      names.add("f" + i);
    }
    return batchFromJson(Schema.of(types, names.build()), json);
  }

  private static void append(final ColumnBuilder<?> builder, final Type type, final JsonNode value) {
    if (value == null || value.isNull()) {
      builder.appendNull();
      return;
    }
    switch (type) {
      case BOOLEAN_TYPE:
        builder.appendBoolean(value.booleanValue());
        break;
      case INT_TYPE:
        builder.appendInt(value.intValue());
        break;
      case LONG_TYPE:
        builder.appendLong(value.longValue());
        break;
      case DOUBLE_TYPE:
        builder.appendDouble(value.doubleValue());
        break;
      case STRING_TYPE:
        builder.appendString(value.textValue());
        break;
      default:
        throw new IllegalArgumentException("unsupported type " + type);
    }
  }

  /**
   * Random batches of an (int, boolean) schema, each tagged with its index so that batches stay distinguishable.
   *
   * @param schema an (int, boolean) schema.
   * @param numBatches the number of batches.
   * @param batchSize the rows per batch.
   * @param seed the random seed.
   * @return the batches.
   */
  public static List<TupleBatch> randomIntBoolBatches(
      final Schema schema, final int numBatches, final int batchSize, final long seed) {
    Random random = new Random(seed);
    List<TupleBatch> ret = new ArrayList<>();
    for (int b = 0; b < numBatches; ++b) {
      List<ColumnBuilder<?>> builders = ColumnFactory.allocateColumns(schema);
      for (int row = 0; row < batchSize; ++row) {
        if (random.nextInt(10) == 0) {
          builders.get(0).appendNull();
        } else {
          builders.get(0).appendInt(random.nextInt());
        }
        builders.get(1).appendBoolean(random.nextBoolean());
      }
      ret.add(
          new TupleBatch(
              schema, ImmutableList.of(builders.get(0).build(), builders.get(1).build()), batchSize, b));
    }
    return ret;
  }

  /**
   * @param future the future.
   * @param <T> the value type.
   * @return the value of the future, waiting at most {@link #TIMEOUT_SECONDS}.
   * @throws Exception the failure of the future, unwrapped.
   */
  public static <T> T await(final ListenableFuture<T> future) throws Exception {
    try {
      return future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof Exception) {
        throw (Exception) e.getCause();
      }
      throw e;
    } catch (TimeoutException e) {
      throw new AssertionError("timed out waiting for " + future, e);
    }
  }

  /**
   * @param future the future.
   * @return the failure of the future, as a {@link DbException}.
   */
  public static DbException awaitFailure(final ListenableFuture<?> future) {
    try {
      await(future);
    } catch (DbException e) {
      return e;
    } catch (Exception e) {
      return DbException.wrap(e);
    }
    throw new AssertionError("expected " + future + " to fail");
  }

  /**
   * Compare collections of batches ignoring order.
   *
   * @param expected the expected batches.
   * @param actual the actual batches.
   */
  public static void assertBatchesEqualIgnoringOrder(
      final Collection<TupleBatch> expected, final Collection<TupleBatch> actual) {
    assertEquals(HashMultiset.create(expected), HashMultiset.create(actual));
  }

  /**
   * Compare the rows of collections of batches ignoring order of both batches and rows.
   *
   * @param expected the expected batches.
   * @param actual the actual batches.
   */
  public static void assertRowsEqualIgnoringOrder(
      final Collection<TupleBatch> expected, final Collection<TupleBatch> actual) {
    HashMultiset<List<Object>> expectedRows = HashMultiset.create();
    for (TupleBatch batch : expected) {
      expectedRows.addAll(batch.toRows());
    }
    HashMultiset<List<Object>> actualRows = HashMultiset.create();
    for (TupleBatch batch : actual) {
      actualRows.addAll(batch.toRows());
    }
    assertEquals(expectedRows, actualRows);
  }
}
