package edu.washington.escience.rivulet.generator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.storage.TupleBatch;
import edu.washington.escience.rivulet.util.TestUtils;
import edu.washington.escience.rivulet.util.concurrent.ExecutorUtils;

public class BatchGeneratorsTest {

  private static ExecutorService executor;

  @BeforeClass
  public static void setUp() {
    executor = ExecutorUtils.newCpuThreadPool(2);
  }

  @AfterClass
  public static void tearDown() {
    executor.shutdownNow();
  }

  private static List<TupleBatch> batches(final int n) {
    List<TupleBatch> ret = new ArrayList<>();
    for (int i = 0; i < n; ++i) {
      ret.add(TestUtils.batchFromJson(Arrays.asList(Type.INT_TYPE), "[[" + i + "], [" + (i * 10) + "]]"));
    }
    return ret;
  }

  @Test
  public void testFromIterable() throws Exception {
    BatchGenerator generator = BatchGenerators.fromIterable(batches(3));
    assertEquals(batches(3), TestUtils.await(BatchGenerators.collect(generator)));
    assertEquals(Optional.empty(), TestUtils.await(generator.next()));
  }

  @Test
  public void testBackground() throws Exception {
    BatchGenerator generator = BatchGenerators.background(batches(5), executor, 1);
    assertEquals(batches(5), TestUtils.await(BatchGenerators.collect(generator)));
  }

  @Test
  public void testLongReadyRunDoesNotOverflowStack() throws Exception {
    List<TupleBatch> many = new ArrayList<>();
    TupleBatch one = batches(1).get(0);
    for (int i = 0; i < 100000; ++i) {
      many.add(one);
    }
    assertEquals(100000, TestUtils.await(BatchGenerators.collect(BatchGenerators.fromIterable(many))).size());
  }

  @Test
  public void testTransferred() throws Exception {
    final AtomicInteger ran = new AtomicInteger();
    BatchGenerator generator =
        BatchGenerators.transferred(
            BatchGenerators.fromIterable(batches(2)),
            command -> {
              ran.incrementAndGet();
              command.run();
            });
    assertEquals(batches(2), TestUtils.await(BatchGenerators.collect(generator)));
    assertTrue(ran.get() >= 3);
  }

  @Test
  public void testMapped() throws Exception {
    BatchGenerator generator = BatchGenerators.mapped(BatchGenerators.fromIterable(batches(3)), b -> b.withTag(9));
    List<TupleBatch> result = TestUtils.await(BatchGenerators.collect(generator));
    assertEquals(3, result.size());
    for (int i = 0; i < 3; ++i) {
      assertEquals(batches(3).get(i).withTag(9), result.get(i));
    }
  }

  @Test
  public void testCollectFailure() {
    final AtomicInteger calls = new AtomicInteger();
    final List<TupleBatch> two = batches(2);
    BatchGenerator generator =
        () -> {
          int call = calls.getAndIncrement();
          if (call < two.size()) {
            return Futures.immediateFuture(Optional.of(two.get(call)));
          }
          ListenableFuture<Optional<TupleBatch>> failed =
              Futures.immediateFailedFuture(DbException.ioError("Artificial error"));
          return failed;
        };
    assertEquals("Artificial error", TestUtils.awaitFailure(BatchGenerators.collect(generator)).getMessage());
  }
}
