package edu.washington.escience.rivulet.generator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.Test;

import com.google.common.util.concurrent.ListenableFuture;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.StatusCode;
import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.storage.TupleBatch;
import edu.washington.escience.rivulet.util.TestUtils;

public class PushGeneratorTest {

  private static TupleBatch batch(final int value) {
    return TestUtils.batchFromJson(Arrays.asList(Type.INT_TYPE), "[[" + value + "]]");
  }

  @Test
  public void testPushThenPull() throws Exception {
    List<Integer> consumed = new ArrayList<>();
    PushGenerator generator = new PushGenerator(consumed::add);
    assertEquals(1, generator.push(batch(1)));
    assertEquals(2, generator.push(batch(2)));
    assertEquals(2, generator.size());

    assertEquals(Optional.of(batch(1)), TestUtils.await(generator.next()));
    assertEquals(Optional.of(batch(2)), TestUtils.await(generator.next()));
    assertEquals(Arrays.asList(1, 0), consumed);
    assertEquals(0, generator.size());
  }

  @Test
  public void testPullThenPush() throws Exception {
    PushGenerator generator = new PushGenerator();
    ListenableFuture<Optional<TupleBatch>> first = generator.next();
    ListenableFuture<Optional<TupleBatch>> second = generator.next();
    assertFalse(first.isDone());
    assertEquals(0, generator.push(batch(1)));
    assertTrue(first.isDone());
    assertFalse(second.isDone());
    assertEquals(Optional.of(batch(1)), TestUtils.await(first));

    generator.close();
    assertEquals(Optional.empty(), TestUtils.await(second));
  }

  @Test
  public void testCloseDeliversQueuedBatchesFirst() throws Exception {
    PushGenerator generator = new PushGenerator();
    generator.push(batch(1));
    generator.close();
    generator.close();
    assertTrue(generator.isClosed());
    assertEquals(-1, generator.push(batch(2)));
    assertEquals(Arrays.asList(batch(1)), TestUtils.await(BatchGenerators.collect(generator)));
    assertEquals(Optional.empty(), TestUtils.await(generator.next()));
  }

  @Test
  public void testFailAfterQueuedBatches() throws Exception {
    PushGenerator generator = new PushGenerator();
    ListenableFuture<Optional<TupleBatch>> waiting = generator.next();
    DbException cause = DbException.ioError("Artificial error");
    generator.push(batch(1));
    generator.push(batch(2));
    generator.fail(cause);
    generator.close();

    assertEquals(Optional.of(batch(1)), TestUtils.await(waiting));
    assertEquals(Optional.of(batch(2)), TestUtils.await(generator.next()));
    DbException e = TestUtils.awaitFailure(generator.next());
    assertSame(cause, e);
    assertEquals(StatusCode.IO_ERROR, e.getCode());
  }

  @Test
  public void testFailWakesWaiters() {
    PushGenerator generator = new PushGenerator();
    ListenableFuture<Optional<TupleBatch>> waiting = generator.next();
    generator.fail(DbException.ioError("Artificial error"));
    assertEquals("Artificial error", TestUtils.awaitFailure(waiting).getMessage());
  }
}
