package edu.washington.escience.rivulet.generator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntConsumer;

import javax.annotation.Nullable;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;

import edu.washington.escience.rivulet.storage.TupleBatch;

import net.jcip.annotations.GuardedBy;
import net.jcip.annotations.ThreadSafe;

/**
 * A {@link BatchGenerator} fed by a producer: batches pushed in come out of {@link #next()} in push order. Queued
 * batches are still delivered after {@link #close()} or {@link #fail(Throwable)}; the end-of-stream or the failure
 * follows them. Futures are completed outside the internal lock.
 */
@ThreadSafe
public final class PushGenerator implements BatchGenerator {

  /** Guards the fields below. */
  private final Object lock = new Object();

  /** Batches pushed but not consumed. */
  @GuardedBy("lock")
  private final Deque<TupleBatch> queue = new ArrayDeque<>();

  /** Consumers waiting for a batch. */
  @GuardedBy("lock")
  private final Deque<SettableFuture<Optional<TupleBatch>>> waiters = new ArrayDeque<>();

  /** Set once no further batches will be pushed. */
  @GuardedBy("lock")
  private boolean closed = false;

  /** The failure, if the producer failed. */
  @GuardedBy("lock")
  private Throwable error = null;

  /** Called with the remaining queue size after a consumer takes a queued batch. */
  @Nullable private final IntConsumer consumedListener;

  /** A generator with no consumption listener. */
  public PushGenerator() {
    this(null);
  }

  /**
   * @param consumedListener called, outside the lock, with the queue size after each queued batch is consumed.
   */
  public PushGenerator(@Nullable final IntConsumer consumedListener) {
    this.consumedListener = consumedListener;
  }

  /**
   * @param batch the batch.
   * @return the number of batches queued after this push, or -1 if the generator is already closed.
   */
  public int push(final TupleBatch batch) {
    Objects.requireNonNull(batch, "batch");
    final SettableFuture<Optional<TupleBatch>> waiter;
    final int size;
    synchronized (lock) {
      if (closed) {
        return -1;
      }
      waiter = waiters.poll();
      if (waiter == null) {
        queue.add(batch);
      }
      size = queue.size();
    }
    if (waiter != null) {
      waiter.set(Optional.of(batch));
    }
    return size;
  }

  /**
   * Ends the sequence after the queued batches. Idempotent.
   */
  public void close() {
    for (SettableFuture<Optional<TupleBatch>> waiter : terminate(null)) {
      waiter.set(Optional.<TupleBatch>empty());
    }
  }

  /**
   * Fails the sequence after the queued batches. Ignored if already closed.
   *
   * @param cause the failure.
   */
  public void fail(final Throwable cause) {
    Objects.requireNonNull(cause, "cause");
    for (SettableFuture<Optional<TupleBatch>> waiter : terminate(cause)) {
      waiter.setException(cause);
    }
  }

  /**
   * @param cause the failure, or null for a clean end.
   * @return the waiters to complete.
   */
  private List<SettableFuture<Optional<TupleBatch>>> terminate(@Nullable final Throwable cause) {
    synchronized (lock) {
      if (closed) {
        return new ArrayList<>();
      }
      closed = true;
      error = cause;
      List<SettableFuture<Optional<TupleBatch>>> toComplete = new ArrayList<>(waiters);
      waiters.clear();
      return toComplete;
    }
  }

  @Override
  public ListenableFuture<Optional<TupleBatch>> next() {
    final TupleBatch batch;
    final int remaining;
    synchronized (lock) {
      batch = queue.poll();
      remaining = queue.size();
      if (batch == null) {
        if (error != null) {
          return Futures.immediateFailedFuture(error);
        }
        if (closed) {
          return Futures.immediateFuture(Optional.<TupleBatch>empty());
        }
        SettableFuture<Optional<TupleBatch>> waiter = SettableFuture.create();
        waiters.add(waiter);
        return waiter;
      }
    }
    if (consumedListener != null) {
      consumedListener.accept(remaining);
    }
    return Futures.immediateFuture(Optional.of(batch));
  }

  /**
   * @return the number of batches queued.
   */
  public int size() {
    synchronized (lock) {
      return queue.size();
    }
  }

  /**
   * @return true once the sequence has been closed or failed.
   */
  public boolean isClosed() {
    synchronized (lock) {
      return closed;
    }
  }
}
