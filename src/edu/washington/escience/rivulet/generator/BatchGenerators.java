package edu.washington.escience.rivulet.generator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import com.google.common.util.concurrent.Uninterruptibles;

import edu.washington.escience.rivulet.storage.TupleBatch;

/**
 * Factory methods and combinators for {@link BatchGenerator}s.
 */
public final class BatchGenerators {

  /** Utility class cannot be instantiated. */
  private BatchGenerators() {}

  /**
   * @param batches the batches.
   * @return a generator yielding the given batches in order, each one already available.
   */
  public static BatchGenerator fromIterable(final Iterable<TupleBatch> batches) {
    final Iterator<TupleBatch> it = batches.iterator();
    return () -> {
      synchronized (it) {
        return Futures.immediateFuture(it.hasNext() ? Optional.of(it.next()) : Optional.<TupleBatch>empty());
      }
    };
  }

  /**
   * A generator whose batches are produced on a background executor, emulating upstream decode work.
   *
   * @param batches the batches.
   * @param executor where each batch is produced.
   * @param delayMillis artificial latency before each batch, 0 for none.
   * @return the generator.
   */
  public static BatchGenerator background(
      final Iterable<TupleBatch> batches, final Executor executor, final long delayMillis) {
    Objects.requireNonNull(executor, "executor");
    Preconditions.checkArgument(delayMillis >= 0, "delayMillis must be non-negative");
    final Iterator<TupleBatch> it = batches.iterator();
    return () ->
        Futures.submit(
            () -> {
              if (delayMillis > 0) {
                Uninterruptibles.sleepUninterruptibly(delayMillis, TimeUnit.MILLISECONDS);
              }
              synchronized (it) {
                return it.hasNext() ? Optional.of(it.next()) : Optional.<TupleBatch>empty();
              }
            },
            executor);
  }

  /**
   * @param generator the generator.
   * @param executor the executor on which the futures of the returned generator complete.
   * @return a generator with the same items, whose completions run on {@code executor}.
   */
  public static BatchGenerator transferred(final BatchGenerator generator, final Executor executor) {
    return () -> Futures.transform(generator.next(), x -> x, executor);
  }

  /**
   * @param generator the generator.
   * @param function applied to each batch.
   * @return a generator yielding the mapped batches.
   */
  public static BatchGenerator mapped(
      final BatchGenerator generator, final Function<TupleBatch, TupleBatch> function) {
    return () ->
        Futures.transform(
            generator.next(), item -> item.map(function::apply), MoreExecutors.directExecutor());
  }

  /**
   * Drains a generator.
   *
   * @param generator the generator.
   * @return a future holding all the batches, in order, or the first failure.
   */
  public static ListenableFuture<List<TupleBatch>> collect(final BatchGenerator generator) {
    final SettableFuture<List<TupleBatch>> result = SettableFuture.create();
    new Collector(generator, result).run();
    return result;
  }

  /**
   * Pulls a generator to exhaustion, looping while futures are already done and resuming from a listener when one is
   * not, so that long runs of ready batches do not grow the stack.
   */
  private static final class Collector implements Runnable {
    /** The generator. */
    private final BatchGenerator generator;
    /** Where the batches end up. */
    private final SettableFuture<List<TupleBatch>> result;
    /** The batches so far. */
    private final List<TupleBatch> batches = new ArrayList<>();
    /** The outstanding request, or null. */
    private ListenableFuture<Optional<TupleBatch>> pending;

    /**
     * @param generator the generator.
     * @param result where the batches end up.
     */
    Collector(final BatchGenerator generator, final SettableFuture<List<TupleBatch>> result) {
      this.generator = generator;
      this.result = result;
    }

    @Override
    public synchronized void run() {
      while (true) {
        if (pending == null) {
          pending = generator.next();
          if (!pending.isDone()) {
            pending.addListener(this, MoreExecutors.directExecutor());
            return;
          }
        }
        final Optional<TupleBatch> item;
        try {
          item = Futures.getDone(pending);
        } catch (ExecutionException e) {
          result.setException(e.getCause());
          return;
        } catch (CancellationException e) {
          result.setException(e);
          return;
        }
        pending = null;
        if (!item.isPresent()) {
          result.set(ImmutableList.copyOf(batches));
          return;
        }
        batches.add(item.get());
      }
    }
  }
}
