package edu.washington.escience.rivulet.util.concurrent;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import net.jcip.annotations.ThreadSafe;

/**
 * Counts delivered items against a total that may only become known later, and reports completion exactly once.
 * Each of {@link #increment()}, {@link #setTotal(int)} and {@link #cancel()} returns true to the single caller whose
 * call completed the count.
 */
@ThreadSafe
public final class CompletionCounter {

  /** Value of {@link #total} while unknown. */
  private static final int UNKNOWN = -1;

  /** Number of items delivered so far. */
  private final AtomicInteger count = new AtomicInteger(0);

  /** Number of items expected, or {@link #UNKNOWN}. */
  private final AtomicInteger total = new AtomicInteger(UNKNOWN);

  /** Set once by whoever completes the count. */
  private final AtomicBoolean complete = new AtomicBoolean(false);

  /**
   * Records one delivered item.
   *
   * @return true if this call completed the count.
   */
  public boolean increment() {
    int delivered = count.incrementAndGet();
    int expected = total.get();
    if (expected != UNKNOWN && delivered == expected) {
      return complete.compareAndSet(false, true);
    }
    return false;
  }

  /**
   * Records the total number of items to expect.
   *
   * @param expected the total.
   * @return true if this call completed the count.
   */
  public boolean setTotal(final int expected) {
    total.set(expected);
    if (count.get() == expected) {
      return complete.compareAndSet(false, true);
    }
    return false;
  }

  /**
   * Completes the count regardless of the items delivered.
   *
   * @return true if the count was not already complete.
   */
  public boolean cancel() {
    return complete.compareAndSet(false, true);
  }

  /**
   * @return true once the count has completed or been cancelled.
   */
  public boolean isComplete() {
    return complete.get();
  }

  /**
   * @return number of items delivered so far.
   */
  public int getCount() {
    return count.get();
  }
}
