package edu.washington.escience.rivulet.util.concurrent;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;

import edu.washington.escience.rivulet.RivuletConstants;

/**
 * Factory methods for the thread pools the engine runs on.
 */
public final class ExecutorUtils {

  /** Utility class cannot be instantiated. */
  private ExecutorUtils() {}

  /**
   * @return a fixed pool of {@link RivuletConstants#DEFAULT_CPU_POOL_SIZE} named worker threads.
   */
  public static ListeningExecutorService newCpuThreadPool() {
    return newCpuThreadPool(RivuletConstants.DEFAULT_CPU_POOL_SIZE);
  }

  /**
   * @param numThreads the number of threads.
   * @return a fixed pool of named worker threads.
   */
  public static ListeningExecutorService newCpuThreadPool(final int numThreads) {
    Preconditions.checkArgument(numThreads > 0, "numThreads must be positive");
    ExecutorService pool =
        Executors.newFixedThreadPool(
            numThreads, new RenamingThreadFactory(RivuletConstants.CPU_THREAD_NAME_PREFIX));
    return MoreExecutors.listeningDecorator(pool);
  }
}
