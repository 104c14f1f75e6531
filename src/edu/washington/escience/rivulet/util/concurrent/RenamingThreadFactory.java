package edu.washington.escience.rivulet.util.concurrent;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates daemon worker threads named {@code <prefix>#<n>}, counting from 0. Exceptions that escape a task are logged
 * rather than printed to stderr.
 */
public class RenamingThreadFactory implements ThreadFactory {

  /** The logger for this class. */
  private static final org.slf4j.Logger LOGGER =
      org.slf4j.LoggerFactory.getLogger(RenamingThreadFactory.class);

  /** Shared by every thread this factory names. */
  private final String namePrefix;
  /** Next thread number. */
  private final AtomicInteger nextId = new AtomicInteger();

  /**
   * @param namePrefix shared by every thread this factory names.
   */
  public RenamingThreadFactory(final String namePrefix) {
    this.namePrefix = namePrefix;
  }

  @Override
  public Thread newThread(final Runnable task) {
    final Thread worker = new Thread(task, namePrefix + "#" + nextId.getAndIncrement());
    worker.setDaemon(true);
    worker.setUncaughtExceptionHandler(
        (thread, cause) -> LOGGER.error("Worker {} died with an uncaught exception", thread.getName(), cause));
    return worker;
  }
}
