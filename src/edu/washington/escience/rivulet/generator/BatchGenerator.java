package edu.washington.escience.rivulet.generator;

import java.util.Optional;

import com.google.common.util.concurrent.ListenableFuture;

import edu.washington.escience.rivulet.storage.TupleBatch;

/**
 * A lazy, asynchronous, finite sequence of batches. Each call to {@link #next()} yields a future for the next batch;
 * an empty {@link Optional} marks the end of the sequence and a failed future marks an error. A caller must not ask
 * for the next batch before the previous future has completed.
 */
@FunctionalInterface
public interface BatchGenerator {

  /**
   * @return a future for the next batch, empty at the end of the sequence.
   */
  ListenableFuture<Optional<TupleBatch>> next();
}
