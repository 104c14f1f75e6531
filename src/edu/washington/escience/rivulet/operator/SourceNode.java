package edu.washington.escience.rivulet.operator;

import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.generator.BatchGenerator;
import edu.washington.escience.rivulet.storage.TupleBatch;

import net.jcip.annotations.GuardedBy;

/**
 * Pulls batches from a {@link BatchGenerator} and pushes them to its consumer, one request at a time. Batches that are
 * already available are handled in a loop; otherwise the loop resumes on the plan's executor once the batch arrives.
 */
public final class SourceNode extends ExecNode {

  /** The logger for this class. */
  private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(SourceNode.class);

  /** The generator. */
  private final BatchGenerator generator;

  /** The number of batches emitted so far, which is also the next sequence number. */
  private final AtomicInteger batchCount = new AtomicInteger(0);

  /** Set once the end of the stream, the stop or the failure has been reported. */
  private final AtomicBoolean completed = new AtomicBoolean(false);

  /** Guards the fields below. */
  private final Object lock = new Object();

  /** Whether a stop was requested. */
  @GuardedBy("lock")
  private boolean stopRequested = false;

  /** Whether the consumer asked for a pause. */
  @GuardedBy("lock")
  private boolean paused = false;

  /** Whether the pull loop is running or waiting on an outstanding request. */
  @GuardedBy("lock")
  private boolean pulling = false;

  /** Whether the node was started. */
  @GuardedBy("lock")
  private boolean started = false;

  /**
   * @param plan the plan.
   * @param label the label, or null.
   * @param options the schema and generator.
   */
  private SourceNode(final ExecPlan plan, @Nullable final String label, final SourceNodeOptions options) {
    super(plan, label, ImmutableList.<ExecNode>of(), ImmutableList.<String>of(), options.getSchema(), 1);
    generator = options.getGenerator();
  }

  /**
   * @param plan the plan.
   * @param label the label, or null.
   * @param options the schema and generator.
   * @return the node, added to the plan.
   */
  static SourceNode make(final ExecPlan plan, @Nullable final String label, final SourceNodeOptions options) {
    return plan.addNode(new SourceNode(plan, label, options));
  }

  @Override
  public String getKindName() {
    return ExecNodes.SOURCE;
  }

  @Override
  protected void startProducing() throws DbException {
    synchronized (lock) {
      if (stopRequested || started) {
        return;
      }
      started = true;
      if (paused) {
        return;
      }
      pulling = true;
    }
    pullLoop();
  }

  /**
   * Request batches until the stream ends, a request is still outstanding, or the node is paused or stopped.
   */
  private void pullLoop() {
    while (true) {
      final boolean stop;
      final boolean halt;
      synchronized (lock) {
        stop = stopRequested;
        halt = stop || paused;
        if (halt) {
          pulling = false;
        }
      }
      if (halt) {
        if (stop) {
          finishStopped();
        }
        return;
      }

      final ListenableFuture<Optional<TupleBatch>> next;
      try {
        next = generator.next();
      } catch (RuntimeException e) {
        fail(e);
        return;
      }
      if (!next.isDone()) {
        next.addListener(
            () -> {
              if (handle(next)) {
                pullLoop();
              }
            },
            getPlan().getExecutor());
        return;
      }
      if (!handle(next)) {
        return;
      }
    }
  }

  /**
   * Deal with one completed request.
   *
   * @param next the completed request.
   * @return true if the loop should request another batch.
   */
  private boolean handle(final ListenableFuture<Optional<TupleBatch>> next) {
    final Optional<TupleBatch> item;
    try {
      item = Futures.getDone(next);
    } catch (ExecutionException e) {
      fail(e.getCause());
      return false;
    } catch (CancellationException e) {
      fail(e);
      return false;
    }
    if (!item.isPresent()) {
      if (completed.compareAndSet(false, true)) {
        LOGGER.debug("Source {} exhausted after {} batches", getLabel(), batchCount.get());
        emitFinished(batchCount.get());
        markFinished();
      }
      return false;
    }
    final boolean stop;
    synchronized (lock) {
      stop = stopRequested;
      if (stop) {
        pulling = false;
      }
    }
    if (stop) {
      finishStopped();
      return false;
    }
    emitBatch(batchCount.getAndIncrement(), item.get());
    return true;
  }

  /**
   * Report a generator failure downstream and fail this node.
   *
   * @param error the failure.
   */
  private void fail(final Throwable error) {
    synchronized (lock) {
      pulling = false;
    }
    if (completed.compareAndSet(false, true)) {
      LOGGER.warn("Source {} failed after {} batches", getLabel(), batchCount.get(), error);
      emitError(error);
      markFailed(error);
    }
  }

  /** Tell the consumer how many batches were emitted before the stop, and complete this node. */
  private void finishStopped() {
    if (completed.compareAndSet(false, true)) {
      emitFinished(batchCount.get());
      markStopped();
    }
  }

  @Override
  public void pauseProducing(final ExecNode output) {
    synchronized (lock) {
      paused = true;
    }
  }

  @Override
  public void resumeProducing(final ExecNode output) {
    synchronized (lock) {
      paused = false;
      if (!started || pulling || stopRequested) {
        return;
      }
      pulling = true;
    }
    pullLoop();
  }

  @Override
  public void stopProducing() {
    final boolean idle;
    synchronized (lock) {
      if (stopRequested) {
        return;
      }
      stopRequested = true;
      idle = !pulling;
    }
    if (idle) {
      finishStopped();
    }
  }

  @Override
  public void inputReceived(final ExecNode input, final int seq, final TupleBatch batch) {
    throw new IllegalStateException("a source has no inputs");
  }

  @Override
  public void errorReceived(final ExecNode input, final Throwable error) {
    throw new IllegalStateException("a source has no inputs");
  }

  @Override
  public void inputFinished(final ExecNode input, final int seqStop) {
    throw new IllegalStateException("a source has no inputs");
  }
}
