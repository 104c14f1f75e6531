package edu.washington.escience.rivulet.operator;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.generator.PushGenerator;
import edu.washington.escience.rivulet.storage.TupleBatch;
import edu.washington.escience.rivulet.util.concurrent.CompletionCounter;

/**
 * Hands the batches reaching the end of a plan to the caller through a {@link PushGenerator}. The generator ends once
 * every input batch has been delivered, and fails if an input fails. With a positive high-water mark the sink pauses
 * its input while that many batches wait to be consumed, and resumes it once no more than the low-water mark remain.
 */
public final class SinkNode extends ExecNode {

  /** The logger for this class. */
  private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(SinkNode.class);

  /** The generator the caller consumes. */
  private final PushGenerator generator;

  /** Counts delivered batches against the input's total. */
  private final CompletionCounter inputCounter = new CompletionCounter();

  /** Queue size that pauses the input, 0 to never pause. */
  private final int highWaterMark;

  /** Queue size that resumes a paused input. */
  private final int lowWaterMark;

  /** Whether the input is paused. */
  private final AtomicBoolean paused = new AtomicBoolean(false);

  /**
   * @param plan the plan.
   * @param label the label, or null.
   * @param input the input.
   */
  private SinkNode(final ExecPlan plan, @Nullable final String label, final ExecNode input) {
    super(plan, label, ImmutableList.of(input), ImmutableList.of("collected"), null, 0);
    generator = new PushGenerator(this::batchConsumed);
    highWaterMark = plan.getSinkHighWaterMark();
    lowWaterMark = Math.min(plan.getSinkLowWaterMark(), Math.max(0, highWaterMark - 1));
  }

  /**
   * @param plan the plan.
   * @param label the label, or null.
   * @param inputs the inputs, exactly one.
   * @param options receives the generator of the new sink.
   * @return the node, added to the plan.
   * @throws DbException INVALID if there is not exactly one input.
   */
  static SinkNode make(
      final ExecPlan plan,
      @Nullable final String label,
      final List<ExecNode> inputs,
      final SinkNodeOptions options)
      throws DbException {
    ExecNodes.checkInputCount(ExecNodes.SINK, inputs, 1);
    SinkNode node = plan.addNode(new SinkNode(plan, label, inputs.get(0)));
    options.setGenerator(node.generator);
    return node;
  }

  @Override
  public String getKindName() {
    return ExecNodes.SINK;
  }

  @Override
  protected void startProducing() throws DbException {}

  @Override
  public void stopProducing() {
    if (inputCounter.cancel()) {
      generator.close();
      markStopped();
    }
    stopInputs();
  }

  @Override
  public void inputReceived(final ExecNode input, final int seq, final TupleBatch batch) {
    if (inputCounter.isComplete()) {
      return;
    }
    int queued = generator.push(batch);
    if (highWaterMark > 0 && queued >= highWaterMark && paused.compareAndSet(false, true)) {
      LOGGER.trace("Sink {} pausing its input with {} batches queued", getLabel(), queued);
      input.pauseProducing(this);
    }
    if (inputCounter.increment()) {
      finish();
    }
  }

  /**
   * Called by the generator after the caller took a batch.
   *
   * @param remaining the number of batches still queued.
   */
  private void batchConsumed(final int remaining) {
    if (remaining <= lowWaterMark && paused.compareAndSet(true, false)) {
      LOGGER.trace("Sink {} resuming its input with {} batches queued", getLabel(), remaining);
      for (ExecNode input : getInputs()) {
        input.resumeProducing(this);
      }
    }
  }

  /** End the generator and complete this node. */
  private void finish() {
    generator.close();
    markFinished();
  }

  @Override
  public void errorReceived(final ExecNode input, final Throwable error) {
    if (inputCounter.cancel()) {
      LOGGER.warn("Sink {} received an error", getLabel(), error);
      generator.fail(error);
      markFailed(error);
    }
    stopInputs();
  }

  @Override
  public void inputFinished(final ExecNode input, final int seqStop) {
    if (inputCounter.setTotal(seqStop)) {
      finish();
    }
  }
}
