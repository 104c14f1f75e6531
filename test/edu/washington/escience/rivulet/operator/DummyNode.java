package edu.washington.escience.rivulet.operator;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.storage.TupleBatch;

/**
 * A node that produces nothing and calls back into the test when it is started or stopped.
 */
public final class DummyNode extends ExecNode {

  /** Called when the node is started. */
  @FunctionalInterface
  public interface StartProducingFunc {
    /**
     * @param node the node being started.
     * @throws DbException to make the start fail.
     */
    void apply(DummyNode node) throws DbException;
  }

  /** Called when the node is stopped. */
  @FunctionalInterface
  public interface StopProducingFunc {
    /**
     * @param node the node being stopped.
     */
    void apply(DummyNode node);
  }

  @Nullable private final StartProducingFunc startProducing;
  @Nullable private final StopProducingFunc stopProducing;
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  private DummyNode(
      final ExecPlan plan,
      final String label,
      final List<ExecNode> inputs,
      final int numOutputs,
      @Nullable final StartProducingFunc startProducing,
      @Nullable final StopProducingFunc stopProducing) {
    super(plan, label, inputs, ImmutableList.<String>of(), null, numOutputs);
    this.startProducing = startProducing;
    this.stopProducing = stopProducing;
  }

  public static DummyNode make(
      final ExecPlan plan,
      final String label,
      final List<ExecNode> inputs,
      final int numOutputs,
      @Nullable final StartProducingFunc startProducing,
      @Nullable final StopProducingFunc stopProducing) {
    return plan.addNode(new DummyNode(plan, label, inputs, numOutputs, startProducing, stopProducing));
  }

  public static DummyNode make(
      final ExecPlan plan, final String label, final List<ExecNode> inputs, final int numOutputs) {
    return make(plan, label, inputs, numOutputs, null, null);
  }

  @Override
  public String getKindName() {
    return "dummy";
  }

  @Override
  protected void startProducing() throws DbException {
    if (startProducing != null) {
      startProducing.apply(this);
    }
  }

  @Override
  public void stopProducing() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    if (stopProducing != null) {
      stopProducing.apply(this);
    }
    markStopped();
  }

  @Override
  public void inputReceived(final ExecNode input, final int seq, final TupleBatch batch) {}

  @Override
  public void errorReceived(final ExecNode input, final Throwable error) {}

  @Override
  public void inputFinished(final ExecNode input, final int seqStop) {}
}
