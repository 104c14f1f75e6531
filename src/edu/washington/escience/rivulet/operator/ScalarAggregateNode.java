package edu.washington.escience.rivulet.operator;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.column.Column;
import edu.washington.escience.rivulet.column.ConstantValueColumn;
import edu.washington.escience.rivulet.operator.agg.Aggregator;
import edu.washington.escience.rivulet.storage.TupleBatch;
import edu.washington.escience.rivulet.util.concurrent.CompletionCounter;

import net.jcip.annotations.GuardedBy;

/**
 * Reduces its whole input to a single row of scalars. Each batch is consumed into fresh states that are then merged
 * into the node's states, so batches may arrive concurrently. Once every input batch has been seen the node emits one
 * batch of length 1 with sequence number 0.
 */
public final class ScalarAggregateNode extends ExecNode {

  /** The logger for this class. */
  private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(ScalarAggregateNode.class);

  /** The resolved aggregates. */
  private final BoundAggregates aggregates;

  /** Counts processed batches against the input's total. */
  private final CompletionCounter inputCounter = new CompletionCounter();

  /** The merged states, one per aggregate. */
  @GuardedBy("states")
  private final Aggregator[] states;

  /**
   * @param plan the plan.
   * @param label the label, or null.
   * @param input the input.
   * @param aggregates the resolved aggregates.
   */
  ScalarAggregateNode(
      final ExecPlan plan,
      @Nullable final String label,
      final ExecNode input,
      final BoundAggregates aggregates) {
    super(plan, label, ImmutableList.of(input), ImmutableList.of("target"), aggregates.getSchema(), 1);
    this.aggregates = aggregates;
    states = newStates();
  }

  /**
   * @param plan the plan.
   * @param label the label, or null.
   * @param inputs the inputs, exactly one.
   * @param options the aggregates, without keys.
   * @return the node, added to the plan.
   * @throws DbException INVALID if there is not exactly one input or an aggregate cannot be resolved.
   */
  static ScalarAggregateNode make(
      final ExecPlan plan,
      @Nullable final String label,
      final List<ExecNode> inputs,
      final AggregateNodeOptions options)
      throws DbException {
    ExecNodes.checkInputCount(ExecNodes.AGGREGATE, inputs, 1);
    ExecNode input = inputs.get(0);
    BoundAggregates aggregates = BoundAggregates.bind(input.getOutputSchema(), options, false);
    return plan.addNode(new ScalarAggregateNode(plan, label, input, aggregates));
  }

  /**
   * @return one fresh state per aggregate.
   */
  private Aggregator[] newStates() {
    Aggregator[] ret = new Aggregator[aggregates.size()];
    for (int i = 0; i < ret.length; ++i) {
      ret[i] = aggregates.getFactory(i).get();
    }
    return ret;
  }

  @Override
  public String getKindName() {
    return ExecNodes.AGGREGATE;
  }

  @Override
  protected void startProducing() throws DbException {}

  @Override
  public void stopProducing() {
    if (inputCounter.cancel()) {
      markStopped();
    }
    stopInputs();
  }

  @Override
  public void inputReceived(final ExecNode input, final int seq, final TupleBatch batch) {
    if (inputCounter.isComplete()) {
      return;
    }
    try {
      Aggregator[] local = newStates();
      for (int i = 0; i < local.length; ++i) {
        local[i].consume(batch.asColumn(aggregates.getTargetIndex(i)));
      }
      synchronized (states) {
        for (int i = 0; i < states.length; ++i) {
          states[i].mergeFrom(local[i]);
        }
      }
    } catch (DbException e) {
      LOGGER.warn("Aggregate {} failed on batch {}", getLabel(), seq, e);
      fail(e);
      return;
    }
    if (inputCounter.increment()) {
      finish();
    }
  }

  /** Emit the finalized row and complete this node. */
  private void finish() {
    final TupleBatch output;
    try {
      ImmutableList.Builder<Column<?>> columns = ImmutableList.builder();
      synchronized (states) {
        for (int i = 0; i < states.length; ++i) {
          Comparable<?> value = (Comparable<?>) states[i].finalizeResult();
          columns.add(new ConstantValueColumn(value, states[i].getOutputType(), 1));
        }
      }
      output = new TupleBatch(getOutputSchema(), columns.build(), 1, null);
    } catch (DbException e) {
      /* the counter already completed, so nothing else can complete this node */
      LOGGER.warn("Aggregate {} failed to finalize", getLabel(), e);
      emitError(e);
      markFailed(e);
      return;
    }
    LOGGER.debug("Aggregate {} produced {}", getLabel(), output);
    emitBatch(0, output);
    emitFinished(1);
    markFinished();
  }

  /**
   * Report a failure downstream and complete this node with it. The counter is cancelled first so that a stop
   * triggered by the failure cannot complete this node as stopped.
   *
   * @param error the failure.
   */
  private void fail(final Throwable error) {
    final boolean first = inputCounter.cancel();
    emitError(error);
    if (first) {
      markFailed(error);
    }
  }

  @Override
  public void errorReceived(final ExecNode input, final Throwable error) {
    fail(error);
  }

  @Override
  public void inputFinished(final ExecNode input, final int seqStop) {
    if (inputCounter.setTotal(seqStop)) {
      finish();
    }
  }
}
