package edu.washington.escience.rivulet.operator;

import java.util.BitSet;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;
import edu.washington.escience.rivulet.expression.ExpressionOperator;
import edu.washington.escience.rivulet.storage.TupleBatch;
import edu.washington.escience.rivulet.util.concurrent.CompletionCounter;

/**
 * Drops the rows for which a boolean predicate is false or null. Every input batch yields exactly one output batch,
 * possibly empty, with the same sequence number.
 */
public final class FilterNode extends ExecNode {

  /** The logger for this class. */
  private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(FilterNode.class);

  /** The predicate. */
  private final ExpressionOperator predicate;

  /** Counts processed batches against the input's total. */
  private final CompletionCounter inputCounter = new CompletionCounter();

  /**
   * @param plan the plan.
   * @param label the label, or null.
   * @param input the input.
   * @param predicate the predicate.
   */
  private FilterNode(
      final ExecPlan plan,
      @Nullable final String label,
      final ExecNode input,
      final ExpressionOperator predicate) {
    super(plan, label, ImmutableList.of(input), ImmutableList.of("target"), input.getOutputSchema(), 1);
    this.predicate = predicate;
  }

  /**
   * @param plan the plan.
   * @param label the label, or null.
   * @param inputs the inputs, exactly one.
   * @param options the predicate.
   * @return the node, added to the plan.
   * @throws DbException INVALID if there is not exactly one input or the predicate is not boolean.
   */
  static FilterNode make(
      final ExecPlan plan,
      @Nullable final String label,
      final List<ExecNode> inputs,
      final FilterNodeOptions options)
      throws DbException {
    ExecNodes.checkInputCount(ExecNodes.FILTER, inputs, 1);
    ExecNode input = inputs.get(0);
    Type type = options.getPredicate().getOutputType(input.getOutputSchema());
    if (type != Type.BOOLEAN_TYPE) {
      throw DbException.invalid("Filter predicate %s must be boolean, not %s", options.getPredicate(), type);
    }
    return plan.addNode(new FilterNode(plan, label, input, options.getPredicate()));
  }

  @Override
  public String getKindName() {
    return ExecNodes.FILTER;
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
      emitBatch(seq, filter(batch));
    } catch (DbException e) {
      LOGGER.warn("Filter {} failed on batch {}", getLabel(), seq, e);
      fail(e);
      return;
    }
    if (inputCounter.increment()) {
      markFinished();
    }
  }

  /**
   * @param batch an input batch.
   * @return the rows of the batch that satisfy the predicate.
   * @throws DbException if the predicate cannot be evaluated.
   */
  private TupleBatch filter(final TupleBatch batch) throws DbException {
    Column<?> mask = predicate.evaluate(batch);
    BitSet keep = new BitSet(batch.numTuples());
    if (mask.isConstant()) {
      if (mask.size() > 0 && !mask.isNull(0) && mask.getBoolean(0)) {
        return batch;
      }
      return batch.filter(keep);
    }
    for (int row = 0; row < mask.size(); ++row) {
      if (!mask.isNull(row) && mask.getBoolean(row)) {
        keep.set(row);
      }
    }
    return batch.filter(keep);
  }

  @Override
  public void errorReceived(final ExecNode input, final Throwable error) {
    fail(error);
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
  public void inputFinished(final ExecNode input, final int seqStop) {
    emitFinished(seqStop);
    if (inputCounter.setTotal(seqStop)) {
      markFinished();
    }
  }
}
