package edu.washington.escience.rivulet.operator;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;
import edu.washington.escience.rivulet.expression.ExpressionOperator;
import edu.washington.escience.rivulet.storage.TupleBatch;
import edu.washington.escience.rivulet.util.concurrent.CompletionCounter;

/**
 * Replaces the columns of every batch with the values of a list of expressions. Scalar inputs yield scalar outputs.
 */
public final class ProjectNode extends ExecNode {

  /** The logger for this class. */
  private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(ProjectNode.class);

  /** One expression per output column. */
  private final ImmutableList<ExpressionOperator> expressions;

  /** Counts processed batches against the input's total. */
  private final CompletionCounter inputCounter = new CompletionCounter();

  /**
   * @param plan the plan.
   * @param label the label, or null.
   * @param input the input.
   * @param expressions one expression per output column.
   * @param outputSchema the schema of the output.
   */
  private ProjectNode(
      final ExecPlan plan,
      @Nullable final String label,
      final ExecNode input,
      final ImmutableList<ExpressionOperator> expressions,
      final Schema outputSchema) {
    super(plan, label, ImmutableList.of(input), ImmutableList.of("target"), outputSchema, 1);
    this.expressions = expressions;
  }

  /**
   * @param plan the plan.
   * @param label the label, or null.
   * @param inputs the inputs, exactly one.
   * @param options the expressions and names.
   * @return the node, added to the plan.
   * @throws DbException INVALID if there is not exactly one input or an expression does not type check.
   */
  static ProjectNode make(
      final ExecPlan plan,
      @Nullable final String label,
      final List<ExecNode> inputs,
      final ProjectNodeOptions options)
      throws DbException {
    ExecNodes.checkInputCount(ExecNodes.PROJECT, inputs, 1);
    ExecNode input = inputs.get(0);
    ImmutableList.Builder<Type> types = ImmutableList.builder();
    for (ExpressionOperator expression : options.getExpressions()) {
      types.add(expression.getOutputType(input.getOutputSchema()));
    }
    Schema outputSchema = Schema.of(types.build(), options.getNames());
    return plan.addNode(new ProjectNode(plan, label, input, options.getExpressions(), outputSchema));
  }

  @Override
  public String getKindName() {
    return ExecNodes.PROJECT;
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
      ImmutableList.Builder<Column<?>> columns = ImmutableList.builder();
      for (ExpressionOperator expression : expressions) {
        columns.add(expression.evaluate(batch));
      }
      emitBatch(seq, new TupleBatch(getOutputSchema(), columns.build(), batch.numTuples(), batch.getTag()));
    } catch (DbException e) {
      LOGGER.warn("Project {} failed on batch {}", getLabel(), seq, e);
      fail(e);
      return;
    }
    if (inputCounter.increment()) {
      markFinished();
    }
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
