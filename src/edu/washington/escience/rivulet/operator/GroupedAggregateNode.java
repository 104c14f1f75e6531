package edu.washington.escience.rivulet.operator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.column.Column;
import edu.washington.escience.rivulet.column.builder.ColumnBuilder;
import edu.washington.escience.rivulet.column.builder.ColumnFactory;
import edu.washington.escience.rivulet.operator.agg.AggUtils;
import edu.washington.escience.rivulet.operator.agg.Aggregator;
import edu.washington.escience.rivulet.operator.agg.Groupings;
import edu.washington.escience.rivulet.operator.agg.HashGrouper;
import edu.washington.escience.rivulet.storage.TupleBatch;
import edu.washington.escience.rivulet.util.concurrent.CompletionCounter;

import net.jcip.annotations.GuardedBy;

/**
 * Aggregates its input per distinct value of the key columns. Output rows hold the aggregates first and the keys last,
 * in order of first appearance of each key, split into batches of at most the plan's output batch size.
 */
public final class GroupedAggregateNode extends ExecNode {

  /** The logger for this class. */
  private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(GroupedAggregateNode.class);

  /** The resolved aggregates. */
  private final BoundAggregates aggregates;

  /** The key columns in the input. */
  private final int[] keyIndices;

  /** Counts processed batches against the input's total. */
  private final CompletionCounter inputCounter = new CompletionCounter();

  /** Guards the fields below. */
  private final Object lock = new Object();

  /** Assigns group ids to keys. */
  @GuardedBy("lock")
  private final HashGrouper grouper;

  /** For each aggregate, one state per group id. */
  @GuardedBy("lock")
  private final List<List<Aggregator>> states;

  /**
   * @param plan the plan.
   * @param label the label, or null.
   * @param input the input.
   * @param aggregates the resolved aggregates.
   * @param keyIndices the key columns in the input.
   */
  GroupedAggregateNode(
      final ExecPlan plan,
      @Nullable final String label,
      final ExecNode input,
      final BoundAggregates aggregates,
      final int[] keyIndices) {
    super(
        plan,
        label,
        ImmutableList.of(input),
        ImmutableList.of("groupby"),
        Schema.merge(aggregates.getSchema(), input.getOutputSchema().getSubSchema(keyIndices)),
        1);
    this.aggregates = aggregates;
    this.keyIndices = keyIndices;
    grouper = new HashGrouper(input.getOutputSchema().getSubSchema(keyIndices));
    states = new ArrayList<>();
    for (int i = 0; i < aggregates.size(); ++i) {
      states.add(new ArrayList<Aggregator>());
    }
  }

  /**
   * @param plan the plan.
   * @param label the label, or null.
   * @param inputs the inputs, exactly one.
   * @param options the aggregates and keys.
   * @return the node, added to the plan.
   * @throws DbException INVALID if there is not exactly one input, a key column is unknown or an aggregate cannot be
   *           resolved.
   */
  static GroupedAggregateNode make(
      final ExecPlan plan,
      @Nullable final String label,
      final List<ExecNode> inputs,
      final AggregateNodeOptions options)
      throws DbException {
    ExecNodes.checkInputCount(ExecNodes.AGGREGATE, inputs, 1);
    ExecNode input = inputs.get(0);
    Schema inputSchema = input.getOutputSchema();
    int[] keyIndices = new int[options.getKeys().size()];
    for (int k = 0; k < keyIndices.length; ++k) {
      keyIndices[k] = inputSchema.getColumnIndex(options.getKeys().get(k));
    }
    BoundAggregates aggregates = BoundAggregates.bind(inputSchema, options, true);
    return plan.addNode(new GroupedAggregateNode(plan, label, input, aggregates, keyIndices));
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
      synchronized (lock) {
        consume(batch);
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

  /**
   * Route every row of a batch to the states of its group.
   *
   * @param batch the batch.
   * @throws DbException if a kernel fails.
   */
  @GuardedBy("lock")
  private void consume(final TupleBatch batch) throws DbException {
    List<Column<?>> keys = new ArrayList<>(keyIndices.length);
    for (int k : keyIndices) {
      keys.add(batch.asColumn(k));
    }
    final int[] groupIds = grouper.consume(keys);
    for (int i = 0; i < aggregates.size(); ++i) {
      List<Aggregator> aggStates = states.get(i);
      while (aggStates.size() < grouper.numGroups()) {
        aggStates.add(aggregates.getFactory(i).get());
      }
    }

    /* Renumber the groups present in this batch densely, so the work is proportional to the batch. */
    final int[] localToGroup = new int[groupIds.length];
    final int[] groupToLocal = new int[grouper.numGroups()];
    Arrays.fill(groupToLocal, -1);
    final int[] localIds = new int[groupIds.length];
    int numLocal = 0;
    for (int row = 0; row < groupIds.length; ++row) {
      int group = groupIds[row];
      if (groupToLocal[group] < 0) {
        groupToLocal[group] = numLocal;
        localToGroup[numLocal] = group;
        ++numLocal;
      }
      localIds[row] = groupToLocal[group];
    }

    final Groupings groupings = AggUtils.makeGroupings(localIds, numLocal);
    for (int i = 0; i < aggregates.size(); ++i) {
      List<Column<?>> perGroup = AggUtils.applyGroupings(groupings, batch.asColumn(aggregates.getTargetIndex(i)));
      for (int local = 0; local < numLocal; ++local) {
        states.get(i).get(localToGroup[local]).consume(perGroup.get(local));
      }
    }
  }

  /** Emit one row per group and complete this node. */
  private void finish() {
    final List<TupleBatch> output = new ArrayList<>();
    try {
      synchronized (lock) {
        final TupleBatch uniques = grouper.getUniques();
        final int numGroups = grouper.numGroups();
        final int batchSize = Math.max(1, getPlan().getOutputBatchSize());
        for (int start = 0; start < numGroups; start += batchSize) {
          final int length = Math.min(batchSize, numGroups - start);
          ImmutableList.Builder<Column<?>> columns = ImmutableList.builder();
          for (int i = 0; i < aggregates.size(); ++i) {
            ColumnBuilder<?> builder = ColumnFactory.allocateColumn(aggregates.getSchema().getColumnType(i));
            for (int group = start; group < start + length; ++group) {
              builder.appendObject(states.get(i).get(group).finalizeResult());
            }
            columns.add(builder.build());
          }
          for (int k = 0; k < keyIndices.length; ++k) {
            columns.add(uniques.asColumn(k).slice(start, length));
          }
          output.add(new TupleBatch(getOutputSchema(), columns.build(), length, null));
        }
      }
    } catch (DbException e) {
      /* the counter already completed, so nothing else can complete this node */
      LOGGER.warn("Aggregate {} failed to finalize", getLabel(), e);
      emitError(e);
      markFailed(e);
      return;
    }
    LOGGER.debug("Aggregate {} produced {} batches", getLabel(), output.size());
    for (int seq = 0; seq < output.size(); ++seq) {
      emitBatch(seq, output.get(seq));
    }
    emitFinished(output.size());
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
