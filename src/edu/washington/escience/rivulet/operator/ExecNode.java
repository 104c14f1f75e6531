package edu.washington.escience.rivulet.operator;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.storage.TupleBatch;

/**
 * A node of an {@link ExecPlan}. Nodes are push-based: an input hands each produced batch to its outputs through
 * {@link #inputReceived(ExecNode, int, TupleBatch)}, announces the total number of batches it produced through
 * {@link #inputFinished(ExecNode, int)} and reports failures through {@link #errorReceived(ExecNode, Throwable)}.
 * Control travels the other way: outputs ask their inputs to pause, resume or stop.
 *
 * Batches may arrive concurrently and in any order; the sequence number tells them apart. The set of node kinds is
 * closed: nodes are only created by the factories in this package.
 */
public abstract class ExecNode {

  /** The logger for this class. */
  private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(ExecNode.class);

  /** The life cycle of a node. */
  public enum State {
    /** Added to a plan. */
    CREATED,
    /** Checked by {@link ExecPlan#validate()}. */
    VALIDATED,
    /** Started and not yet done. */
    PRODUCING,
    /** Stopped before producing all of its output. */
    STOPPED,
    /** Produced all of its output. */
    FINISHED,
    /** Failed. */
    ERRORED
  }

  /** The plan that owns this node. */
  private final ExecPlan plan;

  /** The label of this node, unique within the plan. */
  private final String label;

  /** The nodes feeding this node. */
  private final ImmutableList<ExecNode> inputs;

  /** Optional labels of the inputs, for display. */
  private final ImmutableList<String> inputLabels;

  /** The schema of the batches this node emits, null for nodes that emit nothing. */
  @Nullable private final Schema outputSchema;

  /** The number of consumers this node expects. */
  private final int numOutputs;

  /** Consumers bound by the plan when they were added. */
  private final List<ExecNode> outputs = new CopyOnWriteArrayList<>();

  /** The consumers that asked this node to stop. */
  private final Set<ExecNode> stopRequests = ConcurrentHashMap.newKeySet();

  /** Completes when this node has stopped, finished or failed. */
  private final SettableFuture<Void> finished = SettableFuture.create();

  /** Set by the one call that moves this node to a terminal state. */
  private final AtomicBoolean completed = new AtomicBoolean(false);

  /** The current life cycle state. */
  private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);

  /**
   * @param plan the plan that owns this node.
   * @param label the label of this node, or null to let the plan pick one.
   * @param inputs the nodes feeding this node.
   * @param inputLabels labels of the inputs, empty or one per input.
   * @param outputSchema the schema of emitted batches, null if this node emits nothing.
   * @param numOutputs the number of consumers this node expects.
   */
  ExecNode(
      @Nonnull final ExecPlan plan,
      @Nullable final String label,
      @Nonnull final List<ExecNode> inputs,
      @Nonnull final List<String> inputLabels,
      @Nullable final Schema outputSchema,
      final int numOutputs) {
    this.plan = Objects.requireNonNull(plan, "plan");
    this.inputs = ImmutableList.copyOf(inputs);
    this.inputLabels = ImmutableList.copyOf(inputLabels);
    Preconditions.checkArgument(
        this.inputLabels.isEmpty() || this.inputLabels.size() == this.inputs.size(),
        "got %s input labels for %s inputs",
        this.inputLabels.size(),
        this.inputs.size());
    Preconditions.checkArgument(numOutputs >= 0, "numOutputs must be non-negative");
    for (ExecNode input : this.inputs) {
      Preconditions.checkArgument(input.plan == plan, "input %s belongs to another plan", input.getLabel());
    }
    this.label = label == null ? plan.nextAutoLabel() : label;
    this.outputSchema = outputSchema;
    this.numOutputs = numOutputs;
  }

  /**
   * @return the name of the factory that builds this kind of node.
   */
  public abstract String getKindName();

  /**
   * Called by the plan, in reverse topological order, so that consumers are ready before their producers emit.
   *
   * @throws DbException if the node cannot start.
   */
  protected abstract void startProducing() throws DbException;

  /**
   * Stop this node and ask its inputs to stop. Must be idempotent.
   */
  public abstract void stopProducing();

  /**
   * Receive one batch from an input.
   *
   * @param input the producing node.
   * @param seq the sequence number of the batch within the input's output.
   * @param batch the batch.
   */
  public abstract void inputReceived(ExecNode input, int seq, TupleBatch batch);

  /**
   * Receive a failure from an input.
   *
   * @param input the failing node.
   * @param error the failure.
   */
  public abstract void errorReceived(ExecNode input, Throwable error);

  /**
   * Learn the total number of batches an input produced. Batches may still be in flight.
   *
   * @param input the producing node.
   * @param seqStop the number of batches the input emitted.
   */
  public abstract void inputFinished(ExecNode input, int seqStop);

  /**
   * Stop on behalf of one consumer. The node stops only once every consumer asked.
   *
   * @param output the consumer asking.
   */
  public void stopProducing(final ExecNode output) {
    Preconditions.checkArgument(outputs.contains(output), "%s is not an output of %s", output.getLabel(), label);
    stopRequests.add(output);
    if (stopRequests.containsAll(outputs)) {
      stopProducing();
    }
  }

  /**
   * Ask this node to stop delivering batches to a consumer for a while. By default the request is passed to the
   * inputs.
   *
   * @param output the consumer asking.
   */
  public void pauseProducing(final ExecNode output) {
    for (ExecNode input : inputs) {
      input.pauseProducing(this);
    }
  }

  /**
   * Undo {@link #pauseProducing(ExecNode)}. By default the request is passed to the inputs.
   *
   * @param output the consumer asking.
   */
  public void resumeProducing(final ExecNode output) {
    for (ExecNode input : inputs) {
      input.resumeProducing(this);
    }
  }

  /**
   * Check that every expected consumer has been bound.
   *
   * @throws DbException INVALID if the number of bound consumers differs from the expected number.
   */
  void validate() throws DbException {
    if (outputs.size() != numOutputs) {
      throw DbException.invalid(
          "Node %s expects %d outputs but %d are bound: %s", label, numOutputs, outputs.size(), outputLabels());
    }
    state.compareAndSet(State.CREATED, State.VALIDATED);
  }

  /**
   * Start this node, recording the state change.
   *
   * @throws DbException if the node cannot start.
   */
  final void start() throws DbException {
    try {
      startProducing();
    } catch (DbException e) {
      markFailed(e);
      throw e;
    }
    /* a node may already be done if it completed inside startProducing */
    state.compareAndSet(State.VALIDATED, State.PRODUCING);
  }

  /**
   * Bind a consumer. Called by the plan when the consumer is added.
   *
   * @param output the consumer.
   */
  final void addOutput(final ExecNode output) {
    outputs.add(output);
  }

  /**
   * Hand a batch to every consumer.
   *
   * @param seq the sequence number of the batch.
   * @param batch the batch.
   */
  protected final void emitBatch(final int seq, final TupleBatch batch) {
    for (ExecNode output : outputs) {
      output.inputReceived(this, seq, batch);
    }
  }

  /**
   * Tell every consumer how many batches this node emitted.
   *
   * @param total the number of batches.
   */
  protected final void emitFinished(final int total) {
    for (ExecNode output : outputs) {
      output.inputFinished(this, total);
    }
  }

  /**
   * Pass a failure to every consumer.
   *
   * @param error the failure.
   */
  protected final void emitError(final Throwable error) {
    for (ExecNode output : outputs) {
      output.errorReceived(this, error);
    }
  }

  /** Ask every input to stop on behalf of this node. */
  protected final void stopInputs() {
    for (ExecNode input : inputs) {
      input.stopProducing(this);
    }
  }

  /**
   * Complete this node after it produced all of its output.
   *
   * @return true if this call completed the node.
   */
  protected final boolean markFinished() {
    return complete(State.FINISHED, null);
  }

  /**
   * Complete this node after a stop request.
   *
   * @return true if this call completed the node.
   */
  protected final boolean markStopped() {
    return complete(State.STOPPED, null);
  }

  /**
   * Complete this node with a failure.
   *
   * @param error the failure.
   * @return true if this call completed the node.
   */
  protected final boolean markFailed(final Throwable error) {
    return complete(State.ERRORED, Objects.requireNonNull(error, "error"));
  }

  /**
   * Move to a terminal state, then complete {@link #finished()}. Listeners of the future always observe the terminal
   * state.
   *
   * @param terminal the terminal state.
   * @param error the failure, null unless {@code terminal} is {@link State#ERRORED}.
   * @return true if this call completed the node.
   */
  private boolean complete(final State terminal, @Nullable final Throwable error) {
    if (!completed.compareAndSet(false, true)) {
      return false;
    }
    state.set(terminal);
    LOGGER.debug("Node {} is {}", label, terminal, error);
    if (error == null) {
      finished.set(null);
    } else {
      finished.setException(error);
    }
    return true;
  }

  /**
   * @return true once this node has stopped, finished or failed.
   */
  protected final boolean isDone() {
    return completed.get();
  }

  /**
   * @return a future that completes when this node has stopped, finished or failed.
   */
  public final ListenableFuture<Void> finished() {
    return finished;
  }

  /**
   * @return the plan that owns this node.
   */
  public final ExecPlan getPlan() {
    return plan;
  }

  /**
   * @return the label of this node.
   */
  public final String getLabel() {
    return label;
  }

  /**
   * @return the nodes feeding this node.
   */
  public final ImmutableList<ExecNode> getInputs() {
    return inputs;
  }

  /**
   * @return the labels given to the inputs, possibly empty.
   */
  public final ImmutableList<String> getInputLabels() {
    return inputLabels;
  }

  /**
   * @return the consumers bound so far.
   */
  public final ImmutableList<ExecNode> getOutputs() {
    return ImmutableList.copyOf(outputs);
  }

  /**
   * @return the number of consumers this node expects.
   */
  public final int getNumOutputs() {
    return numOutputs;
  }

  /**
   * @return the schema of the batches this node emits, null if it emits nothing.
   */
  @Nullable
  public final Schema getOutputSchema() {
    return outputSchema;
  }

  /**
   * @return the current life cycle state.
   */
  public final State getState() {
    return state.get();
  }

  /**
   * @return the labels of the bound consumers.
   */
  private ImmutableSet<String> outputLabels() {
    ImmutableSet.Builder<String> ret = ImmutableSet.builder();
    for (ExecNode output : outputs) {
      ret.add(output.getLabel());
    }
    return ret.build();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getKindName()).append(':').append(label).append('{');
    if (!inputs.isEmpty()) {
      sb.append("inputs=[");
      for (int i = 0; i < inputs.size(); ++i) {
        if (i > 0) {
          sb.append(", ");
        }
        if (!inputLabels.isEmpty()) {
          sb.append(inputLabels.get(i)).append(": ");
        }
        sb.append('"').append(inputs.get(i).getLabel()).append('"');
      }
      sb.append("], ");
    }
    sb.append("outputs=").append(outputLabels());
    if (outputSchema != null) {
      sb.append(", schema=").append(outputSchema);
    }
    return sb.append('}').toString();
  }
}
