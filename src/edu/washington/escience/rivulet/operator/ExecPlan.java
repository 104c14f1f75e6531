package edu.washington.escience.rivulet.operator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import javax.annotation.Nonnull;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.RivuletConstants;

import net.jcip.annotations.GuardedBy;

/**
 * A directed acyclic graph of {@link ExecNode}s, together with the execution environment they run in. A plan is
 * built by adding nodes whose inputs are already in the plan, validated, started once, and completes through
 * {@link #finished()}.
 */
public final class ExecPlan {

  /** The logger for this class. */
  private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(ExecPlan.class);

  /** Environment variables: executor, batch size, sink water marks. */
  private final ImmutableMap<String, Object> execEnvVars;

  /** The nodes, in insertion order. */
  private final List<ExecNode> nodes = new ArrayList<>();

  /** Source of labels for nodes added without one. */
  private final AtomicInteger autoLabelCounter = new AtomicInteger(0);

  /** Completes when every node is done, or as soon as one fails. */
  private final SettableFuture<Void> finished = SettableFuture.create();

  /** Guards the fields below. */
  private final Object lock = new Object();

  /** The nodes with inputs before consumers, computed once by {@link #validate()}. */
  @GuardedBy("lock")
  private ImmutableList<ExecNode> topologicalOrder = null;

  /** Whether {@link #startProducing()} has been called. */
  @GuardedBy("lock")
  private boolean started = false;

  /** Whether {@link #stopProducing()} has been called. */
  @GuardedBy("lock")
  private boolean stopped = false;

  /** Whether {@link #startProducing()} failed. */
  @GuardedBy("lock")
  private boolean startFailed = false;

  /**
   * @param execEnvVars the execution environment.
   */
  private ExecPlan(final ImmutableMap<String, Object> execEnvVars) {
    this.execEnvVars = execEnvVars;
  }

  /**
   * @return an empty plan that runs callbacks on the calling threads.
   */
  public static ExecPlan make() {
    return new ExecPlan(RivuletConstants.defaultExecEnvVars());
  }

  /**
   * @param execEnvVars the execution environment, overriding the defaults key by key.
   * @return an empty plan.
   */
  public static ExecPlan make(@Nonnull final Map<String, Object> execEnvVars) {
    Map<String, Object> merged = new HashMap<>(RivuletConstants.defaultExecEnvVars());
    merged.putAll(execEnvVars);
    return new ExecPlan(ImmutableMap.copyOf(merged));
  }

  /**
   * Add a freshly built node and bind it as an output of each of its inputs.
   *
   * @param node the node.
   * @param <T> the type of node.
   * @return the node.
   */
  <T extends ExecNode> T addNode(@Nonnull final T node) {
    Preconditions.checkArgument(node.getPlan() == this, "node %s belongs to another plan", node.getLabel());
    synchronized (lock) {
      Preconditions.checkState(!started && !stopped, "cannot add nodes to a started plan");
      for (ExecNode existing : nodes) {
        Preconditions.checkArgument(
            !existing.getLabel().equals(node.getLabel()), "duplicate node label %s", node.getLabel());
      }
      nodes.add(node);
      topologicalOrder = null;
    }
    for (ExecNode input : node.getInputs()) {
      input.addOutput(node);
    }
    return node;
  }

  /**
   * @return a label not yet used in this plan.
   */
  String nextAutoLabel() {
    return String.valueOf(autoLabelCounter.getAndIncrement());
  }

  /**
   * Check every node and fix the order in which nodes are started and stopped.
   *
   * @throws DbException INVALID if the plan has no nodes or a node has the wrong number of consumers.
   */
  public void validate() throws DbException {
    synchronized (lock) {
      if (nodes.isEmpty()) {
        throw DbException.invalid("ExecPlan has no node");
      }
      for (ExecNode node : nodes) {
        node.validate();
      }
      if (topologicalOrder == null) {
        topologicalOrder = computeTopologicalOrder();
      }
    }
  }

  /**
   * Depth-first, visiting inputs before their consumer and roots in insertion order.
   *
   * @return the nodes with every input before its consumers.
   */
  @GuardedBy("lock")
  private ImmutableList<ExecNode> computeTopologicalOrder() {
    ImmutableList.Builder<ExecNode> order = ImmutableList.builder();
    Set<ExecNode> visited = new HashSet<>();
    for (ExecNode node : nodes) {
      visit(node, visited, order);
    }
    return order.build();
  }

  /**
   * @param node the node to place.
   * @param visited nodes already placed.
   * @param order the order being built.
   */
  private static void visit(
      final ExecNode node, final Set<ExecNode> visited, final ImmutableList.Builder<ExecNode> order) {
    if (!visited.add(node)) {
      return;
    }
    for (ExecNode input : node.getInputs()) {
      visit(input, visited, order);
    }
    order.add(node);
  }

  /**
   * Start every node, consumers first. If a node fails to start, the nodes already started are stopped in reverse
   * order of their start and the plan fails with the same error.
   *
   * @throws DbException INVALID if the plan was already started or stopped, or the start error of a node.
   */
  public void startProducing() throws DbException {
    final List<ExecNode> order;
    synchronized (lock) {
      if (started || stopped) {
        throw DbException.invalid("ExecPlan restarted");
      }
      started = true;
    }
    try {
      validate();
    } catch (DbException e) {
      synchronized (lock) {
        startFailed = true;
      }
      finished.setException(e);
      throw e;
    }
    synchronized (lock) {
      order = Lists.reverse(topologicalOrder);
    }

    final List<ExecNode> startedNodes = new ArrayList<>();
    for (ExecNode node : order) {
      try {
        node.start();
      } catch (DbException e) {
        LOGGER.warn("Node {} failed to start, stopping {} started nodes", node.getLabel(), startedNodes.size(), e);
        synchronized (lock) {
          startFailed = true;
        }
        for (ExecNode startedNode : Lists.reverse(startedNodes)) {
          startedNode.stopProducing();
        }
        finished.setException(e);
        throw e;
      }
      startedNodes.add(node);
    }
    LOGGER.debug("Started {} nodes", startedNodes.size());

    List<ListenableFuture<Void>> nodeFutures = new ArrayList<>();
    for (ExecNode node : getNodes()) {
      nodeFutures.add(node.finished());
    }
    Futures.addCallback(
        Futures.allAsList(nodeFutures),
        new FutureCallback<List<Void>>() {
          @Override
          public void onSuccess(final List<Void> result) {
            finished.set(null);
          }

          @Override
          public void onFailure(final Throwable t) {
            LOGGER.warn("ExecPlan failed", t);
            finished.setException(t);
            stopProducing();
          }
        },
        MoreExecutors.directExecutor());
  }

  /**
   * Stop every node, inputs first. Idempotent. Stopping a plan that was never started completes it successfully;
   * stopping a plan whose start failed does nothing.
   */
  public void stopProducing() {
    final List<ExecNode> order;
    final boolean wasStarted;
    synchronized (lock) {
      if (stopped || startFailed) {
        return;
      }
      stopped = true;
      wasStarted = started;
      if (topologicalOrder != null) {
        order = topologicalOrder;
      } else {
        order = ImmutableList.copyOf(nodes);
      }
    }
    LOGGER.debug("Stopping {} nodes", order.size());
    for (ExecNode node : order) {
      node.stopProducing();
    }
    if (!wasStarted) {
      finished.set(null);
    }
  }

  /**
   * @return a future that completes when every node is done, or fails with the first node failure.
   */
  public ListenableFuture<Void> finished() {
    return finished;
  }

  /**
   * @return the nodes, in insertion order.
   */
  public ImmutableList<ExecNode> getNodes() {
    synchronized (lock) {
      return ImmutableList.copyOf(nodes);
    }
  }

  /**
   * @return the nodes without inputs, in insertion order.
   */
  public ImmutableList<ExecNode> getSources() {
    ImmutableList.Builder<ExecNode> ret = ImmutableList.builder();
    for (ExecNode node : getNodes()) {
      if (node.getInputs().isEmpty()) {
        ret.add(node);
      }
    }
    return ret.build();
  }

  /**
   * @return the nodes that expect no consumer, in insertion order.
   */
  public ImmutableList<ExecNode> getSinks() {
    ImmutableList.Builder<ExecNode> ret = ImmutableList.builder();
    for (ExecNode node : getNodes()) {
      if (node.getNumOutputs() == 0) {
        ret.add(node);
      }
    }
    return ret.build();
  }

  /**
   * @return the execution environment.
   */
  public ImmutableMap<String, Object> getExecEnvVars() {
    return execEnvVars;
  }

  /**
   * @return the executor callbacks and background work run on.
   */
  public Executor getExecutor() {
    Object executor = execEnvVars.get(RivuletConstants.EXEC_ENV_VAR_EXECUTOR);
    Preconditions.checkState(executor instanceof Executor, "%s is not an Executor", executor);
    return (Executor) executor;
  }

  /**
   * @return the maximum number of rows in a batch emitted by grouped aggregation.
   */
  public int getOutputBatchSize() {
    return getIntVar(RivuletConstants.EXEC_ENV_VAR_OUTPUT_BATCH_SIZE, RivuletConstants.DEFAULT_OUTPUT_BATCH_SIZE);
  }

  /**
   * @return the number of queued batches at which a sink pauses its inputs, 0 if sinks never pause.
   */
  public int getSinkHighWaterMark() {
    return getIntVar(
        RivuletConstants.EXEC_ENV_VAR_SINK_HIGH_WATER_MARK, RivuletConstants.DEFAULT_SINK_HIGH_WATER_MARK);
  }

  /**
   * @return the number of queued batches at which a paused sink resumes its inputs.
   */
  public int getSinkLowWaterMark() {
    return getIntVar(
        RivuletConstants.EXEC_ENV_VAR_SINK_LOW_WATER_MARK, RivuletConstants.DEFAULT_SINK_LOW_WATER_MARK);
  }

  /**
   * @param key the variable.
   * @param defaultValue the value if the variable is unset.
   * @return the integer value of the variable.
   */
  private int getIntVar(final String key, final int defaultValue) {
    Object value = execEnvVars.get(key);
    if (value == null) {
      return defaultValue;
    }
    Preconditions.checkState(value instanceof Number, "%s must be a number, got %s", key, value);
    return ((Number) value).intValue();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("ExecPlan with ").append(getNodes().size()).append(" nodes:");
    for (ExecNode node : getNodes()) {
      sb.append('\n').append(node);
    }
    return sb.toString();
  }
}
