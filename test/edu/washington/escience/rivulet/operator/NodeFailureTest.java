package edu.washington.escience.rivulet.operator;

import static edu.washington.escience.rivulet.expression.Expressions.add;
import static edu.washington.escience.rivulet.expression.Expressions.field;
import static edu.washington.escience.rivulet.expression.Expressions.greater;
import static edu.washington.escience.rivulet.expression.Expressions.literal;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.StatusCode;
import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;
import edu.washington.escience.rivulet.generator.BatchGenerators;
import edu.washington.escience.rivulet.operator.agg.Aggregator;
import edu.washington.escience.rivulet.operator.agg.AggregatorFactory;
import edu.washington.escience.rivulet.storage.TupleBatch;
import edu.washington.escience.rivulet.util.TestUtils;

/**
 * Checks that the node whose own work fails ends up {@link ExecNode.State#ERRORED}, not stopped by the cascade that
 * its failure triggers.
 */
public class NodeFailureTest {

  private static final Schema SCHEMA = Schema.ofFields("i32", Type.INT_TYPE, "str", Type.STRING_TYPE);

  private static List<TupleBatch> overflowingBatches() {
    return ImmutableList.of(
        TestUtils.batchFromJson(SCHEMA, "[[1, \"alfa\"], [2, \"beta\"]]"),
        TestUtils.batchFromJson(SCHEMA, "[[2147483647, \"alfa\"]]"));
  }

  private static ExecNode addSource(final ExecPlan plan) throws DbException {
    return new Declaration(
            ExecNodes.SOURCE, new SourceNodeOptions(SCHEMA, BatchGenerators.fromIterable(overflowingBatches())))
        .addToPlan(plan);
  }

  /** A kernel that accepts every input and cannot produce a result. */
  private static final class UnfinishableAggregator implements Aggregator {
    @Override
    public void consume(final Column<?> input) {}

    @Override
    public void mergeFrom(final Aggregator other) {}

    @Override
    public Object finalizeResult() throws DbException {
      throw DbException.executionError("cannot finalize");
    }

    @Override
    public Type getOutputType() {
      return Type.LONG_TYPE;
    }
  }

  private static BoundAggregates unfinishable() {
    AggregatorFactory factory =
        new AggregatorFactory() {
          @Override
          public Aggregator get() {
            return new UnfinishableAggregator();
          }

          @Override
          public Type getOutputType() {
            return Type.LONG_TYPE;
          }
        };
    return BoundAggregates.of(
        new int[] {0}, ImmutableList.<AggregatorFactory>of(factory), ImmutableList.of("broken(i32)"));
  }

  /**
   * Start the plan and check that it fails, that {@code failing} failed with the same code and that the sink saw the
   * failure.
   */
  private static void assertFailsAt(final ExecPlan plan, final ExecNode failing, final SinkNodeOptions sink)
      throws DbException {
    plan.validate();
    plan.startProducing();

    DbException collectFailure = TestUtils.awaitFailure(BatchGenerators.collect(sink.getGenerator()));
    assertEquals(StatusCode.EXECUTION_ERROR, collectFailure.getCode());
    DbException planFailure = TestUtils.awaitFailure(plan.finished());
    assertEquals(StatusCode.EXECUTION_ERROR, planFailure.getCode());
    DbException nodeFailure = TestUtils.awaitFailure(failing.finished());
    assertEquals(StatusCode.EXECUTION_ERROR, nodeFailure.getCode());

    assertEquals(ExecNode.State.ERRORED, failing.getState());
    for (ExecNode output : failing.getOutputs()) {
      assertEquals(output.getLabel(), ExecNode.State.ERRORED, output.getState());
    }
  }

  @Test
  public void testProjectOverflowErrorsTheProject() throws Exception {
    ExecPlan plan = ExecPlan.make();
    ExecNode source = addSource(plan);
    ExecNode project =
        ExecNodes.make(
            ExecNodes.PROJECT,
            plan,
            ImmutableList.of(source),
            new ProjectNodeOptions(ImmutableList.of(add(field("i32"), literal(1)))));
    SinkNodeOptions sink = new SinkNodeOptions();
    ExecNodes.make(ExecNodes.SINK, plan, ImmutableList.of(project), sink);
    assertFailsAt(plan, project, sink);
  }

  @Test
  public void testFilterOverflowErrorsTheFilter() throws Exception {
    ExecPlan plan = ExecPlan.make();
    ExecNode source = addSource(plan);
    ExecNode filter =
        ExecNodes.make(
            ExecNodes.FILTER,
            plan,
            ImmutableList.of(source),
            new FilterNodeOptions(greater(add(field("i32"), literal(1)), literal(0))));
    SinkNodeOptions sink = new SinkNodeOptions();
    ExecNodes.make(ExecNodes.SINK, plan, ImmutableList.of(filter), sink);
    assertFailsAt(plan, filter, sink);
  }

  @Test
  public void testScalarFinalizeFailureErrorsTheAggregate() throws Exception {
    ExecPlan plan = ExecPlan.make();
    ExecNode source = addSource(plan);
    ExecNode aggregate = plan.addNode(new ScalarAggregateNode(plan, "broken", source, unfinishable()));
    SinkNodeOptions sink = new SinkNodeOptions();
    ExecNodes.make(ExecNodes.SINK, plan, ImmutableList.of(aggregate), sink);
    assertFailsAt(plan, aggregate, sink);
  }

  @Test
  public void testGroupedFinalizeFailureErrorsTheAggregate() throws Exception {
    ExecPlan plan = ExecPlan.make();
    ExecNode source = addSource(plan);
    ExecNode aggregate =
        plan.addNode(new GroupedAggregateNode(plan, "broken", source, unfinishable(), new int[] {1}));
    SinkNodeOptions sink = new SinkNodeOptions();
    ExecNodes.make(ExecNodes.SINK, plan, ImmutableList.of(aggregate), sink);
    assertFailsAt(plan, aggregate, sink);
  }

  @Test
  public void testFailedStartNeverProduces() throws Exception {
    final List<ExecNode.State> seenDuringStart = new ArrayList<>();
    ExecPlan plan = ExecPlan.make();
    DummyNode node =
        DummyNode.make(
            plan,
            "unstartable",
            ImmutableList.<ExecNode>of(),
            0,
            n -> {
              seenDuringStart.add(n.getState());
              throw DbException.ioError("no device");
            },
            null);
    plan.validate();
    try {
      plan.startProducing();
      fail("the plan must not start");
    } catch (DbException e) {
      assertEquals(StatusCode.IO_ERROR, e.getCode());
    }
    assertEquals(ImmutableList.of(ExecNode.State.VALIDATED), seenDuringStart);
    assertEquals(ExecNode.State.ERRORED, node.getState());
    assertEquals(StatusCode.IO_ERROR, TestUtils.awaitFailure(node.finished()).getCode());
  }

  @Test
  public void testStartedNodeIsProducing() throws Exception {
    ExecPlan plan = ExecPlan.make();
    DummyNode node = DummyNode.make(plan, "idle", ImmutableList.<ExecNode>of(), 0);
    plan.startProducing();
    assertEquals(ExecNode.State.PRODUCING, node.getState());
    assertFalse(node.finished().isDone());
    plan.stopProducing();
    TestUtils.await(plan.finished());
    assertEquals(ExecNode.State.STOPPED, node.getState());
  }
}
