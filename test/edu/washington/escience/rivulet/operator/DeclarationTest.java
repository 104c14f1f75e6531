package edu.washington.escience.rivulet.operator;

import static edu.washington.escience.rivulet.expression.Expressions.field;
import static edu.washington.escience.rivulet.expression.Expressions.greater;
import static edu.washington.escience.rivulet.expression.Expressions.literal;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.StatusCode;
import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.generator.BatchGenerators;
import edu.washington.escience.rivulet.operator.agg.Aggregate;
import edu.washington.escience.rivulet.operator.agg.VarianceOptions;
import edu.washington.escience.rivulet.storage.TupleBatch;
import edu.washington.escience.rivulet.util.JsonMapperProvider;

public class DeclarationTest {

  private static final Schema SCHEMA = Schema.ofFields("x", Type.INT_TYPE, "k", Type.STRING_TYPE);

  private static Declaration source() {
    return new Declaration(
        ExecNodes.SOURCE,
        new SourceNodeOptions(SCHEMA, BatchGenerators.fromIterable(ImmutableList.<TupleBatch>of())));
  }

  @Test
  public void testSequenceChainsInputs() throws DbException {
    ExecPlan plan = ExecPlan.make();
    SinkNodeOptions sink = new SinkNodeOptions();
    Declaration last =
        Declaration.sequence(
            source(),
            new Declaration(ExecNodes.FILTER, new FilterNodeOptions(greater(field("x"), literal(0)))),
            new Declaration(ExecNodes.SINK, ImmutableList.<Declaration>of(), sink, "out"));
    assertEquals(ExecNodes.SINK, last.getFactoryName());
    assertEquals(1, last.getInputs().size());
    assertEquals(ExecNodes.FILTER, last.getInputs().get(0).getFactoryName());

    ExecNode node = last.addToPlan(plan);
    assertEquals("out", node.getLabel());
    assertEquals(3, plan.getNodes().size());
    assertEquals(ExecNodes.SOURCE, plan.getSources().get(0).getKindName());
    assertEquals(ImmutableList.of(node), plan.getSinks());
    assertEquals(ExecNodes.FILTER, node.getInputs().get(0).getKindName());
    plan.validate();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOnlyFirstDeclarationMayHaveInputs() {
    Declaration.sequence(
        source(),
        new Declaration(ExecNodes.SINK, ImmutableList.of(source()), new SinkNodeOptions(), null));
  }

  @Test
  public void testUnknownFactory() {
    try {
      new Declaration("join", new FilterNodeOptions(literal(true))).addToPlan(ExecPlan.make());
      fail("there is no join factory");
    } catch (DbException e) {
      assertEquals(StatusCode.INVALID, e.getCode());
      assertTrue(e.getMessage(), e.getMessage().contains("join"));
    }
  }

  @Test
  public void testMismatchedOptions() {
    try {
      Declaration.sequence(source(), new Declaration(ExecNodes.PROJECT, new FilterNodeOptions(literal(true))))
          .addToPlan(ExecPlan.make());
      fail("a project node needs project options");
    } catch (DbException e) {
      assertEquals(StatusCode.INVALID, e.getCode());
    }
  }

  @Test
  public void testWrongNumberOfInputs() {
    try {
      new Declaration(ExecNodes.SINK, new SinkNodeOptions()).addToPlan(ExecPlan.make());
      fail("a sink needs an input");
    } catch (DbException e) {
      assertEquals(StatusCode.INVALID, e.getCode());
    }
  }

  @Test
  public void testUnknownTargetColumn() {
    try {
      Declaration.sequence(
              source(),
              new Declaration(
                  ExecNodes.AGGREGATE,
                  new AggregateNodeOptions(
                      ImmutableList.of(new Aggregate("sum")), ImmutableList.of("y"), ImmutableList.of("sum(y)"))))
          .addToPlan(ExecPlan.make());
      fail("y is not a column");
    } catch (DbException e) {
      assertEquals(StatusCode.INVALID, e.getCode());
    }
  }

  @Test
  public void testUnsupportedAggregateType() {
    try {
      Declaration.sequence(
              source(),
              new Declaration(
                  ExecNodes.AGGREGATE,
                  new AggregateNodeOptions(
                      ImmutableList.of(new Aggregate("hash_mean")),
                      ImmutableList.of("k"),
                      ImmutableList.of("mean(k)"),
                      ImmutableList.of("x"))))
          .addToPlan(ExecPlan.make());
      fail("strings have no mean");
    } catch (DbException e) {
      assertEquals(StatusCode.NOT_IMPLEMENTED, e.getCode());
    }
  }

  @Test
  public void testOptionsFromJson() throws Exception {
    String json =
        "{\"type\": \"aggregate\","
            + " \"aggregates\": [{\"function\": \"hash_variance\","
            + " \"options\": {\"type\": \"Variance\", \"ddof\": 1}}],"
            + " \"targets\": [\"x\"], \"names\": [\"var(x)\"], \"keys\": [\"k\"]}";
    ExecNodeOptions options = JsonMapperProvider.getMapper().readValue(json, ExecNodeOptions.class);
    assertTrue(options instanceof AggregateNodeOptions);
    AggregateNodeOptions aggregate = (AggregateNodeOptions) options;
    assertEquals(new Aggregate("hash_variance", new VarianceOptions(1)), aggregate.getAggregates().get(0));
    assertEquals(ImmutableList.of("k"), aggregate.getKeys());

    ExecPlan plan = ExecPlan.make();
    ExecNode node = Declaration.sequence(source(), new Declaration(ExecNodes.AGGREGATE, options)).addToPlan(plan);
    assertEquals(Schema.ofFields("var(x)", Type.DOUBLE_TYPE, "k", Type.STRING_TYPE), node.getOutputSchema());
  }

  @Test
  public void testFilterOptionsRoundTrip() throws Exception {
    FilterNodeOptions options = new FilterNodeOptions(greater(field("x"), literal(3)));
    String json = JsonMapperProvider.getWriter().writeValueAsString(options);
    ExecNodeOptions read = JsonMapperProvider.getMapper().readValue(json, ExecNodeOptions.class);
    assertTrue(read instanceof FilterNodeOptions);
    assertEquals(options.getPredicate().toString(), ((FilterNodeOptions) read).getPredicate().toString());
  }
}
