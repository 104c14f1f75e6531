package edu.washington.escience.rivulet.operator;

import java.util.List;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.operator.agg.Aggregate;
import edu.washington.escience.rivulet.operator.agg.AggregateFunctions;
import edu.washington.escience.rivulet.operator.agg.AggregatorFactory;

/**
 * The aggregates of an aggregation node resolved against its input schema.
 */
final class BoundAggregates {

  /** The input column of each aggregate. */
  private final int[] targetIndices;

  /** The kernel factory of each aggregate. */
  private final ImmutableList<AggregatorFactory> factories;

  /** The names and output types of the aggregates. */
  private final Schema schema;

  /**
   * @param targetIndices the input column of each aggregate.
   * @param factories the kernel factory of each aggregate.
   * @param schema the names and output types of the aggregates.
   */
  private BoundAggregates(
      final int[] targetIndices, final ImmutableList<AggregatorFactory> factories, final Schema schema) {
    this.targetIndices = targetIndices;
    this.factories = factories;
    this.schema = schema;
  }

  /**
   * Resolve every aggregate's function, target column and output type.
   *
   * @param inputSchema the schema of the aggregated batches.
   * @param options the aggregates.
   * @param grouped whether the functions must be the grouped ({@code hash_}) forms.
   * @return the resolved aggregates.
   * @throws DbException INVALID if a function or target column is unknown or the function has the wrong form,
   *           NOT_IMPLEMENTED if a function does not support its target's type.
   */
  static BoundAggregates bind(final Schema inputSchema, final AggregateNodeOptions options, final boolean grouped)
      throws DbException {
    final List<Aggregate> aggregates = options.getAggregates();
    final int[] targetIndices = new int[aggregates.size()];
    final ImmutableList.Builder<AggregatorFactory> factories = ImmutableList.builder();
    final ImmutableList.Builder<Type> types = ImmutableList.builder();
    for (int i = 0; i < aggregates.size(); ++i) {
      final Aggregate aggregate = aggregates.get(i);
      final boolean isGroupedName = aggregate.getFunction().startsWith(AggregateFunctions.GROUPED_PREFIX);
      if (grouped != isGroupedName) {
        throw DbException.invalid(
            "%s aggregation cannot use function %s",
            grouped ? "Grouped" : "Scalar",
            aggregate.getFunction());
      }
      targetIndices[i] = inputSchema.getColumnIndex(options.getTargets().get(i));
      final AggregatorFactory factory =
          AggregateFunctions.get(aggregate.getFunction())
              .getFactory(inputSchema.getColumnType(targetIndices[i]), aggregate.getOptions());
      factories.add(factory);
      types.add(factory.getOutputType());
    }
    return new BoundAggregates(targetIndices, factories.build(), Schema.of(types.build(), options.getNames()));
  }

  /**
   * Bind kernels that do not come from the function registry.
   *
   * @param targetIndices the input column of each aggregate.
   * @param factories the kernel factory of each aggregate.
   * @param names the output name of each aggregate.
   * @return the bound aggregates.
   */
  static BoundAggregates of(
      final int[] targetIndices, final List<AggregatorFactory> factories, final List<String> names) {
    final ImmutableList.Builder<Type> types = ImmutableList.builder();
    for (AggregatorFactory factory : factories) {
      types.add(factory.getOutputType());
    }
    return new BoundAggregates(
        targetIndices.clone(), ImmutableList.copyOf(factories), Schema.of(types.build(), names));
  }

  /**
   * @return the number of aggregates.
   */
  int size() {
    return targetIndices.length;
  }

  /**
   * @param i an aggregate.
   * @return the input column it aggregates.
   */
  int getTargetIndex(final int i) {
    return targetIndices[i];
  }

  /**
   * @param i an aggregate.
   * @return its kernel factory.
   */
  AggregatorFactory getFactory(final int i) {
    return factories.get(i);
  }

  /**
   * @return the names and output types of the aggregates.
   */
  Schema getSchema() {
    return schema;
  }
}
