package edu.washington.escience.rivulet.operator;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.rivulet.DbException;

/**
 * Builds {@link ExecNode}s by factory name. The known factories are {@value #SOURCE}, {@value #FILTER},
 * {@value #PROJECT}, {@value #AGGREGATE} and {@value #SINK}; an aggregation with keys is grouped, one without is
 * scalar.
 */
public final class ExecNodes {

  /** Factory name of {@link SourceNode}. */
  public static final String SOURCE = "source";
  /** Factory name of {@link FilterNode}. */
  public static final String FILTER = "filter";
  /** Factory name of {@link ProjectNode}. */
  public static final String PROJECT = "project";
  /** Factory name of {@link ScalarAggregateNode} and {@link GroupedAggregateNode}. */
  public static final String AGGREGATE = "aggregate";
  /** Factory name of {@link SinkNode}. */
  public static final String SINK = "sink";

  /** The known factory names. */
  private static final ImmutableList<String> FACTORY_NAMES = ImmutableList.of(SOURCE, FILTER, PROJECT, AGGREGATE, SINK);

  /** Utility classes do not have a public constructor. */
  private ExecNodes() {}

  /**
   * Build a node and add it to a plan.
   *
   * @param factoryName the kind of node.
   * @param plan the plan.
   * @param inputs the inputs, already in the plan.
   * @param options the options of that kind of node.
   * @param label the label, or null to let the plan pick one.
   * @return the node.
   * @throws DbException INVALID if the factory is unknown, the options do not match it, or the node cannot be built
   *           on its inputs.
   */
  public static ExecNode make(
      final String factoryName,
      final ExecPlan plan,
      final List<ExecNode> inputs,
      final ExecNodeOptions options,
      @Nullable final String label)
      throws DbException {
    switch (factoryName) {
      case SOURCE:
        checkInputCount(SOURCE, inputs, 0);
        return SourceNode.make(plan, label, checkOptions(SOURCE, options, SourceNodeOptions.class));
      case FILTER:
        return FilterNode.make(plan, label, inputs, checkOptions(FILTER, options, FilterNodeOptions.class));
      case PROJECT:
        return ProjectNode.make(plan, label, inputs, checkOptions(PROJECT, options, ProjectNodeOptions.class));
      case AGGREGATE:
        AggregateNodeOptions aggregateOptions = checkOptions(AGGREGATE, options, AggregateNodeOptions.class);
        if (aggregateOptions.getKeys().isEmpty()) {
          return ScalarAggregateNode.make(plan, label, inputs, aggregateOptions);
        }
        return GroupedAggregateNode.make(plan, label, inputs, aggregateOptions);
      case SINK:
        return SinkNode.make(plan, label, inputs, checkOptions(SINK, options, SinkNodeOptions.class));
      default:
        throw DbException.invalid(
            "No factory registered with name %s, known factories are %s", factoryName, FACTORY_NAMES);
    }
  }

  /**
   * @param factoryName the kind of node.
   * @param plan the plan.
   * @param inputs the inputs, already in the plan.
   * @param options the options of that kind of node.
   * @return the node, labelled by the plan.
   * @throws DbException see {@link #make(String, ExecPlan, List, ExecNodeOptions, String)}.
   */
  public static ExecNode make(
      final String factoryName, final ExecPlan plan, final List<ExecNode> inputs, final ExecNodeOptions options)
      throws DbException {
    return make(factoryName, plan, inputs, options, null);
  }

  /**
   * @return the known factory names.
   */
  public static ImmutableList<String> getFactoryNames() {
    return FACTORY_NAMES;
  }

  /**
   * @param factoryName the kind of node.
   * @param inputs the inputs.
   * @param expected the number of inputs that kind of node takes.
   * @throws DbException INVALID if the number of inputs differs.
   */
  static void checkInputCount(final String factoryName, final List<ExecNode> inputs, final int expected)
      throws DbException {
    if (inputs.size() != expected) {
      throw DbException.invalid("%s node takes %d inputs, got %d", factoryName, expected, inputs.size());
    }
  }

  /**
   * @param factoryName the kind of node.
   * @param options the options given.
   * @param optionsClass the options class of that kind of node.
   * @param <T> the options class.
   * @return the options, cast.
   * @throws DbException INVALID if the options are of another class.
   */
  private static <T extends ExecNodeOptions> T checkOptions(
      final String factoryName, final ExecNodeOptions options, final Class<T> optionsClass) throws DbException {
    if (!optionsClass.isInstance(options)) {
      throw DbException.invalid(
          "%s node needs %s, got %s",
          factoryName,
          optionsClass.getSimpleName(),
          options == null ? null : options.getClass().getSimpleName());
    }
    return optionsClass.cast(options);
  }
}
