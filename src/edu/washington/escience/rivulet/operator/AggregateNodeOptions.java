package edu.washington.escience.rivulet.operator;

import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.washington.escience.rivulet.operator.agg.Aggregate;

/**
 * Options of an aggregation node. Without keys the node reduces its whole input to one row; with keys it produces one
 * row per distinct key, the aggregates first and the keys last.
 */
public final class AggregateNodeOptions extends ExecNodeOptions {

  /** The aggregates to compute. */
  @JsonProperty private final ImmutableList<Aggregate> aggregates;

  /** The input column aggregated by each aggregate. */
  @JsonProperty private final ImmutableList<String> targets;

  /** The output name of each aggregate. */
  @JsonProperty private final ImmutableList<String> names;

  /** The grouping columns, empty for a scalar aggregation. */
  @JsonProperty private final ImmutableList<String> keys;

  /**
   * @param aggregates the aggregates to compute.
   * @param targets the input column of each aggregate.
   * @param names the output name of each aggregate.
   * @param keys the grouping columns, null or empty for a scalar aggregation.
   */
  @JsonCreator
  public AggregateNodeOptions(
      @JsonProperty(value = "aggregates", required = true) final List<Aggregate> aggregates,
      @JsonProperty(value = "targets", required = true) final List<String> targets,
      @JsonProperty(value = "names", required = true) final List<String> names,
      @JsonProperty("keys") @Nullable final List<String> keys) {
    this.aggregates = ImmutableList.copyOf(Objects.requireNonNull(aggregates, "aggregates"));
    this.targets = ImmutableList.copyOf(Objects.requireNonNull(targets, "targets"));
    this.names = ImmutableList.copyOf(Objects.requireNonNull(names, "names"));
    this.keys = keys == null ? ImmutableList.<String>of() : ImmutableList.copyOf(keys);
    Preconditions.checkArgument(
        this.targets.size() == this.aggregates.size() && this.names.size() == this.aggregates.size(),
        "need one target and one name per aggregate, got %s aggregates, %s targets and %s names",
        this.aggregates.size(),
        this.targets.size(),
        this.names.size());
  }

  /**
   * A scalar aggregation.
   *
   * @param aggregates the aggregates to compute.
   * @param targets the input column of each aggregate.
   * @param names the output name of each aggregate.
   */
  public AggregateNodeOptions(final List<Aggregate> aggregates, final List<String> targets, final List<String> names) {
    this(aggregates, targets, names, null);
  }

  /**
   * @return the aggregates.
   */
  public ImmutableList<Aggregate> getAggregates() {
    return aggregates;
  }

  /**
   * @return the input column of each aggregate.
   */
  public ImmutableList<String> getTargets() {
    return targets;
  }

  /**
   * @return the output name of each aggregate.
   */
  public ImmutableList<String> getNames() {
    return names;
  }

  /**
   * @return the grouping columns, empty for a scalar aggregation.
   */
  public ImmutableList<String> getKeys() {
    return keys;
  }
}
