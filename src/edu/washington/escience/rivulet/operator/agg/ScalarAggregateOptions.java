package edu.washington.escience.rivulet.operator.agg;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import net.jcip.annotations.Immutable;

/**
 * Null handling shared by the basic scalar aggregates.
 */
@Immutable
public final class ScalarAggregateOptions extends FunctionOptions {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** If true, nulls are ignored; otherwise a null makes the result null (or Kleene, for any/all). */
  @JsonProperty private final boolean skipNulls;

  /** Fewer non-null values than this make the result null. */
  @JsonProperty private final int minCount;

  /**
   * @param skipNulls whether to ignore nulls.
   * @param minCount minimum number of non-null values for a non-null result.
   */
  @JsonCreator
  public ScalarAggregateOptions(
      @JsonProperty("skipNulls") final boolean skipNulls, @JsonProperty("minCount") final int minCount) {
    Preconditions.checkArgument(minCount >= 0, "minCount must be non-negative");
    this.skipNulls = skipNulls;
    this.minCount = minCount;
  }

  /**
   * @return skip nulls, min count 1.
   */
  public static ScalarAggregateOptions defaults() {
    return new ScalarAggregateOptions(true, 1);
  }

  /**
   * @return whether nulls are ignored.
   */
  public boolean getSkipNulls() {
    return skipNulls;
  }

  /**
   * @return the minimum number of non-null values for a non-null result.
   */
  public int getMinCount() {
    return minCount;
  }

  @Override
  public boolean equals(final Object o) {
    if (!(o instanceof ScalarAggregateOptions)) {
      return false;
    }
    ScalarAggregateOptions other = (ScalarAggregateOptions) o;
    return skipNulls == other.skipNulls && minCount == other.minCount;
  }

  @Override
  public int hashCode() {
    return Objects.hash(skipNulls, minCount);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("skipNulls", skipNulls).add("minCount", minCount).toString();
  }
}
