package edu.washington.escience.rivulet.operator.agg;

import java.io.Serializable;
import java.util.Objects;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import net.jcip.annotations.Immutable;

/**
 * One requested aggregate: a function name and its options (null for the function's defaults).
 */
@Immutable
public final class Aggregate implements Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The function name, e.g. {@code hash_sum}. */
  @JsonProperty private final String function;

  /** The options, or null. */
  @JsonProperty @Nullable private final FunctionOptions options;

  /**
   * @param function the function name.
   * @param options the options, or null for the defaults.
   */
  @JsonCreator
  public Aggregate(
      @JsonProperty("function") final String function,
      @JsonProperty("options") @Nullable final FunctionOptions options) {
    this.function = Objects.requireNonNull(function, "function");
    this.options = options;
  }

  /**
   * @param function the function name.
   */
  public Aggregate(final String function) {
    this(function, null);
  }

  /**
   * @return the function name.
   */
  public String getFunction() {
    return function;
  }

  /**
   * @return the options, or null for the defaults.
   */
  @Nullable
  public FunctionOptions getOptions() {
    return options;
  }

  @Override
  public boolean equals(final Object o) {
    if (!(o instanceof Aggregate)) {
      return false;
    }
    Aggregate other = (Aggregate) o;
    return function.equals(other.function) && Objects.equals(options, other.options);
  }

  @Override
  public int hashCode() {
    return Objects.hash(function, options);
  }

  @Override
  public String toString() {
    return options == null ? function : function + options;
  }
}
