package edu.washington.escience.rivulet.operator.agg;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import net.jcip.annotations.Immutable;

/**
 * Options of the variance and stddev kernels.
 */
@Immutable
public final class VarianceOptions extends FunctionOptions {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** Delta degrees of freedom: the divisor is {@code count - ddof}. */
  @JsonProperty private final int ddof;

  /**
   * @param ddof delta degrees of freedom.
   */
  @JsonCreator
  public VarianceOptions(@JsonProperty("ddof") final int ddof) {
    this.ddof = ddof;
  }

  /**
   * @return population variance, ddof 0.
   */
  public static VarianceOptions defaults() {
    return new VarianceOptions(0);
  }

  /**
   * @return delta degrees of freedom.
   */
  public int getDdof() {
    return ddof;
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof VarianceOptions && ((VarianceOptions) o).ddof == ddof;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(ddof);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("ddof", ddof).toString();
  }
}
