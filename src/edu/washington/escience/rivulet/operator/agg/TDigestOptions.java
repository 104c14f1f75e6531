package edu.washington.escience.rivulet.operator.agg;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import net.jcip.annotations.Immutable;

/**
 * Options of the approximate quantile kernel.
 */
@Immutable
public final class TDigestOptions extends FunctionOptions {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The quantile to compute, in [0, 1]. */
  @JsonProperty private final double q;

  /** Compression parameter of the digest. */
  @JsonProperty private final int delta;

  /** Size of the digest's input buffer. */
  @JsonProperty private final int bufferSize;

  /**
   * @param q the quantile to compute, in [0, 1].
   * @param delta compression parameter of the digest.
   * @param bufferSize size of the digest's input buffer.
   */
  @JsonCreator
  public TDigestOptions(
      @JsonProperty("q") final double q,
      @JsonProperty("delta") final int delta,
      @JsonProperty("bufferSize") final int bufferSize) {
    Preconditions.checkArgument(q >= 0 && q <= 1, "q must be in [0, 1], got %s", q);
    Preconditions.checkArgument(delta > 0, "delta must be positive");
    Preconditions.checkArgument(bufferSize > 0, "bufferSize must be positive");
    this.q = q;
    this.delta = delta;
    this.bufferSize = bufferSize;
  }

  /**
   * @return the median, delta 100, buffer size 500.
   */
  public static TDigestOptions defaults() {
    return new TDigestOptions(0.5, 100, 500);
  }

  /**
   * @return the quantile to compute.
   */
  public double getQ() {
    return q;
  }

  /**
   * @return the compression parameter.
   */
  public int getDelta() {
    return delta;
  }

  /**
   * @return the input buffer size.
   */
  public int getBufferSize() {
    return bufferSize;
  }

  @Override
  public boolean equals(final Object o) {
    if (!(o instanceof TDigestOptions)) {
      return false;
    }
    TDigestOptions other = (TDigestOptions) o;
    return q == other.q && delta == other.delta && bufferSize == other.bufferSize;
  }

  @Override
  public int hashCode() {
    return Objects.hash(q, delta, bufferSize);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("q", q)
        .add("delta", delta)
        .add("bufferSize", bufferSize)
        .toString();
  }
}
