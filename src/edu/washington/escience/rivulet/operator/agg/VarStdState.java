package edu.washington.escience.rivulet.operator.agg;

import com.google.common.base.MoreObjects;

/**
 * The sufficient statistics of variance: count, mean and {@code m2}, the sum of squared deviations from the mean.
 */
final class VarStdState {
  /** Number of non-null values. */
  long count = 0;
  /** Mean of the values. */
  double mean = 0;
  /** Sum of squared deviations from {@link #mean}. */
  double m2 = 0;

  /** An empty state. */
  VarStdState() {}

  /**
   * @param count number of values.
   * @param mean their mean.
   * @param m2 sum of their squared deviations from the mean.
   */
  VarStdState(final long count, final double mean, final double m2) {
    this.count = count;
    this.mean = mean;
    this.m2 = m2;
  }

  /**
   * Combine another state into this one using the pairwise update for parallel variance.
   *
   * @param other the other state.
   */
  void mergeFrom(final VarStdState other) {
    if (other.count == 0) {
      return;
    }
    if (count == 0) {
      count = other.count;
      mean = other.mean;
      m2 = other.m2;
      return;
    }
    final long newCount = count + other.count;
    final double delta = mean - other.mean;
    final double newMean = (mean * count + other.mean * other.count) / newCount;
    m2 = m2 + other.m2 + delta * delta * count * other.count / newCount;
    mean = newMean;
    count = newCount;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("count", count).add("mean", mean).add("m2", m2).toString();
  }
}
