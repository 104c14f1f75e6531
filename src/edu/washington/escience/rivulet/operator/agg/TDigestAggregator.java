package edu.washington.escience.rivulet.operator.agg;

import com.tdunning.math.stats.MergingDigest;
import com.tdunning.math.stats.TDigest;

import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;

/**
 * Approximate quantile of a numeric column, kept in a t-digest. Nulls are skipped.
 */
final class TDigestAggregator implements Aggregator {

  /** The quantile to report. */
  private final double q;

  /** The digest. */
  private final TDigest digest;

  /**
   * @param options the options.
   */
  TDigestAggregator(final TDigestOptions options) {
    q = options.getQ();
    digest = new MergingDigest(options.getDelta(), options.getBufferSize());
  }

  @Override
  public void consume(final Column<?> input) {
    if (input.isConstant()) {
      if (input.size() > 0 && !input.isNull(0)) {
        digest.add(input.getNumericAsDouble(0), input.size());
      }
      return;
    }
    for (int row = 0; row < input.size(); ++row) {
      if (!input.isNull(row)) {
        digest.add(input.getNumericAsDouble(row));
      }
    }
  }

  @Override
  public void mergeFrom(final Aggregator other) {
    TDigest otherDigest = AggUtils.sameKernel(other, TDigestAggregator.class).digest;
    if (otherDigest.size() > 0) {
      digest.add(otherDigest);
    }
  }

  @Override
  public Object finalizeResult() {
    if (digest.size() == 0) {
      return null;
    }
    return digest.quantile(q);
  }

  @Override
  public Type getOutputType() {
    return Type.DOUBLE_TYPE;
  }
}
