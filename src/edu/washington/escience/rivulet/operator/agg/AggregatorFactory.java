package edu.washington.escience.rivulet.operator.agg;

import javax.annotation.Nonnull;

import edu.washington.escience.rivulet.Type;

/**
 * Creates instances of the {@link Aggregator} class for one function bound to one input type and one set of options.
 */
public interface AggregatorFactory {

  /**
   * @return a fresh, empty aggregate state.
   */
  @Nonnull
  Aggregator get();

  /**
   * @return the type of the finalized value.
   */
  Type getOutputType();
}
