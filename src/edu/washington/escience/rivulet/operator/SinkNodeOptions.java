package edu.washington.escience.rivulet.operator;

import com.google.common.base.Preconditions;

import edu.washington.escience.rivulet.generator.BatchGenerator;

/**
 * Options of a {@link SinkNode}. Once the sink is built, {@link #getGenerator()} returns the generator through which
 * the caller consumes the batches reaching the sink.
 */
public final class SinkNodeOptions extends ExecNodeOptions {

  /** Set by the sink node when it is built. */
  private volatile BatchGenerator generator = null;

  /**
   * @param generator the generator of the sink built with these options.
   */
  void setGenerator(final BatchGenerator generator) {
    Preconditions.checkState(this.generator == null, "these options were already used to build a sink");
    this.generator = generator;
  }

  /**
   * @return the generator yielding the batches that reach the sink.
   */
  public BatchGenerator getGenerator() {
    Preconditions.checkState(generator != null, "no sink has been built with these options");
    return generator;
  }
}
