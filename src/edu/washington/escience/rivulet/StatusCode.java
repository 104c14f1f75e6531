package edu.washington.escience.rivulet;

/**
 * The kind of a failure reported through a {@link DbException}.
 */
public enum StatusCode {
  /** A malformed plan or argument: unbound output, empty graph, double start, bad options. */
  INVALID,
  /** The requested operation is not available, e.g. an aggregate over an unsupported input type. */
  NOT_IMPLEMENTED,
  /** A failure reading or writing external data, usually raised by a user-supplied source. */
  IO_ERROR,
  /** A failure raised while producing batches, e.g. an arithmetic overflow. */
  EXECUTION_ERROR,
  /** A clean shutdown. Not a true error. */
  CANCELLED;
}
