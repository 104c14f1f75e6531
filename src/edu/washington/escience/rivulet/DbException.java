package edu.washington.escience.rivulet;

import java.util.Objects;

/** Generic database exception class. Every failure carries the {@link StatusCode} that tags its kind. */
public class DbException extends Exception {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /** The kind of this failure. */
  private final StatusCode code;

  /**
   * Standard String constructor.
   *
   * @param code the kind of this failure.
   * @param s a String describing the exception.
   */
  public DbException(final StatusCode code, final String s) {
    super(s);
    this.code = Objects.requireNonNull(code, "code");
  }

  /**
   * @param code the kind of this failure.
   * @param s a String describing the exception.
   * @param cause the underlying cause.
   */
  public DbException(final StatusCode code, final String s, final Throwable cause) {
    super(s, cause);
    this.code = Objects.requireNonNull(code, "code");
  }

  /**
   * Standard Throwable constructor. A wrapped {@link DbException} keeps its kind, anything else becomes an
   * {@link StatusCode#EXECUTION_ERROR}.
   *
   * @param e a different Throwable to be wrapped in a DbException.
   */
  public DbException(final Throwable e) {
    super(e.getMessage(), e);
    if (e instanceof DbException) {
      code = ((DbException) e).getCode();
    } else {
      code = StatusCode.EXECUTION_ERROR;
    }
  }

  /**
   * @return the kind of this failure.
   */
  public StatusCode getCode() {
    return code;
  }

  /**
   * @param format a {@link String#format} pattern.
   * @param args the pattern arguments.
   * @return an {@link StatusCode#INVALID} exception.
   */
  public static DbException invalid(final String format, final Object... args) {
    return new DbException(StatusCode.INVALID, String.format(format, args));
  }

  /**
   * @param format a {@link String#format} pattern.
   * @param args the pattern arguments.
   * @return a {@link StatusCode#NOT_IMPLEMENTED} exception.
   */
  public static DbException notImplemented(final String format, final Object... args) {
    return new DbException(StatusCode.NOT_IMPLEMENTED, String.format(format, args));
  }

  /**
   * @param format a {@link String#format} pattern.
   * @param args the pattern arguments.
   * @return an {@link StatusCode#IO_ERROR} exception.
   */
  public static DbException ioError(final String format, final Object... args) {
    return new DbException(StatusCode.IO_ERROR, String.format(format, args));
  }

  /**
   * @param format a {@link String#format} pattern.
   * @param args the pattern arguments.
   * @return an {@link StatusCode#EXECUTION_ERROR} exception.
   */
  public static DbException executionError(final String format, final Object... args) {
    return new DbException(StatusCode.EXECUTION_ERROR, String.format(format, args));
  }

  /**
   * Convert any throwable seen on an asynchronous path into a {@link DbException}.
   *
   * @param t the throwable.
   * @return {@code t} itself if it already is a {@link DbException}, otherwise a wrapper.
   */
  public static DbException wrap(final Throwable t) {
    if (t instanceof DbException) {
      return (DbException) t;
    }
    return new DbException(t);
  }

  @Override
  public String toString() {
    return code + ": " + getMessage();
  }
}
