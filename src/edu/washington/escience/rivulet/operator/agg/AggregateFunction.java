package edu.washington.escience.rivulet.operator.agg;

import java.util.Objects;
import java.util.function.Supplier;

import javax.annotation.Nullable;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Type;

import net.jcip.annotations.Immutable;

/**
 * A named aggregate function: documentation, default options, and a way to bind the function to an input type.
 */
@Immutable
public final class AggregateFunction {

  /**
   * Binds a function to an input type and options.
   */
  @FunctionalInterface
  interface Binder {
    /**
     * @param inputType the input type.
     * @param options the options, of the function's options class.
     * @return a supplier of fresh kernel states.
     * @throws DbException NOT_IMPLEMENTED if the input type is unsupported.
     */
    Supplier<Aggregator> bind(Type inputType, FunctionOptions options) throws DbException;
  }

  /** The name. */
  private final String name;
  /** One-line documentation. */
  private final String doc;
  /** The options used when a caller supplies none. */
  private final FunctionOptions defaultOptions;
  /** Binds the kernel. */
  private final Binder binder;

  /**
   * @param name the name.
   * @param doc one-line documentation.
   * @param defaultOptions the options used when a caller supplies none.
   * @param binder binds the kernel.
   */
  AggregateFunction(
      final String name, final String doc, final FunctionOptions defaultOptions, final Binder binder) {
    this.name = Objects.requireNonNull(name, "name");
    this.doc = Objects.requireNonNull(doc, "doc");
    this.defaultOptions = Objects.requireNonNull(defaultOptions, "defaultOptions");
    this.binder = Objects.requireNonNull(binder, "binder");
  }

  /**
   * @return the name.
   */
  public String getName() {
    return name;
  }

  /**
   * @return one-line documentation.
   */
  public String getDoc() {
    return doc;
  }

  /**
   * @return the options used when a caller supplies none.
   */
  public FunctionOptions getDefaultOptions() {
    return defaultOptions;
  }

  /**
   * Bind this function to an input type.
   *
   * @param inputType the type of the aggregated column.
   * @param options the options, or null for the defaults.
   * @return a factory of fresh kernel states.
   * @throws DbException INVALID if the options are of the wrong class, NOT_IMPLEMENTED if the input type is
   *           unsupported.
   */
  public AggregatorFactory getFactory(final Type inputType, @Nullable final FunctionOptions options)
      throws DbException {
    final FunctionOptions opts = options == null ? defaultOptions : options;
    if (!defaultOptions.getClass().isInstance(opts)) {
      throw DbException.invalid(
          "%s expects %s, got %s",
          name,
          defaultOptions.getClass().getSimpleName(),
          opts.getClass().getSimpleName());
    }
    final Supplier<Aggregator> supplier = binder.bind(inputType, opts);
    final Type outputType = supplier.get().getOutputType();
    return new AggregatorFactory() {
      @Override
      public Aggregator get() {
        return supplier.get();
      }

      @Override
      public Type getOutputType() {
        return outputType;
      }
    };
  }

  @Override
  public String toString() {
    return name;
  }
}
