package edu.washington.escience.rivulet.operator.agg;

import com.google.common.collect.ImmutableMap;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Type;

/**
 * The registry of aggregate functions. A name may carry the {@code hash_} prefix of its grouped form; both forms share
 * one kernel.
 */
public final class AggregateFunctions {

  /** Prefix of the grouped form of a function name. */
  public static final String GROUPED_PREFIX = "hash_";

  /** The functions by name. */
  private static final ImmutableMap<String, AggregateFunction> FUNCTIONS = buildRegistry();

  /** Utility class cannot be instantiated. */
  private AggregateFunctions() {}

  /**
   * @param name the function name, with or without the {@code hash_} prefix.
   * @return the function.
   * @throws DbException INVALID if no such function exists.
   */
  public static AggregateFunction get(final String name) throws DbException {
    final String baseName = name.startsWith(GROUPED_PREFIX) ? name.substring(GROUPED_PREFIX.length()) : name;
    AggregateFunction function = FUNCTIONS.get(baseName);
    if (function == null) {
      throw DbException.invalid("No aggregate function registered with name: %s", name);
    }
    return function;
  }

  /**
   * @return the names of all registered functions, without prefix.
   */
  public static Iterable<String> getFunctionNames() {
    return FUNCTIONS.keySet();
  }

  /**
   * @return the registry.
   */
  private static ImmutableMap<String, AggregateFunction> buildRegistry() {
    final ScalarAggregateOptions scalarDefaults = ScalarAggregateOptions.defaults();
    final ImmutableMap.Builder<String, AggregateFunction> functions = ImmutableMap.builder();
    add(
        functions,
        new AggregateFunction(
            "count",
            "Count the non-null values, or the nulls if nulls are not skipped",
            scalarDefaults,
            (type, options) -> () -> new CountAggregator((ScalarAggregateOptions) options)));
    add(
        functions,
        new AggregateFunction(
            "sum",
            "Compute the sum of a numeric column",
            scalarDefaults,
            (type, options) -> {
              requireNumeric("sum", type);
              return () -> new SumAggregator(type, (ScalarAggregateOptions) options);
            }));
    add(
        functions,
        new AggregateFunction(
            "product",
            "Compute the product of a numeric column",
            scalarDefaults,
            (type, options) -> {
              requireNumeric("product", type);
              return () -> new ProductAggregator(type, (ScalarAggregateOptions) options);
            }));
    add(
        functions,
        new AggregateFunction(
            "mean",
            "Compute the mean of a numeric column",
            scalarDefaults,
            (type, options) -> {
              requireNumeric("mean", type);
              return () -> new MeanAggregator(type, (ScalarAggregateOptions) options);
            }));
    add(
        functions,
        new AggregateFunction(
            "min",
            "Compute the minimum value of a column",
            scalarDefaults,
            (type, options) -> () -> new MinMaxAggregator(type, true, (ScalarAggregateOptions) options)));
    add(
        functions,
        new AggregateFunction(
            "max",
            "Compute the maximum value of a column",
            scalarDefaults,
            (type, options) -> () -> new MinMaxAggregator(type, false, (ScalarAggregateOptions) options)));
    add(
        functions,
        new AggregateFunction(
            "any",
            "Test whether any element of a boolean column is true",
            scalarDefaults,
            (type, options) -> {
              requireBoolean("any", type);
              return () -> new BooleanAggregator(true, (ScalarAggregateOptions) options);
            }));
    add(
        functions,
        new AggregateFunction(
            "all",
            "Test whether all elements of a boolean column are true",
            scalarDefaults,
            (type, options) -> {
              requireBoolean("all", type);
              return () -> new BooleanAggregator(false, (ScalarAggregateOptions) options);
            }));
    add(
        functions,
        new AggregateFunction(
            "variance",
            "Calculate the variance of a numeric column; null if there are no more than ddof values",
            VarianceOptions.defaults(),
            (type, options) -> {
              requireNumeric("variance", type);
              return () -> new VarStdAggregator(type, false, (VarianceOptions) options);
            }));
    add(
        functions,
        new AggregateFunction(
            "stddev",
            "Calculate the standard deviation of a numeric column; null if there are no more than ddof values",
            VarianceOptions.defaults(),
            (type, options) -> {
              requireNumeric("stddev", type);
              return () -> new VarStdAggregator(type, true, (VarianceOptions) options);
            }));
    add(
        functions,
        new AggregateFunction(
            "tdigest",
            "Approximate a quantile of a numeric column with a t-digest",
            TDigestOptions.defaults(),
            (type, options) -> {
              requireNumeric("tdigest", type);
              return () -> new TDigestAggregator((TDigestOptions) options);
            }));
    return functions.build();
  }

  /**
   * @param functions the registry under construction.
   * @param function the function to add.
   */
  private static void add(
      final ImmutableMap.Builder<String, AggregateFunction> functions, final AggregateFunction function) {
    functions.put(function.getName(), function);
  }

  /**
   * @param name the function name.
   * @param type the input type.
   * @throws DbException NOT_IMPLEMENTED if the type is not numeric.
   */
  private static void requireNumeric(final String name, final Type type) throws DbException {
    if (!type.isNumeric()) {
      throw DbException.notImplemented("No %s implemented for type %s", name, type);
    }
  }

  /**
   * @param name the function name.
   * @param type the input type.
   * @throws DbException NOT_IMPLEMENTED if the type is not boolean.
   */
  private static void requireBoolean(final String name, final Type type) throws DbException {
    if (type != Type.BOOLEAN_TYPE) {
      throw DbException.notImplemented("No %s implemented for type %s", name, type);
    }
  }
}
