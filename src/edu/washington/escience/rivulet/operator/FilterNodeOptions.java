package edu.washington.escience.rivulet.operator;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import edu.washington.escience.rivulet.expression.ExpressionOperator;

/**
 * Options of a {@link FilterNode}: the boolean predicate that rows must satisfy.
 */
public final class FilterNodeOptions extends ExecNodeOptions {

  /** The predicate. */
  @JsonProperty private final ExpressionOperator predicate;

  /**
   * @param predicate the boolean predicate. Rows where it is false or null are dropped.
   */
  @JsonCreator
  public FilterNodeOptions(@JsonProperty(value = "predicate", required = true) final ExpressionOperator predicate) {
    this.predicate = Objects.requireNonNull(predicate, "predicate");
  }

  /**
   * @return the predicate.
   */
  public ExpressionOperator getPredicate() {
    return predicate;
  }
}
