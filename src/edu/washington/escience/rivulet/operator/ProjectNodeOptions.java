package edu.washington.escience.rivulet.operator;

import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.washington.escience.rivulet.expression.ExpressionOperator;

/**
 * Options of a {@link ProjectNode}: one expression per output column and, optionally, the column names. Missing names
 * default to the text of the expression.
 */
public final class ProjectNodeOptions extends ExecNodeOptions {

  /** The expressions. */
  @JsonProperty private final ImmutableList<ExpressionOperator> expressions;

  /** The names of the output columns, empty to use the expressions' text. */
  @JsonProperty private final ImmutableList<String> names;

  /**
   * @param expressions one expression per output column.
   * @param names the output column names, or null to use the expressions' text.
   */
  @JsonCreator
  public ProjectNodeOptions(
      @JsonProperty(value = "expressions", required = true) final List<ExpressionOperator> expressions,
      @JsonProperty("names") @Nullable final List<String> names) {
    this.expressions = ImmutableList.copyOf(Objects.requireNonNull(expressions, "expressions"));
    this.names = names == null ? ImmutableList.<String>of() : ImmutableList.copyOf(names);
    Preconditions.checkArgument(
        this.names.isEmpty() || this.names.size() == this.expressions.size(),
        "got %s names for %s expressions",
        this.names.size(),
        this.expressions.size());
  }

  /**
   * @param expressions one expression per output column, named by their text.
   */
  public ProjectNodeOptions(final List<ExpressionOperator> expressions) {
    this(expressions, null);
  }

  /**
   * @return the expressions.
   */
  public ImmutableList<ExpressionOperator> getExpressions() {
    return expressions;
  }

  /**
   * @return the output column names, one per expression.
   */
  public ImmutableList<String> getNames() {
    if (!names.isEmpty()) {
      return names;
    }
    ImmutableList.Builder<String> ret = ImmutableList.builder();
    for (ExpressionOperator expression : expressions) {
      ret.add(expression.toString());
    }
    return ret.build();
  }
}
