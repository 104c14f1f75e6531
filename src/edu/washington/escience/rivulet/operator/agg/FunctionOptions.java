package edu.washington.escience.rivulet.operator.agg;

import java.io.Serializable;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonSubTypes.Type;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Configuration of an aggregate kernel. Each function accepts one concrete options class.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @Type(value = ScalarAggregateOptions.class, name = "ScalarAggregate"),
  @Type(value = VarianceOptions.class, name = "Variance"),
  @Type(value = TDigestOptions.class, name = "TDigest")
})
public abstract class FunctionOptions implements Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;
}
