package edu.washington.escience.rivulet.operator;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonSubTypes.Type;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * The parameters of one kind of {@link ExecNode}. Options that only carry values can be read from JSON; options that
 * carry live objects, such as a source's generator, cannot.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @Type(name = ExecNodes.FILTER, value = FilterNodeOptions.class),
  @Type(name = ExecNodes.PROJECT, value = ProjectNodeOptions.class),
  @Type(name = ExecNodes.AGGREGATE, value = AggregateNodeOptions.class)
})
public abstract class ExecNodeOptions {}
