package edu.washington.escience.rivulet.operator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.washington.escience.rivulet.DbException;

/**
 * A description of a node that is not yet in a plan: its factory name, options, optional label and the declarations of
 * its inputs. A tree of declarations is added to a plan with {@link #addToPlan(ExecPlan)}.
 */
public final class Declaration {

  /** The kind of node. */
  private final String factoryName;

  /** The options of the node. */
  private final ExecNodeOptions options;

  /** The declarations of the inputs. */
  private final ImmutableList<Declaration> inputs;

  /** The label, or null. */
  @Nullable private final String label;

  /**
   * @param factoryName the kind of node.
   * @param inputs the declarations of the inputs.
   * @param options the options of the node.
   * @param label the label, or null to let the plan pick one.
   */
  public Declaration(
      final String factoryName,
      final List<Declaration> inputs,
      final ExecNodeOptions options,
      @Nullable final String label) {
    this.factoryName = Objects.requireNonNull(factoryName, "factoryName");
    this.inputs = ImmutableList.copyOf(inputs);
    this.options = Objects.requireNonNull(options, "options");
    this.label = label;
  }

  /**
   * A declaration without inputs or label.
   *
   * @param factoryName the kind of node.
   * @param options the options of the node.
   */
  public Declaration(final String factoryName, final ExecNodeOptions options) {
    this(factoryName, ImmutableList.<Declaration>of(), options, null);
  }

  /**
   * Chain declarations so that each one is the single input of the next. Only the first may have inputs of its own.
   *
   * @param declarations the declarations, producer first.
   * @return the last declaration, fed by the chain.
   */
  public static Declaration sequence(final List<Declaration> declarations) {
    Preconditions.checkArgument(!declarations.isEmpty(), "cannot sequence no declarations");
    Declaration current = declarations.get(0);
    for (Declaration next : declarations.subList(1, declarations.size())) {
      Preconditions.checkArgument(
          next.inputs.isEmpty(), "only the first declaration of a sequence may have inputs: %s", next);
      current = new Declaration(next.factoryName, ImmutableList.of(current), next.options, next.label);
    }
    return current;
  }

  /**
   * @param declarations the declarations, producer first.
   * @return the last declaration, fed by the chain.
   * @see #sequence(List)
   */
  public static Declaration sequence(final Declaration... declarations) {
    return sequence(Arrays.asList(declarations));
  }

  /**
   * Add the declared inputs, recursively, and then the declared node to a plan.
   *
   * @param plan the plan.
   * @return the node built for this declaration.
   * @throws DbException if a node cannot be built.
   */
  public ExecNode addToPlan(final ExecPlan plan) throws DbException {
    List<ExecNode> inputNodes = new ArrayList<>(inputs.size());
    for (Declaration input : inputs) {
      inputNodes.add(input.addToPlan(plan));
    }
    return ExecNodes.make(factoryName, plan, inputNodes, options, label);
  }

  /**
   * @return the kind of node.
   */
  public String getFactoryName() {
    return factoryName;
  }

  /**
   * @return the options of the node.
   */
  public ExecNodeOptions getOptions() {
    return options;
  }

  /**
   * @return the declarations of the inputs.
   */
  public ImmutableList<Declaration> getInputs() {
    return inputs;
  }

  /**
   * @return the label, or null.
   */
  @Nullable
  public String getLabel() {
    return label;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("factory", factoryName)
        .add("label", label)
        .add("inputs", inputs.size())
        .toString();
  }
}
