package edu.washington.escience.rivulet.operator;

import java.util.Objects;

import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.generator.BatchGenerator;

/**
 * Options of a {@link SourceNode}: the schema of the produced batches and the generator they are pulled from.
 */
public final class SourceNodeOptions extends ExecNodeOptions {

  /** The schema of the produced batches. */
  private final Schema schema;

  /** The generator pulled for batches. */
  private final BatchGenerator generator;

  /**
   * @param schema the schema of the produced batches.
   * @param generator the generator pulled for batches.
   */
  public SourceNodeOptions(final Schema schema, final BatchGenerator generator) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.generator = Objects.requireNonNull(generator, "generator");
  }

  /**
   * @return the schema of the produced batches.
   */
  public Schema getSchema() {
    return schema;
  }

  /**
   * @return the generator pulled for batches.
   */
  public BatchGenerator getGenerator() {
    return generator;
  }
}
